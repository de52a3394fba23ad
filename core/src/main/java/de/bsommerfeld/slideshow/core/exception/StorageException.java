package de.bsommerfeld.slideshow.core.exception;

/**
 * Unchecked wrapper for failures of the underlying store. The transaction
 * that raised it has already been rolled back.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
