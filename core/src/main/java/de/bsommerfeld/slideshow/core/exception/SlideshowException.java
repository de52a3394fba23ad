package de.bsommerfeld.slideshow.core.exception;

/**
 * Base of all precondition failures that abort a single pipeline command.
 * Recoverable ingestion problems never surface as exceptions; they are
 * recorded as issue or failure rows instead.
 */
public class SlideshowException extends RuntimeException {

    public SlideshowException(String message) {
        super(message);
    }

    public SlideshowException(String message, Throwable cause) {
        super(message, cause);
    }
}
