package de.bsommerfeld.slideshow.cli;

/**
 * Malformed command line. Reported with the usage text and exit status 2.
 */
class UsageException extends RuntimeException {

    UsageException(String message) {
        super(message);
    }
}
