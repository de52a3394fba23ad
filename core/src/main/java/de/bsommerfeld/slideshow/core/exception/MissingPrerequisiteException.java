package de.bsommerfeld.slideshow.core.exception;

/**
 * Thrown when a command runs before the data or files it depends on exist,
 * e.g. matching without a normalized corpus or a backfill without an
 * accounts file.
 */
public class MissingPrerequisiteException extends SlideshowException {

    public MissingPrerequisiteException(String message) {
        super(message);
    }
}
