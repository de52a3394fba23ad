package de.bsommerfeld.slideshow.core.exception;

import java.util.List;

/**
 * Thrown when draft generation finds no format scores for the requested
 * account scope. Scoring has to run first.
 */
public class NoRankedFormatsException extends SlideshowException {

    public NoRankedFormatsException(List<String> accountScope) {
        super(accountScope == null || accountScope.isEmpty()
                ? "No ranked formats available. Run score-formats first."
                : "No ranked formats available for accounts " + accountScope + ". Run score-formats first.");
    }
}
