package de.bsommerfeld.slideshow.pipeline.drafts;

/**
 * A format with its sample-size weighted proxy score across the selected
 * accounts.
 */
public record RankedFormat(String formatName, double score) {
}
