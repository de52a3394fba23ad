package de.bsommerfeld.slideshow.core.domain;

/**
 * One reference instance of a format in the assets corpus.
 *
 * @param formatName name of the format directory
 * @param exampleId  example number from the file name prefix
 * @param slideCount number of distinct slides found for this example
 */
public record FormatExample(String formatName, String exampleId, int slideCount) {
}
