package de.bsommerfeld.slideshow.pipeline.assets;

/**
 * Counts of one corpus normalization run.
 *
 * @param formats  formats with at least one well-formed example
 * @param examples well-formed (format, example) groups
 * @param slides   slides stored across all examples
 * @param issues   files recorded as normalization issues
 */
public record NormalizationResult(int formats, int examples, int slides, int issues) {
}
