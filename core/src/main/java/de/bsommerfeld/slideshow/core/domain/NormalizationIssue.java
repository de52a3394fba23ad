package de.bsommerfeld.slideshow.core.domain;

import java.time.Instant;

/**
 * Advisory record for a corpus file that could not be grouped.
 *
 * @param formatName format directory the file was found in
 * @param filePath   path of the offending file
 * @param issueType  machine-readable issue category
 * @param detail     free-form detail, usually the file name
 * @param createdAt  time of the normalization run
 */
public record NormalizationIssue(
        String formatName,
        String filePath,
        String issueType,
        String detail,
        Instant createdAt) {

    public static final String NON_STANDARD_FILENAME = "non_standard_filename";
}
