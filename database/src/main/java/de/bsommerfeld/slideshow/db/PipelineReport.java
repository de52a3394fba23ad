package de.bsommerfeld.slideshow.db;

import java.util.Map;

/**
 * Row counts across the store. {@code matches} maps each stored match status
 * to its count; statuses without rows are absent.
 */
public record PipelineReport(
        long posts,
        long crawlFailures,
        long normalizationIssues,
        Map<String, Long> matches,
        long formatScores,
        long drafts,
        long exports) {

    public PipelineReport {
        matches = Map.copyOf(matches);
    }
}
