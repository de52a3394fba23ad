package de.bsommerfeld.slideshow.core.domain;

import java.util.List;

/**
 * Best-guess format assignment for a crawled post. Format and example are
 * {@code null} whenever the status is {@link MatchStatus#NEEDS_REVIEW}.
 *
 * @param postId     the matched {@link CrawlPost}
 * @param formatName winning format, or {@code null}
 * @param exampleId  first example of the winning format, or {@code null}
 * @param confidence combined 0.0–1.0 similarity
 * @param status     review state
 * @param reasons    human-readable component scores
 */
public record PostFormatMatch(
        String postId,
        String formatName,
        String exampleId,
        double confidence,
        MatchStatus status,
        List<String> reasons) {

    public PostFormatMatch {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }
}
