package de.bsommerfeld.slideshow.core.domain;

/**
 * Aggregated proxy virality statistics of one format on one account.
 * All ratio fields are averages over the matched posts of the group.
 *
 * @param formatName      scored format
 * @param accountHandle   account the statistics are drawn from
 * @param normalizedViews mean z-score of views relative to the account
 * @param sharesPer1k     mean shares per 1000 views
 * @param commentsPer1k   mean comments per 1000 views
 * @param likesPer1k      mean likes per 1000 views
 * @param proxyScore      combined score in {@code [0, 1)}
 * @param sampleSize      number of matched posts in the group
 */
public record FormatScore(
        String formatName,
        String accountHandle,
        double normalizedViews,
        double sharesPer1k,
        double commentsPer1k,
        double likesPer1k,
        double proxyScore,
        int sampleSize) {
}
