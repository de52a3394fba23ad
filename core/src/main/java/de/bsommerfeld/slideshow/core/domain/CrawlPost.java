package de.bsommerfeld.slideshow.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of a single platform post as seen by the crawler. Rows are keyed
 * by {@code postId} and overwritten on every crawl that sees the post again.
 *
 * @param postId        platform-unique id (the digits of the video URL)
 * @param postUrl       canonical post URL
 * @param accountHandle owning account handle without {@code @}
 * @param postedAt      publish time, {@code null} when the page does not expose it
 * @param caption       post caption, {@code null} if none could be extracted
 * @param views         view counter
 * @param likes         like counter
 * @param comments      comment counter
 * @param shares        share counter
 * @param collectedAt   time of the crawl that produced this snapshot
 * @param source        provenance tag of the extraction path
 * @param confidence    crawler's own 0.0–1.0 estimate of metric reliability
 */
public record CrawlPost(
        String postId,
        String postUrl,
        String accountHandle,
        Instant postedAt,
        String caption,
        long views,
        long likes,
        long comments,
        long shares,
        Instant collectedAt,
        String source,
        double confidence) {

    public CrawlPost {
        Objects.requireNonNull(postId, "postId");
        Objects.requireNonNull(accountHandle, "accountHandle");
        if (views < 0 || likes < 0 || comments < 0 || shares < 0) {
            throw new IllegalArgumentException("Engagement counters must be non-negative for post " + postId);
        }
    }

    /**
     * {@code (likes + comments + 2 * shares) / views}, or 0 for posts without views.
     */
    public double engagementDensity() {
        if (views <= 0)
            return 0.0;
        return ((double) likes + comments + 2.0 * shares) / views;
    }
}
