package de.bsommerfeld.slideshow.crawler;

/**
 * Engagement counters extracted from a post page together with the
 * crawler's confidence in them.
 */
public record PostMetrics(long views, long likes, long comments, long shares, double confidence) {

    static final double CONFIDENCE_NONE = 0.55;
    static final double CONFIDENCE_PARTIAL = 0.8;
    static final double CONFIDENCE_FULL = 0.9;

    /**
     * Assigns confidence from which counters were found: none, any non-zero,
     * or both views and likes.
     */
    public static PostMetrics of(long views, long likes, long comments, long shares) {
        double confidence = CONFIDENCE_NONE;
        if (views > 0 || likes > 0 || comments > 0 || shares > 0)
            confidence = CONFIDENCE_PARTIAL;
        if (views > 0 && likes > 0)
            confidence = CONFIDENCE_FULL;
        return new PostMetrics(views, likes, comments, shares, confidence);
    }
}
