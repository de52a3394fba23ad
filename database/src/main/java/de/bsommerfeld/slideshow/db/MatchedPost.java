package de.bsommerfeld.slideshow.db;

/**
 * A crawled post joined with the format it was matched to. Only posts whose
 * match status counts for scoring and whose format is known are returned in
 * this shape.
 */
public record MatchedPost(
        String postId,
        String accountHandle,
        String formatName,
        long views,
        long likes,
        long comments,
        long shares) {
}
