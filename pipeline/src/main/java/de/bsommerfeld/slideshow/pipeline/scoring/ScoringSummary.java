package de.bsommerfeld.slideshow.pipeline.scoring;

/**
 * @param formatAccountScores number of (format, account) rows written
 * @param postsUsed           matched posts that contributed
 */
public record ScoringSummary(int formatAccountScores, int postsUsed) {
}
