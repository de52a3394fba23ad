package de.bsommerfeld.slideshow.crawler;

/**
 * Outcome of one crawl run.
 *
 * @param accounts   account entries processed, including unresolvable ones
 * @param postsSeen  distinct post links discovered
 * @param postsSaved posts written to the store
 * @param failures   account-level plus post-level failures recorded
 */
public record CrawlSummary(int accounts, int postsSeen, int postsSaved, int failures) {
}
