package de.bsommerfeld.slideshow.core.domain;

import java.time.Instant;

/**
 * Diagnostic record of a post or account the crawler could not process.
 * Append-only, never read by the rest of the pipeline.
 *
 * @param accountHandle account being crawled when the failure happened
 * @param postUrl       post or profile URL, may be {@code null}
 * @param reason        human-readable cause
 * @param collectedAt   time of the crawl run
 */
public record CrawlFailure(String accountHandle, String postUrl, String reason, Instant collectedAt) {
}
