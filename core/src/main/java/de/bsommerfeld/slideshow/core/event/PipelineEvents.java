package de.bsommerfeld.slideshow.core.event;

/**
 * Progress events posted by the pipeline stages.
 */
public final class PipelineEvents {

    private PipelineEvents() {
    }

    /** One account of a backfill has been processed. */
    public record AccountCrawledEvent(String handle, int postsFound, int postsSaved, int failures) {
    }

    /** A crawl failure row has been recorded. */
    public record CrawlFailureEvent(String handle, String url, String reason) {
    }

    /**
     * A stage finished. {@code summary} is the same object the stage returns
     * to its caller.
     */
    public record StageCompletedEvent(String stage, Object summary) {
    }
}
