package de.bsommerfeld.slideshow.cli;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.AccountCrawledEvent;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.CrawlFailureEvent;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.StageCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes pipeline progress to the log. Standard output is reserved for the
 * JSON result of the command.
 */
public class ProgressLogger {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressLogger.class);

    @Subscribe
    public void onAccountCrawled(AccountCrawledEvent event) {
        LOG.info("@{}: {} posts found, {} saved, {} failures", event.handle(), event.postsFound(),
                event.postsSaved(), event.failures());
    }

    @Subscribe
    public void onCrawlFailure(CrawlFailureEvent event) {
        LOG.debug("Crawl failure for @{} at {}: {}", event.handle(), event.url(), event.reason());
    }

    @Subscribe
    public void onStageCompleted(StageCompletedEvent event) {
        LOG.info("{} completed: {}", event.stage(), event.summary());
    }
}
