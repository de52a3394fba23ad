package de.bsommerfeld.slideshow.crawler;

import com.google.inject.Singleton;
import de.bsommerfeld.slideshow.core.config.CrawlerConfig;
import de.bsommerfeld.slideshow.core.domain.CrawlFailure;
import de.bsommerfeld.slideshow.core.domain.CrawlPost;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.exception.StorageException;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.AccountCrawledEvent;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.CrawlFailureEvent;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.StageCompletedEvent;
import de.bsommerfeld.slideshow.db.DatabaseService;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Historical backfill of account timelines into {@code crawl_posts}.
 *
 * <h3>Flow per account</h3>
 *
 * <pre>
 * resolve entry      → handle + profile URL (unresolvable → failure row)
 * open profile       → collect post links, bounded scroll passes, cap applied
 * for each post link → fetch page → caption + metrics → upsert CrawlPost
 * </pre>
 *
 * <h3>Failure semantics</h3>
 * A failing post is recorded in {@code crawl_failures} and the loop moves
 * on to the next post; a failing profile is recorded and the loop moves on
 * to the next account. Only store failures escape: a
 * {@link StorageException} aborts the crawl.
 */
@Singleton
public class ProfileCrawler {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileCrawler.class);

    private final DatabaseService database;
    private final Provider<ProfileBrowser> browserProvider;
    private final CrawlerConfig config;
    private final PipelineEventBus eventBus;

    @Inject
    public ProfileCrawler(DatabaseService database, Provider<ProfileBrowser> browserProvider,
            CrawlerConfig config, PipelineEventBus eventBus) {
        this.database = database;
        this.browserProvider = browserProvider;
        this.config = config;
        this.eventBus = eventBus;
    }

    /**
     * @param accounts           handles or profile URLs in crawl order
     * @param maxPostsPerAccount per-account link cap; {@code null} or
     *                           non-positive means unbounded
     */
    public CrawlSummary crawl(List<String> accounts, Integer maxPostsPerAccount) {
        Integer cap = maxPostsPerAccount != null && maxPostsPerAccount > 0 ? maxPostsPerAccount : null;
        Instant collectedAt = Instant.now();
        int processed = 0;
        int seen = 0;
        int saved = 0;
        int failures = 0;

        LOG.info("Starting backfill of {} accounts (cap: {})", accounts.size(), cap == null ? "none" : cap);
        try (ProfileBrowser browser = browserProvider.get()) {
            for (String entry : accounts) {
                processed++;

                ResolvedAccount account;
                try {
                    account = AccountResolver.resolve(entry);
                } catch (IllegalArgumentException e) {
                    failures++;
                    recordFailure(entry == null ? "" : entry.strip(), null, e, collectedAt);
                    continue;
                }

                int accountSaved = 0;
                int accountFailures = 0;
                int accountLinks = 0;
                try {
                    List<PostLink> links = collectPostLinks(browser, account, cap);
                    accountLinks = links.size();

                    for (PostLink link : links) {
                        try {
                            CrawlPost post = crawlPost(browser, link, account, collectedAt);
                            database.upsertPost(post);
                            accountSaved++;
                        } catch (StorageException e) {
                            throw e;
                        } catch (Exception e) {
                            accountFailures++;
                            recordFailure(account.handle(), link.url(), e, collectedAt);
                        }
                    }
                } catch (StorageException e) {
                    throw e;
                } catch (Exception e) {
                    accountFailures++;
                    recordFailure(account.handle(), account.profileUrl(), e, collectedAt);
                }

                seen += accountLinks;
                saved += accountSaved;
                failures += accountFailures;
                LOG.info("@{}: {} links, {} saved, {} failed", account.handle(), accountLinks, accountSaved,
                        accountFailures);
                eventBus.post(new AccountCrawledEvent(account.handle(), accountLinks, accountSaved, accountFailures));
            }
        }

        CrawlSummary summary = new CrawlSummary(processed, seen, saved, failures);
        LOG.info("Backfill finished: {}", summary);
        eventBus.post(new StageCompletedEvent("backfill", summary));
        return summary;
    }

    /**
     * Reads rendered links after every scroll pass, keeping the first
     * occurrence of each post URL. Stops at the cap, after
     * {@code max-scroll-attempts} passes, or when the profile has no more
     * content.
     */
    List<PostLink> collectPostLinks(ProfileBrowser browser, ResolvedAccount account, Integer cap)
            throws IOException {
        browser.openProfile(account.profileUrl());

        Set<String> urls = new LinkedHashSet<>();
        List<PostLink> links = new ArrayList<>();
        for (int pass = 0; pass < config.getMaxScrollAttempts(); pass++) {
            for (String href : browser.visibleLinks()) {
                Optional<PostLink> link = PostLink.parse(href);
                if (link.isPresent() && urls.add(link.get().url()))
                    links.add(link.get());
            }
            if (cap != null && links.size() >= cap)
                break;
            if (!browser.scroll())
                break;
            pause();
        }
        return cap != null && links.size() > cap ? new ArrayList<>(links.subList(0, cap)) : links;
    }

    private CrawlPost crawlPost(ProfileBrowser browser, PostLink link, ResolvedAccount account,
            Instant collectedAt) throws IOException {
        pause();
        String html = browser.fetchPage(link.url());
        String caption = CaptionExtractor.extract(html, config.getMaxCaptionLength());
        PostMetrics metrics = MetricExtractor.extract(html);
        LOG.debug("Post {}: views={} likes={} comments={} shares={} confidence={}", link.postId(),
                metrics.views(), metrics.likes(), metrics.comments(), metrics.shares(), metrics.confidence());

        return new CrawlPost(link.postId(), link.url(), account.handle(), null, caption,
                metrics.views(), metrics.likes(), metrics.comments(), metrics.shares(),
                collectedAt, config.getSourceTag(), metrics.confidence());
    }

    private void recordFailure(String handle, String url, Exception e, Instant collectedAt) {
        String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
        LOG.warn("Crawl failure for @{} ({}): {}", handle, url, reason);
        database.recordFailure(new CrawlFailure(handle, url, reason, collectedAt));
        eventBus.post(new CrawlFailureEvent(handle, url, reason));
    }

    /** Settle delay between page loads. An interrupt ends the delay and stays set. */
    private void pause() {
        long millis = config.getSettleMillis();
        if (millis <= 0)
            return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
