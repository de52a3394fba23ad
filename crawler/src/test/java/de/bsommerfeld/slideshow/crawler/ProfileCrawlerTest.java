package de.bsommerfeld.slideshow.crawler;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.slideshow.core.config.CrawlerConfig;
import de.bsommerfeld.slideshow.core.domain.CrawlFailure;
import de.bsommerfeld.slideshow.core.domain.CrawlPost;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.AccountCrawledEvent;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.StageCompletedEvent;
import de.bsommerfeld.slideshow.core.exception.StorageException;
import de.bsommerfeld.slideshow.db.DatabaseService;
import de.bsommerfeld.slideshow.db.SqlDatabaseService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Drives the crawl loop against a mocked browser and a real temporary
 * SQLite store.
 */
class ProfileCrawlerTest {

    private static final String POST_HTML = "<html><head>"
            + "<meta property=\"og:description\" content=\"soft glam in 5 steps\"></head>"
            + "<body><script>{\"playCount\":\"12.5K\",\"diggCount\":900,"
            + "\"commentCount\":40,\"shareCount\":\"1.1K\"}</script></body></html>";

    @TempDir
    Path tempDir;

    private SqlDatabaseService db;
    private ProfileBrowser browser;
    private PipelineEventBus eventBus;
    private ProfileCrawler crawler;

    @BeforeEach
    void setUp() {
        db = new SqlDatabaseService(tempDir.resolve("crawl.db"));
        browser = mock(ProfileBrowser.class);
        CrawlerConfig config = new CrawlerConfig();
        config.setSettleMillis(0);
        eventBus = new PipelineEventBus();
        crawler = new ProfileCrawler(db, () -> browser, config, eventBus);
    }

    @Test
    void crawl_shouldSaveDiscoveredPosts() throws Exception {
        when(browser.visibleLinks()).thenReturn(List.of(
                "https://www.tiktok.com/@a/video/1?lang=en",
                "https://www.tiktok.com/@a",
                "https://www.tiktok.com/@a/video/2",
                "https://www.tiktok.com/@a/video/1"));
        when(browser.scroll()).thenReturn(false);
        when(browser.fetchPage(anyString())).thenReturn(POST_HTML);

        CrawlSummary summary = crawler.crawl(List.of("@a"), null);

        assertEquals(new CrawlSummary(1, 2, 2, 0), summary);
        List<CrawlPost> posts = db.getAllPosts();
        assertEquals(2, posts.size());
        CrawlPost first = posts.get(0);
        assertEquals("1", first.postId());
        assertEquals("https://www.tiktok.com/@a/video/1", first.postUrl());
        assertEquals("a", first.accountHandle());
        assertEquals("soft glam in 5 steps", first.caption());
        assertEquals(12_500, first.views());
        assertEquals(900, first.likes());
        assertEquals(40, first.comments());
        assertEquals(1_100, first.shares());
        assertEquals(0.9, first.confidence(), 1e-9);
        assertEquals("http_public", first.source());
        verify(browser).openProfile("https://www.tiktok.com/@a");
    }

    @Test
    void crawl_shouldRecordPostFailureAndContinue() throws Exception {
        when(browser.visibleLinks()).thenReturn(List.of(
                "https://www.tiktok.com/@a/video/1",
                "https://www.tiktok.com/@a/video/2"));
        when(browser.fetchPage("https://www.tiktok.com/@a/video/1")).thenThrow(new IOException("HTTP 403"));
        when(browser.fetchPage("https://www.tiktok.com/@a/video/2")).thenReturn(POST_HTML);

        CrawlSummary summary = crawler.crawl(List.of("a"), null);

        assertEquals(new CrawlSummary(1, 2, 1, 1), summary);
        List<CrawlFailure> failures = db.getFailures();
        assertEquals(1, failures.size());
        assertEquals("a", failures.get(0).accountHandle());
        assertEquals("https://www.tiktok.com/@a/video/1", failures.get(0).postUrl());
        assertEquals("IOException: HTTP 403", failures.get(0).reason());
    }

    @Test
    void crawl_shouldRecordAccountFailuresAndContinue() throws Exception {
        doThrow(new IOException("timeout")).when(browser).openProfile("https://www.tiktok.com/@broken");
        when(browser.visibleLinks()).thenReturn(List.of("https://www.tiktok.com/@ok/video/5"));
        when(browser.fetchPage(anyString())).thenReturn(POST_HTML);

        CrawlSummary summary = crawler.crawl(
                List.of("@broken", "https://www.tiktok.com/explore", "@ok"), null);

        assertEquals(3, summary.accounts());
        assertEquals(1, summary.postsSaved());
        assertEquals(2, summary.failures());
        List<CrawlFailure> failures = db.getFailures();
        assertEquals("broken", failures.get(0).accountHandle());
        assertEquals("https://www.tiktok.com/@broken", failures.get(0).postUrl());
        assertEquals("https://www.tiktok.com/explore", failures.get(1).accountHandle());
        assertNull(failures.get(1).postUrl());
    }

    @Test
    void crawl_shouldApplyCapPerAccount() throws Exception {
        when(browser.visibleLinks()).thenReturn(List.of(
                "https://www.tiktok.com/@a/video/1",
                "https://www.tiktok.com/@a/video/2",
                "https://www.tiktok.com/@a/video/3",
                "https://www.tiktok.com/@a/video/4"));
        when(browser.fetchPage(anyString())).thenReturn(POST_HTML);

        CrawlSummary summary = crawler.crawl(List.of("@a"), 3);

        assertEquals(3, summary.postsSeen());
        assertEquals(3, summary.postsSaved());
        verify(browser, times(3)).fetchPage(anyString());
        verify(browser, never()).scroll();
    }

    @Test
    void crawl_shouldBoundScrollPasses() throws Exception {
        when(browser.visibleLinks()).thenReturn(List.of("https://www.tiktok.com/@a/video/1"));
        when(browser.scroll()).thenReturn(true);
        when(browser.fetchPage(anyString())).thenReturn(POST_HTML);

        crawler.crawl(List.of("@a"), null);

        verify(browser, times(8)).visibleLinks();
        verify(browser, times(8)).scroll();
    }

    @Test
    void crawl_shouldReupsertOnRecrawl() throws Exception {
        when(browser.visibleLinks()).thenReturn(List.of("https://www.tiktok.com/@a/video/1"));
        when(browser.fetchPage(anyString())).thenReturn(POST_HTML);

        crawler.crawl(List.of("@a"), null);
        crawler.crawl(List.of("@a"), null);

        assertEquals(1, db.getAllPosts().size());
    }

    @Test
    void crawl_shouldPostProgressEvents() throws Exception {
        when(browser.visibleLinks()).thenReturn(List.of("https://www.tiktok.com/@a/video/1"));
        when(browser.fetchPage(anyString())).thenReturn(POST_HTML);
        List<Object> events = new ArrayList<>();
        eventBus.register(new Object() {
            @Subscribe
            public void onAccount(AccountCrawledEvent event) {
                events.add(event);
            }

            @Subscribe
            public void onStage(StageCompletedEvent event) {
                events.add(event);
            }
        });

        CrawlSummary summary = crawler.crawl(List.of("@a"), null);

        assertEquals(List.of(new AccountCrawledEvent("a", 1, 1, 0),
                new StageCompletedEvent("backfill", summary)), events);
    }

    @Test
    void crawl_shouldCloseBrowser() {
        crawler.crawl(List.of(), null);

        verify(browser).close();
    }

    @Test
    void crawl_shouldPropagateStoreFailures() throws Exception {
        DatabaseService failing = mock(DatabaseService.class);
        doThrow(new StorageException("Failed to save post 1", new SQLException("disk I/O error")))
                .when(failing).upsertPost(any(CrawlPost.class));
        CrawlerConfig config = new CrawlerConfig();
        config.setSettleMillis(0);
        ProfileCrawler storeBacked = new ProfileCrawler(failing, () -> browser, config, eventBus);
        when(browser.visibleLinks()).thenReturn(List.of("https://www.tiktok.com/@a/video/1"));
        when(browser.scroll()).thenReturn(false);
        when(browser.fetchPage(anyString())).thenReturn(POST_HTML);

        assertThrows(StorageException.class, () -> storeBacked.crawl(List.of("@a", "@b"), null));
        verify(failing, never()).recordFailure(any(CrawlFailure.class));
        verify(browser).close();
    }
}
