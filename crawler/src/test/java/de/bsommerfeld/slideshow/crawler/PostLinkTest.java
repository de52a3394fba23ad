package de.bsommerfeld.slideshow.crawler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PostLinkTest {

    @Test
    void parse_shouldExtractHandleAndId() {
        PostLink link = PostLink.parse("https://www.tiktok.com/@a.b/video/7312?is_from_webapp=1").orElseThrow();
        assertEquals("a.b", link.handle());
        assertEquals("7312", link.postId());
        assertEquals("https://www.tiktok.com/@a.b/video/7312", link.url());
    }

    @Test
    void parse_shouldIgnoreCase() {
        assertTrue(PostLink.parse("HTTPS://TikTok.com/@A/video/1").isPresent());
    }

    @Test
    void parse_shouldRejectNonPostLinks() {
        assertTrue(PostLink.parse("https://www.tiktok.com/@a").isEmpty());
        assertTrue(PostLink.parse("https://www.tiktok.com/@a/photo/1").isEmpty());
        assertTrue(PostLink.parse("https://example.com/@a/video/1").isEmpty());
        assertTrue(PostLink.parse(null).isEmpty());
    }
}
