package de.bsommerfeld.slideshow.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CrawlPostTest {

    @Test
    void constructor_shouldRejectNegativeCounters() {
        assertThrows(IllegalArgumentException.class, () -> post(-1, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> post(10, 0, 0, -5));
    }

    @Test
    void engagementDensity_shouldWeightSharesTwice() {
        CrawlPost post = post(1000, 50, 10, 20);
        assertEquals((50 + 10 + 40) / 1000.0, post.engagementDensity(), 1e-9);
    }

    @Test
    void engagementDensity_shouldBeZeroWithoutViews() {
        assertEquals(0.0, post(0, 10, 10, 10).engagementDensity());
    }

    @Test
    void engagementDensity_shouldStayPositiveForSaturatedCounters() {
        CrawlPost post = post(1, Long.MAX_VALUE, Long.MAX_VALUE, 0);

        double density = post.engagementDensity();
        assertTrue(density > 0.0);
        assertEquals(2.0 * Long.MAX_VALUE, density, Math.ulp(density));
    }

    private static CrawlPost post(long views, long likes, long comments, long shares) {
        return new CrawlPost("1", "https://www.tiktok.com/@a/video/1", "a", null, "caption",
                views, likes, comments, shares, Instant.now(), "test", 0.8);
    }
}
