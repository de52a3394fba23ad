package de.bsommerfeld.slideshow.crawler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccountResolverTest {

    @Test
    void resolve_shouldStripAtSign() {
        ResolvedAccount account = AccountResolver.resolve("@glow.daily");
        assertEquals("glow.daily", account.handle());
        assertEquals("https://www.tiktok.com/@glow.daily", account.profileUrl());
    }

    @Test
    void resolve_shouldAcceptBareHandle() {
        assertEquals("glow_daily", AccountResolver.resolve("  glow_daily ").handle());
    }

    @Test
    void resolve_shouldExtractHandleFromProfileUrl() {
        ResolvedAccount account = AccountResolver.resolve("https://www.tiktok.com/@make-up.lab?lang=en");
        assertEquals("make-up.lab", account.handle());
        assertEquals("https://www.tiktok.com/@make-up.lab", account.profileUrl());
    }

    @Test
    void resolve_shouldExtractHandleFromPostUrl() {
        assertEquals("a", AccountResolver.resolve("https://tiktok.com/@a/video/123").handle());
    }

    @Test
    void resolve_shouldRejectBlankEntry() {
        assertThrows(IllegalArgumentException.class, () -> AccountResolver.resolve("   "));
        assertThrows(IllegalArgumentException.class, () -> AccountResolver.resolve("@"));
    }

    @Test
    void resolve_shouldRejectUrlWithoutHandle() {
        assertThrows(IllegalArgumentException.class,
                () -> AccountResolver.resolve("https://www.tiktok.com/explore"));
    }
}
