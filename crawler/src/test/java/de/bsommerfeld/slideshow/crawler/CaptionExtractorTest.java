package de.bsommerfeld.slideshow.crawler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CaptionExtractorTest {

    @Test
    void extract_shouldPreferDescriptionHeading() {
        String html = "<html><head><meta property=\"og:description\" content=\"meta text\"></head>"
                + "<body><div data-e2e=\"browse-video-desc\">div text</div>"
                + "<h1 data-e2e=\"browse-video-desc\">  glass   skin\n routine </h1></body></html>";

        assertEquals("glass skin routine", CaptionExtractor.extract(html, 1000));
    }

    @Test
    void extract_shouldFallBackToDescriptionBlock() {
        String html = "<div data-e2e=\"browse-video-desc\">soft <b>glam</b> tips</div>";
        assertEquals("soft glam tips", CaptionExtractor.extract(html, 1000));
    }

    @Test
    void extract_shouldFallBackToMetaDescription() {
        String html = "<html><head><meta property=\"og:description\" content=\"  from meta  \"></head></html>";
        assertEquals("from meta", CaptionExtractor.extract(html, 1000));
    }

    @Test
    void extract_shouldSkipEmptyHeading() {
        String html = "<h1 data-e2e=\"browse-video-desc\">   </h1>"
                + "<meta property=\"og:description\" content=\"fallback\">";
        assertEquals("fallback", CaptionExtractor.extract(html, 1000));
    }

    @Test
    void extract_shouldTruncateToMaxLength() {
        String html = "<h1 data-e2e=\"browse-video-desc\">abcdefghij</h1>";
        assertEquals("abcd", CaptionExtractor.extract(html, 4));
    }

    @Test
    void extract_shouldReturnNullWithoutCaption() {
        assertNull(CaptionExtractor.extract("<p>hello</p>", 1000));
        assertNull(CaptionExtractor.extract("", 1000));
    }
}
