package de.bsommerfeld.slideshow.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * Finds the caption of a post page: the description heading, then the
 * description block, then the {@code og:description} meta tag.
 */
public final class CaptionExtractor {

    private static final List<String> TEXT_SELECTORS = List.of(
            "h1[data-e2e=\"browse-video-desc\"]",
            "div[data-e2e=\"browse-video-desc\"]");
    private static final String META_SELECTOR = "meta[property=\"og:description\"]";

    private CaptionExtractor() {
    }

    /**
     * @return whitespace-collapsed caption cut to {@code maxLength}, or
     *         {@code null} when none of the sources carries text
     */
    public static String extract(String html, int maxLength) {
        if (html == null || html.isBlank())
            return null;

        Document doc = Jsoup.parse(html);
        for (String selector : TEXT_SELECTORS) {
            Element el = doc.selectFirst(selector);
            if (el != null) {
                String caption = clean(el.text(), maxLength);
                if (caption != null)
                    return caption;
            }
        }
        Element meta = doc.selectFirst(META_SELECTOR);
        return meta != null ? clean(meta.attr("content"), maxLength) : null;
    }

    private static String clean(String value, int maxLength) {
        if (value == null)
            return null;
        String collapsed = value.strip().replaceAll("\\s+", " ");
        if (collapsed.isEmpty())
            return null;
        return collapsed.length() > maxLength ? collapsed.substring(0, maxLength) : collapsed;
    }
}
