package de.bsommerfeld.slideshow.crawler;

import java.io.IOException;
import java.util.List;

/**
 * Page-level access to the platform, driven sequentially by
 * {@link ProfileCrawler}. One instance serves one crawl run and is closed at
 * its end.
 *
 * <p>
 * Implementations apply their own navigation timeout; a navigation that
 * exceeds it fails with an {@link IOException}.
 */
public interface ProfileBrowser extends AutoCloseable {

    /** Navigates to a profile timeline, replacing the current page. */
    void openProfile(String profileUrl) throws IOException;

    /** Absolute link targets currently rendered on the open profile. */
    List<String> visibleLinks();

    /**
     * Asks the profile for more timeline content.
     *
     * @return {@code false} when no further content can be loaded
     */
    boolean scroll() throws IOException;

    /** Loads a post page and returns its HTML. */
    String fetchPage(String url) throws IOException;

    @Override
    void close();
}
