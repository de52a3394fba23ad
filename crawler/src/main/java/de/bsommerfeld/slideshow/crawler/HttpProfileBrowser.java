package de.bsommerfeld.slideshow.crawler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.slideshow.core.config.CrawlerConfig;
import jakarta.inject.Inject;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * {@link ProfileBrowser} over plain HTTP. Profile and post pages are fetched
 * as server-rendered HTML with a standard {@link HttpClient}; links are read
 * from anchors and from the embedded page state.
 *
 * <h3>Scrolling</h3>
 * The profile's page state carries the account's {@code secUid}. Each
 * {@link #scroll()} requests the next page of the timeline from the
 * {@code item_list} endpoint on the profile's origin and appends the returned
 * posts to the visible links. The response's {@code cursor} and
 * {@code hasMore} drive the following request; once {@code hasMore} is false,
 * or the profile exposed no {@code secUid}, {@code scroll()} returns
 * {@code false}.
 */
public class HttpProfileBrowser implements ProfileBrowser {

    private static final Logger LOG = LoggerFactory.getLogger(HttpProfileBrowser.class);
    private static final String TIMELINE_PATH = "/api/post/item_list/";
    private static final String POST_ORIGIN = "https://www.tiktok.com";
    static final int PAGE_SIZE = 35;

    private final CrawlerConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Set<String> currentLinks = new LinkedHashSet<>();

    private String profileUrl;
    private String handle;
    private String secUid;
    private String cursor;
    private boolean hasMore;

    @Inject
    public HttpProfileBrowser(CrawlerConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(config.getNavigationTimeoutSeconds()))
                .build();
    }

    @Override
    public void openProfile(String profileUrl) throws IOException {
        reset();
        String html = executeGet(profileUrl, "text/html,application/xhtml+xml");
        this.profileUrl = profileUrl;
        this.handle = handleOf(profileUrl);
        this.secUid = extractSecUid(html, mapper);
        this.cursor = "0";
        this.hasMore = secUid != null;
        currentLinks.addAll(extractLinks(html, profileUrl));
        LOG.debug("Profile {} rendered {} candidate links (paginated: {})", profileUrl, currentLinks.size(),
                hasMore);
    }

    @Override
    public List<String> visibleLinks() {
        return List.copyOf(currentLinks);
    }

    @Override
    public boolean scroll() throws IOException {
        if (!hasMore)
            return false;

        String body = executeGet(timelineUrl(profileUrl, secUid, cursor), "application/json");
        JsonNode root = mapper.readTree(body);
        int before = currentLinks.size();
        for (JsonNode item : root.path("itemList")) {
            String id = item.path("id").asText("");
            if (id.isEmpty())
                continue;
            String author = item.path("author").path("uniqueId").asText(handle);
            currentLinks.add(POST_ORIGIN + "/@" + author + "/video/" + id);
        }

        String next = root.path("cursor").asText("");
        hasMore = root.path("hasMore").asBoolean(false) && !next.isEmpty() && !next.equals(cursor);
        cursor = next;
        LOG.debug("Timeline page for @{} added {} links (more: {})", handle, currentLinks.size() - before, hasMore);
        return true;
    }

    @Override
    public String fetchPage(String url) throws IOException {
        return executeGet(url, "text/html,application/xhtml+xml");
    }

    @Override
    public void close() {
        reset();
    }

    private void reset() {
        currentLinks.clear();
        profileUrl = null;
        handle = null;
        secUid = null;
        cursor = null;
        hasMore = false;
    }

    /**
     * The first {@code secUid} found in the embedded JSON page state, or
     * {@code null} when the document carries none.
     */
    static String extractSecUid(String html, ObjectMapper mapper) {
        Document doc = Jsoup.parse(html);
        for (Element script : doc.select("script[type='application/json']")) {
            try {
                JsonNode secUid = mapper.readTree(script.data()).findValue("secUid");
                if (secUid != null && secUid.isTextual() && !secUid.asText().isEmpty())
                    return secUid.asText();
            } catch (IOException e) {
                LOG.debug("Skipping unparseable page state block: {}", e.getMessage());
            }
        }
        return null;
    }

    /** Timeline endpoint on the profile's own origin. */
    static String timelineUrl(String profileUrl, String secUid, String cursor) {
        URI profile = URI.create(profileUrl);
        return profile.getScheme() + "://" + profile.getRawAuthority() + TIMELINE_PATH
                + "?secUid=" + URLEncoder.encode(secUid, StandardCharsets.UTF_8)
                + "&count=" + PAGE_SIZE
                + "&cursor=" + URLEncoder.encode(cursor, StandardCharsets.UTF_8);
    }

    private static String handleOf(String profileUrl) {
        String path = URI.create(profileUrl).getPath();
        int at = path.indexOf('@');
        if (at < 0)
            return "";
        String rest = path.substring(at + 1);
        int slash = rest.indexOf('/');
        return slash < 0 ? rest : rest.substring(0, slash);
    }

    /**
     * Anchor targets resolved against the page URL, followed by post URLs
     * found anywhere in the document. The embedded JSON state writes slashes
     * as unicode escapes, which are decoded first.
     */
    static List<String> extractLinks(String html, String baseUrl) {
        Set<String> links = new LinkedHashSet<>();
        Document doc = Jsoup.parse(html, baseUrl);
        for (Element a : doc.select("a[href*='/video/']")) {
            String href = a.absUrl("href");
            if (!href.isEmpty())
                links.add(href);
        }
        Matcher m = PostLink.POST_URL.matcher(html.replace("\\u002F", "/"));
        while (m.find())
            links.add(m.group(0));
        return new ArrayList<>(links);
    }

    private String executeGet(String url, String accept) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(config.getNavigationTimeoutSeconds()))
                .header("User-Agent", config.getUserAgent())
                .header("Accept", accept)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while loading " + url, e);
        }
        if (response.statusCode() != 200)
            throw new IOException("HTTP " + response.statusCode() + " for " + url);
        return response.body();
    }
}
