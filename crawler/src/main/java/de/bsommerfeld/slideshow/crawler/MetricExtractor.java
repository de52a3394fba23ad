package de.bsommerfeld.slideshow.crawler;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls engagement counters out of a raw post page. The embedded JSON state
 * ({@code "playCount": 1234}) is preferred; loose {@code key: value} or
 * {@code key=value} text is the fallback. For each counter the first key
 * that yields a hit wins.
 */
public final class MetricExtractor {

    private static final List<String> VIEW_KEYS = List.of("playCount", "viewCount", "views");
    private static final List<String> LIKE_KEYS = List.of("diggCount", "likeCount", "likes");
    private static final List<String> COMMENT_KEYS = List.of("commentCount", "comments");
    private static final List<String> SHARE_KEYS = List.of("shareCount", "shares");

    private MetricExtractor() {
    }

    public static PostMetrics extract(String html) {
        String body = html == null ? "" : html;
        return PostMetrics.of(
                extractNumber(body, VIEW_KEYS),
                extractNumber(body, LIKE_KEYS),
                extractNumber(body, COMMENT_KEYS),
                extractNumber(body, SHARE_KEYS));
    }

    static long extractNumber(String text, List<String> keys) {
        for (String key : keys) {
            for (Pattern pattern : patternsFor(key)) {
                Matcher m = pattern.matcher(text);
                if (m.find())
                    return CountParser.parseCount(m.group(1));
            }
        }
        return 0;
    }

    private static List<Pattern> patternsFor(String key) {
        String quoted = Pattern.quote(key);
        return List.of(
                Pattern.compile("\"" + quoted + "\"\\s*:\\s*\"?([0-9.,KMB]+)\"?", Pattern.CASE_INSENSITIVE),
                Pattern.compile(quoted + "\\s*[:=]\\s*([0-9.,KMB]+)", Pattern.CASE_INSENSITIVE));
    }
}
