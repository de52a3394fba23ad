package de.bsommerfeld.slideshow.crawler;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A recognised post URL. Only {@code tiktok.com/@<handle>/video/<digits>}
 * links are posts; query strings and fragments are dropped.
 *
 * @param handle handle found in the URL
 * @param postId numeric post id
 * @param url    canonical post URL (the matched part of the link)
 */
public record PostLink(String handle, String postId, String url) {

    static final Pattern POST_URL = Pattern.compile(
            "https?://(?:www\\.)?tiktok\\.com/@([A-Za-z0-9._-]+)/video/(\\d+)",
            Pattern.CASE_INSENSITIVE);

    public static Optional<PostLink> parse(String href) {
        if (href == null)
            return Optional.empty();
        Matcher m = POST_URL.matcher(href);
        if (!m.find())
            return Optional.empty();
        return Optional.of(new PostLink(m.group(1), m.group(2), m.group(0)));
    }
}
