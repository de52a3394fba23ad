package de.bsommerfeld.slideshow.crawler;

import java.net.URI;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an accounts-file entry ({@code @handle}, {@code handle} or a profile
 * URL) into a {@link ResolvedAccount}.
 */
public final class AccountResolver {

    static final String PROFILE_BASE = "https://www.tiktok.com/@";

    private static final Pattern HANDLE_IN_PATH = Pattern.compile("/@([A-Za-z0-9._-]+)");

    private AccountResolver() {
    }

    /**
     * @throws IllegalArgumentException for blank entries and URLs without an
     *                                  {@code /@handle} path segment
     */
    public static ResolvedAccount resolve(String entry) {
        String account = entry == null ? "" : entry.strip();
        if (account.isEmpty())
            throw new IllegalArgumentException("Empty account handle/url");

        String handle;
        if (account.startsWith("http")) {
            String path;
            try {
                path = URI.create(account).getPath();
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Could not parse account handle from " + account, e);
            }
            Matcher m = HANDLE_IN_PATH.matcher(path == null ? "" : path);
            if (!m.find())
                throw new IllegalArgumentException("Could not parse account handle from " + account);
            handle = m.group(1);
        } else {
            handle = account.replaceFirst("^@+", "");
            if (handle.isEmpty())
                throw new IllegalArgumentException("Empty account handle/url");
        }
        return new ResolvedAccount(handle, PROFILE_BASE + handle);
    }
}
