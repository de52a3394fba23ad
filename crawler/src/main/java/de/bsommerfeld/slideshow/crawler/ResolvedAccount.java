package de.bsommerfeld.slideshow.crawler;

/**
 * Canonical form of an account entry.
 *
 * @param handle     handle without the leading {@code @}
 * @param profileUrl public profile URL of the handle
 */
public record ResolvedAccount(String handle, String profileUrl) {
}
