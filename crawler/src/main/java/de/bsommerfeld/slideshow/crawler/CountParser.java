package de.bsommerfeld.slideshow.crawler;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact engagement counters as rendered by the platform:
 * {@code "1.2K" → 1200}, {@code "3.5M" → 3500000}, {@code "12,345" → 12345}.
 * The parse is total; anything unrecognisable degrades to its digits or 0.
 */
public final class CountParser {

    private static final Pattern COMPACT = Pattern.compile("^([0-9]+(?:\\.[0-9]+)?)([KMB])?$",
            Pattern.CASE_INSENSITIVE);
    private static final BigDecimal MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private CountParser() {
    }

    public static long parseCount(String value) {
        if (value == null || value.isBlank())
            return 0;

        String cleaned = value.strip().replace(",", "");
        Matcher m = COMPACT.matcher(cleaned);
        if (!m.matches()) {
            String digits = cleaned.replaceAll("[^0-9]", "");
            return digits.isEmpty() ? 0 : clamp(new BigDecimal(digits));
        }

        BigDecimal number = new BigDecimal(m.group(1));
        String suffix = m.group(2) == null ? "" : m.group(2).toUpperCase(Locale.ROOT);
        long factor = 1L;
        switch (suffix) {
            case "K":
                factor = 1_000L;
                break;
            case "M":
                factor = 1_000_000L;
                break;
            case "B":
                factor = 1_000_000_000L;
                break;
            default:
                break;
        }
        return clamp(number.multiply(BigDecimal.valueOf(factor)));
    }

    /** Truncates toward zero and saturates at {@link Long#MAX_VALUE}. */
    private static long clamp(BigDecimal value) {
        return value.min(MAX).longValue();
    }
}
