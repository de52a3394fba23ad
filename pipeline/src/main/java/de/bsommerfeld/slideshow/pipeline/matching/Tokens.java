package de.bsommerfeld.slideshow.pipeline.matching;

import com.google.common.collect.Sets;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lowercase alphanumeric word sets and their overlap.
 */
public final class Tokens {

    private static final Pattern WORD = Pattern.compile("[a-z0-9]+");

    private Tokens() {
    }

    /**
     * Distinct lowercase {@code [a-z0-9]+} runs of the text in order of first
     * appearance. {@code null} yields an empty set.
     */
    public static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null)
            return tokens;
        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find())
            tokens.add(m.group());
        return tokens;
    }

    /**
     * Jaccard index {@code |a ∩ b| / |a ∪ b|}; 0 if either set is empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty())
            return 0.0;
        int intersection = Sets.intersection(a, b).size();
        int union = Sets.union(a, b).size();
        return (double) intersection / union;
    }
}
