package de.bsommerfeld.slideshow.core.domain;

import java.util.Locale;

/**
 * Narrative role of a slide within a slideshow. The normalizer only ever
 * infers the first five roles from slide positions; {@link #LIST_ITEM} and
 * {@link #COMPARISON} exist for hand-curated structures.
 */
public enum SlideRole {

    HOOK,
    SETUP,
    PROOF,
    REVEAL,
    CTA,
    LIST_ITEM,
    COMPARISON;

    /** Lower snake case name as stored and exported, e.g. {@code list_item}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a stored role name. Unknown or missing values fall back to
     * {@link #PROOF}, the neutral body-slide role.
     */
    public static SlideRole fromWire(String value) {
        if (value == null || value.isBlank())
            return PROOF;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return PROOF;
        }
    }

    /**
     * Position-based role inference for slide {@code index} (1-based) of an
     * example with {@code count} slides. Checks run in order: first slide is
     * the hook, last is the call to action, second is setup, the one before
     * the last is the reveal, everything else is proof.
     */
    public static SlideRole inferFromPosition(int index, int count) {
        if (index == 1)
            return HOOK;
        if (index == count)
            return CTA;
        if (index == 2)
            return SETUP;
        if (index >= count - 1)
            return REVEAL;
        return PROOF;
    }
}
