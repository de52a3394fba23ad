package de.bsommerfeld.slideshow.core.domain;

/**
 * One generated slide of a {@link Draft}.
 *
 * @param index 1-based slide position
 * @param role  narrative role the text was generated for
 * @param text  slide copy
 */
public record DraftSlide(int index, SlideRole role, String text) {
}
