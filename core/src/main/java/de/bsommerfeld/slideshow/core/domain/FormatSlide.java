package de.bsommerfeld.slideshow.core.domain;

/**
 * A single ordered slide of a {@link FormatExample}.
 *
 * @param formatName owning format
 * @param exampleId  owning example
 * @param slideIndex 1-based position within the example
 * @param filePath   absolute path of the slide image
 * @param ocrText    extracted text, {@code null} if OCR was disabled or failed
 * @param role       narrative role inferred from the slide position
 */
public record FormatSlide(
        String formatName,
        String exampleId,
        int slideIndex,
        String filePath,
        String ocrText,
        SlideRole role) {
}
