package de.bsommerfeld.slideshow.pipeline.assets;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Best-effort text extraction from a slide image. Implementations never
 * throw for a bad image or a missing engine; they return empty instead.
 */
public interface OcrExtractor {

    Optional<String> extract(Path image);
}
