package de.bsommerfeld.slideshow.core.domain;

import java.time.Instant;

/**
 * Audit entry for one manifest write. A draft may be exported many times.
 */
public record ExportRecord(String draftId, String outputDir, String manifestPath, Instant createdAt) {
}
