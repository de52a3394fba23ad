package de.bsommerfeld.slideshow.pipeline.matching;

import de.bsommerfeld.slideshow.core.domain.SlideRole;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Aggregated view of one format used for similarity scoring.
 *
 * @param formatName    the format
 * @param tokens        words of all slide OCR text plus the format name
 * @param avgSlideCount mean slide count across the format's examples
 * @param exampleIds    example ids in ascending order
 * @param roleCounts    occurrences of each stored slide role
 */
public record FormatFingerprint(
        String formatName,
        Set<String> tokens,
        double avgSlideCount,
        List<String> exampleIds,
        Map<SlideRole, Integer> roleCounts) {

    public FormatFingerprint {
        tokens = Set.copyOf(tokens);
        exampleIds = List.copyOf(exampleIds);
        roleCounts = Map.copyOf(roleCounts);
    }

    /** The example reported for an automatic match, or {@code null} if the format has none. */
    public String firstExampleId() {
        return exampleIds.isEmpty() ? null : exampleIds.get(0);
    }
}
