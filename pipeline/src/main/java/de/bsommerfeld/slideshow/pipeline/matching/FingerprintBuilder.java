package de.bsommerfeld.slideshow.pipeline.matching;

import de.bsommerfeld.slideshow.core.domain.FormatExample;
import de.bsommerfeld.slideshow.core.domain.FormatSlide;
import de.bsommerfeld.slideshow.core.domain.SlideRole;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds one {@link FormatFingerprint} per format from the normalized corpus.
 */
public final class FingerprintBuilder {

    private FingerprintBuilder() {
    }

    /**
     * @return fingerprints ordered by format name
     */
    public static List<FormatFingerprint> build(List<FormatExample> examples, List<FormatSlide> slides) {
        Map<String, List<FormatExample>> examplesByFormat = new TreeMap<>();
        for (FormatExample example : examples)
            examplesByFormat.computeIfAbsent(example.formatName(), k -> new ArrayList<>()).add(example);

        Map<String, Set<String>> slideTokens = new HashMap<>();
        Map<String, Map<SlideRole, Integer>> roles = new HashMap<>();
        for (FormatSlide slide : slides) {
            slideTokens.computeIfAbsent(slide.formatName(), k -> new HashSet<>())
                    .addAll(Tokens.tokenize(slide.ocrText()));
            if (slide.role() != null)
                roles.computeIfAbsent(slide.formatName(), k -> new EnumMap<>(SlideRole.class))
                        .merge(slide.role(), 1, Integer::sum);
        }

        List<FormatFingerprint> fingerprints = new ArrayList<>();
        for (Map.Entry<String, List<FormatExample>> entry : examplesByFormat.entrySet()) {
            String formatName = entry.getKey();
            Set<String> tokens = new HashSet<>(Tokens.tokenize(formatName.replace('_', ' ')));
            tokens.addAll(slideTokens.getOrDefault(formatName, Set.of()));

            double avgSlides = entry.getValue().stream().mapToInt(FormatExample::slideCount).average().orElse(0.0);
            Set<String> exampleIds = new TreeSet<>();
            entry.getValue().forEach(e -> exampleIds.add(e.exampleId()));

            fingerprints.add(new FormatFingerprint(formatName, tokens, avgSlides, new ArrayList<>(exampleIds),
                    roles.getOrDefault(formatName, Map.of())));
        }
        return fingerprints;
    }
}
