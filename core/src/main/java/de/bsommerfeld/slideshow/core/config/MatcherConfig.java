package de.bsommerfeld.slideshow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Heuristic constants of the post to format matcher. The slide targets and
 * weights have no derivation beyond observation and are kept tunable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MatcherConfig {

    @JsonProperty("threshold")
    @JsonPropertyDescription("Minimum confidence for an automatic match (default: 0.4)")
    private double threshold = 0.4;

    @JsonProperty("text-weight")
    private double textWeight = 0.75;

    @JsonProperty("structure-weight")
    private double structureWeight = 0.25;

    @JsonProperty("dense-engagement-cutoff")
    @JsonPropertyDescription("Engagement density above which shorter formats are preferred (default: 0.08)")
    private double denseEngagementCutoff = 0.08;

    @JsonProperty("dense-target-slides")
    private double denseTargetSlides = 5.0;

    @JsonProperty("sparse-target-slides")
    private double sparseTargetSlides = 7.0;

    @JsonProperty("prior-width")
    @JsonPropertyDescription("Denominator of the gaussian structural prior (default: 9.0)")
    private double priorWidth = 9.0;

    public double getThreshold() {
        return threshold;
    }

    public double getTextWeight() {
        return textWeight;
    }

    public double getStructureWeight() {
        return structureWeight;
    }

    public double getDenseEngagementCutoff() {
        return denseEngagementCutoff;
    }

    public double getDenseTargetSlides() {
        return denseTargetSlides;
    }

    public double getSparseTargetSlides() {
        return sparseTargetSlides;
    }

    public double getPriorWidth() {
        return priorWidth;
    }
}
