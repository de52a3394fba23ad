package de.bsommerfeld.slideshow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Weights and scales of the proxy virality score. Each scale divides the
 * per-1000 ratio before squashing; the four weights sum to 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoringConfig {

    @JsonProperty("views-weight")
    private double viewsWeight = 0.40;

    @JsonProperty("shares-weight")
    private double sharesWeight = 0.30;

    @JsonProperty("comments-weight")
    private double commentsWeight = 0.15;

    @JsonProperty("likes-weight")
    private double likesWeight = 0.15;

    @JsonProperty("shares-scale")
    @JsonPropertyDescription("Shares per 1000 views that map to a squashed 0.5 (default: 20)")
    private double sharesScale = 20.0;

    @JsonProperty("comments-scale")
    private double commentsScale = 20.0;

    @JsonProperty("likes-scale")
    private double likesScale = 100.0;

    public double getViewsWeight() {
        return viewsWeight;
    }

    public double getSharesWeight() {
        return sharesWeight;
    }

    public double getCommentsWeight() {
        return commentsWeight;
    }

    public double getLikesWeight() {
        return likesWeight;
    }

    public double getSharesScale() {
        return sharesScale;
    }

    public double getCommentsScale() {
        return commentsScale;
    }

    public double getLikesScale() {
        return likesScale;
    }
}
