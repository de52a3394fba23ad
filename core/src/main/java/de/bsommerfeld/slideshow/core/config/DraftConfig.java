package de.bsommerfeld.slideshow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Draft generation policy. {@code seed} makes format sampling reproducible.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DraftConfig {

    @JsonProperty("explore-ratio")
    @JsonPropertyDescription("Probability of sampling outside the top formats (default: 0.2)")
    private double exploreRatio = 0.2;

    @JsonProperty("exploit-pool-size")
    @JsonPropertyDescription("Number of top ranked formats sampled when exploiting (default: 3)")
    private int exploitPoolSize = 3;

    @JsonProperty("seed")
    private long seed = 42L;

    @JsonProperty("objective")
    private String objective = "qualified_virality_proxy";

    @JsonProperty("hashtags")
    private String hashtags = "#pretti #makeup #tiktoktips";

    @JsonProperty("max-roles")
    @JsonPropertyDescription("Upper bound of slides per generated draft (default: 8)")
    private int maxRoles = 8;

    public double getExploreRatio() {
        return exploreRatio;
    }

    public int getExploitPoolSize() {
        return exploitPoolSize;
    }

    public long getSeed() {
        return seed;
    }

    public String getObjective() {
        return objective;
    }

    public String getHashtags() {
        return hashtags;
    }

    public int getMaxRoles() {
        return maxRoles;
    }
}
