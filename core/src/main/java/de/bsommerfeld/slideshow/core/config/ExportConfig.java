package de.bsommerfeld.slideshow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportConfig {

    @JsonProperty("output-root")
    @JsonPropertyDescription("Directory receiving one sub-directory per exported draft")
    private String outputRoot = "./output";

    @JsonProperty("platform")
    private String platform = "tiktok";

    @JsonProperty("mode")
    @JsonPropertyDescription("Uploader mode column; drafts are never published directly")
    private String mode = "draft";

    public String getOutputRoot() {
        return outputRoot;
    }

    public String getPlatform() {
        return platform;
    }

    public String getMode() {
        return mode;
    }
}
