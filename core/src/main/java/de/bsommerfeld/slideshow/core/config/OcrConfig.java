package de.bsommerfeld.slideshow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

@JsonIgnoreProperties(ignoreUnknown = true)
public class OcrConfig {

    @JsonProperty("command")
    @JsonPropertyDescription("Tesseract executable (default: tesseract on PATH)")
    private String command = "tesseract";

    @JsonProperty("dpi")
    private int dpi = 300;

    @JsonProperty("timeout-seconds")
    @JsonPropertyDescription("Per-slide OCR timeout (default: 12)")
    private long timeoutSeconds = 12;

    @JsonProperty("max-chars")
    @JsonPropertyDescription("Extracted text is truncated to this length (default: 1200)")
    private int maxChars = 1200;

    public String getCommand() {
        return command;
    }

    public int getDpi() {
        return dpi;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getMaxChars() {
        return maxChars;
    }
}
