package de.bsommerfeld.slideshow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Backfill crawl parameters. Values are persisted in config.toml and loaded
 * at startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlerConfig {

    @JsonProperty("max-scroll-attempts")
    @JsonPropertyDescription("Profile timeline scroll passes per account (default: 8)")
    private int maxScrollAttempts = 8;

    @JsonProperty("navigation-timeout-seconds")
    @JsonPropertyDescription("Timeout for a single page load (default: 60)")
    private long navigationTimeoutSeconds = 60;

    @JsonProperty("settle-millis")
    @JsonPropertyDescription("Pause after each navigation or scroll (default: 1500)")
    private long settleMillis = 1500;

    @JsonProperty("max-caption-length")
    @JsonPropertyDescription("Captions are truncated to this many characters (default: 1000)")
    private int maxCaptionLength = 1000;

    @JsonProperty("user-agent")
    @JsonPropertyDescription("User-Agent header sent with every request")
    private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36 slideshow-machine";

    @JsonProperty("source-tag")
    @JsonPropertyDescription("Provenance tag stored on every crawled post")
    private String sourceTag = "http_public";

    public int getMaxScrollAttempts() {
        return maxScrollAttempts;
    }

    public long getNavigationTimeoutSeconds() {
        return navigationTimeoutSeconds;
    }

    public long getSettleMillis() {
        return settleMillis;
    }

    public void setSettleMillis(long settleMillis) {
        this.settleMillis = settleMillis;
    }

    public int getMaxCaptionLength() {
        return maxCaptionLength;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getSourceTag() {
        return sourceTag;
    }
}
