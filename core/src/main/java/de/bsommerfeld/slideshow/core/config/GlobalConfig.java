package de.bsommerfeld.slideshow.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Root of {@code config.toml}. Every section is pre-populated with defaults,
 * so an absent file or an absent section behaves like a fresh install.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("storage")
    @JsonPropertyDescription("Database location")
    private StorageConfig storage = new StorageConfig();

    @JsonProperty("crawler")
    @JsonPropertyDescription("Historical backfill settings")
    private CrawlerConfig crawler = new CrawlerConfig();

    @JsonProperty("ocr")
    @JsonPropertyDescription("Optional slide text extraction")
    private OcrConfig ocr = new OcrConfig();

    @JsonProperty("matcher")
    @JsonPropertyDescription("Post to format matching heuristics")
    private MatcherConfig matcher = new MatcherConfig();

    @JsonProperty("scoring")
    @JsonPropertyDescription("Proxy virality score weights")
    private ScoringConfig scoring = new ScoringConfig();

    @JsonProperty("drafts")
    @JsonPropertyDescription("Draft generation policy")
    private DraftConfig drafts = new DraftConfig();

    @JsonProperty("export")
    @JsonPropertyDescription("Manifest and uploader hand-off")
    private ExportConfig export = new ExportConfig();

    public StorageConfig getStorage() {
        return storage;
    }

    public CrawlerConfig getCrawler() {
        return crawler;
    }

    public OcrConfig getOcr() {
        return ocr;
    }

    public MatcherConfig getMatcher() {
        return matcher;
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    public DraftConfig getDrafts() {
        return drafts;
    }

    public ExportConfig getExport() {
        return export;
    }
}
