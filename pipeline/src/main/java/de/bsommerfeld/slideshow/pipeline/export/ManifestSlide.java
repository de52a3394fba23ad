package de.bsommerfeld.slideshow.pipeline.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({ "index", "role", "text" })
public record ManifestSlide(
        @JsonProperty("index") int index,
        @JsonProperty("role") String role,
        @JsonProperty("text") String text) {
}
