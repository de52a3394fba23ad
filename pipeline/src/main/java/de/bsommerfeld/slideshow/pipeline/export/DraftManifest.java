package de.bsommerfeld.slideshow.pipeline.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.bsommerfeld.slideshow.core.domain.Draft;

import java.util.List;

/**
 * The {@code manifest.json} document handed to reviewers and the uploader.
 * Roles are written with their wire names.
 */
@JsonPropertyOrder({ "draft_id", "topic", "objective", "format_name", "predicted_score", "rationale", "caption",
        "status", "slides" })
public record DraftManifest(
        @JsonProperty("draft_id") String draftId,
        @JsonProperty("topic") String topic,
        @JsonProperty("objective") String objective,
        @JsonProperty("format_name") String formatName,
        @JsonProperty("predicted_score") double predictedScore,
        @JsonProperty("rationale") List<String> rationale,
        @JsonProperty("caption") String caption,
        @JsonProperty("status") String status,
        @JsonProperty("slides") List<ManifestSlide> slides) {

    public static DraftManifest of(Draft draft) {
        List<ManifestSlide> slides = draft.slides().stream()
                .map(s -> new ManifestSlide(s.index(), s.role().wireName(), s.text()))
                .toList();
        return new DraftManifest(draft.draftId(), draft.topic(), draft.objective(), draft.formatName(),
                draft.predictedScore(), draft.rationale(), draft.caption(), draft.status(), slides);
    }
}
