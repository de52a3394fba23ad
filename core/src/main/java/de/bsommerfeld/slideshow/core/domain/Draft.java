package de.bsommerfeld.slideshow.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * A generated, review-only slideshow candidate. Drafts are never published by
 * the pipeline; status changes after {@link #STATUS_REVIEW} happen elsewhere.
 *
 * @param draftId        opaque id ({@code d_} + 12 hex chars)
 * @param topic          topic the copy was generated for
 * @param objective      optimization objective tag
 * @param formatName     sampled format
 * @param predictedScore ranked proxy score of the format at generation time
 * @param rationale      ordered explanation of the choice
 * @param caption        post caption
 * @param status         lifecycle state
 * @param createdAt      generation time
 * @param slides         ordered slides
 */
public record Draft(
        String draftId,
        String topic,
        String objective,
        String formatName,
        double predictedScore,
        List<String> rationale,
        String caption,
        String status,
        Instant createdAt,
        List<DraftSlide> slides) {

    public static final String STATUS_REVIEW = "review";

    public Draft {
        rationale = rationale != null ? List.copyOf(rationale) : List.of();
        slides = slides != null ? List.copyOf(slides) : List.of();
    }
}
