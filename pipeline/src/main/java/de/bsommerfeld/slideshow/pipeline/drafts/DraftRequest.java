package de.bsommerfeld.slideshow.pipeline.drafts;

import java.util.List;

/**
 * Parameters of one {@code make-drafts} invocation.
 *
 * @param topic        topic the copy is written for
 * @param count        number of drafts, at least 1
 * @param accountScope account handles to rank with; empty means all accounts
 * @param exploreRatio probability of an explore pick, in {@code [0, 1]}
 */
public record DraftRequest(String topic, int count, List<String> accountScope, double exploreRatio) {

    public DraftRequest {
        if (topic == null || topic.isBlank())
            throw new IllegalArgumentException("topic must not be blank");
        if (count <= 0)
            throw new IllegalArgumentException("count must be > 0");
        if (exploreRatio < 0.0 || exploreRatio > 1.0)
            throw new IllegalArgumentException("explore ratio must be within [0, 1], was " + exploreRatio);
        accountScope = accountScope != null ? List.copyOf(accountScope) : List.of();
    }
}
