package de.bsommerfeld.slideshow.core.domain;

/**
 * Review state of a {@link PostFormatMatch}. Only {@link #AUTO_MATCHED} and
 * {@link #APPROVED} matches feed into scoring.
 */
public enum MatchStatus {

    AUTO_MATCHED("auto_matched"),
    NEEDS_REVIEW("needs_review"),
    /** Set by a human reviewer outside the pipeline. */
    APPROVED("approved");

    private final String wireName;

    MatchStatus(String wireName) {
        this.wireName = wireName;
    }

    /** The lower snake case name used in the store and in JSON output. */
    public String wireName() {
        return wireName;
    }

    public boolean countsForScoring() {
        return this == AUTO_MATCHED || this == APPROVED;
    }

    /**
     * Resolves a stored status value.
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static MatchStatus fromWire(String value) {
        for (MatchStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value))
                return status;
        }
        throw new IllegalArgumentException("Unknown match status: " + value);
    }
}
