package de.bsommerfeld.slideshow.pipeline.matching;

import de.bsommerfeld.slideshow.core.config.MatcherConfig;
import de.bsommerfeld.slideshow.core.domain.MatchStatus;
import de.bsommerfeld.slideshow.core.domain.PostFormatMatch;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.exception.MissingPrerequisiteException;
import de.bsommerfeld.slideshow.db.SqlDatabaseService;
import de.bsommerfeld.slideshow.pipeline.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PostMatcherTest {

    @TempDir
    Path tempDir;

    private SqlDatabaseService db;
    private PostMatcher matcher;

    @BeforeEach
    void setUp() {
        db = new SqlDatabaseService(tempDir.resolve("match.db"));
        matcher = new PostMatcher(db, new MatcherConfig(), new PipelineEventBus());
    }

    @Test
    void matchAll_shouldAutoMatchSimilarCaption() {
        PipelineFixtures.seedAlphaBeta(db);
        db.upsertPost(PipelineFixtures.post("p1", "acc", "my glow routine", 10_000, 1_200, 150, 120));

        Map<String, Integer> counts = matcher.matchAll(0.4);

        assertEquals(Map.of("auto_matched", 1), counts);
        PostFormatMatch match = db.getMatch("p1").orElseThrow();
        assertEquals("alpha", match.formatName());
        assertEquals("1", match.exampleId());
        assertEquals(MatchStatus.AUTO_MATCHED, match.status());
        // 0.75 * 0.4 + 0.25 * exp(-4 / 9)
        assertEquals(0.75 * 0.4 + 0.25 * Math.exp(-4.0 / 9.0), match.confidence(), 1e-9);
        assertEquals(List.of("caption_token_similarity=0.400", "structure_prior=0.641"), match.reasons());
    }

    @Test
    void matchAll_shouldLeaveLowConfidenceForReview() {
        PipelineFixtures.seedAlphaBeta(db);
        db.upsertPost(PipelineFixtures.post("p2", "acc", null, 0, 0, 0, 0));

        Map<String, Integer> counts = matcher.matchAll(0.4);

        assertEquals(Map.of("needs_review", 1), counts);
        PostFormatMatch match = db.getMatch("p2").orElseThrow();
        assertEquals(MatchStatus.NEEDS_REVIEW, match.status());
        assertNull(match.formatName());
        assertNull(match.exampleId());
        assertTrue(match.confidence() >= 0.0 && match.confidence() < 0.4);
    }

    @Test
    void matchAll_shouldPreferLongerFormatsForSparseEngagement() {
        PipelineFixtures.seedAlphaBeta(db);
        db.upsertPost(PipelineFixtures.post("p3", "acc", "", 1_000, 1, 0, 0));

        matcher.matchAll(0.0);

        // no text overlap; beta's 4 slides sit closer to the sparse target of 7
        assertEquals("beta", db.getMatch("p3").orElseThrow().formatName());
    }

    @Test
    void matchAll_shouldBeIdempotent() {
        PipelineFixtures.seedAlphaBeta(db);
        db.upsertPost(PipelineFixtures.post("p1", "acc", "my glow routine", 10_000, 1_200, 150, 120));
        db.upsertPost(PipelineFixtures.post("p2", "acc", "lip liner", 8_000, 500, 60, 40));

        matcher.matchAll(0.0);
        PostFormatMatch first = db.getMatch("p2").orElseThrow();
        matcher.matchAll(0.0);

        assertEquals(first, db.getMatch("p2").orElseThrow());
        assertEquals(2L, (long) db.getReport().matches().get("auto_matched"));
    }

    @Test
    void matchAll_shouldFailWithoutFormats() {
        db.upsertPost(PipelineFixtures.post("p1", "acc", "glow", 100, 1, 1, 1));

        assertThrows(MissingPrerequisiteException.class, () -> matcher.matchAll(0.4));
    }

    @Test
    void match_shouldKeepConfidenceWithinUnitInterval() {
        var fingerprint = new FormatFingerprint("glow", Set.of("glow"), 5.0, List.of("1"), Map.of());
        MatcherConfig config = new MatcherConfig();
        PostMatcher standalone = new PostMatcher(db, config, new PipelineEventBus());

        PostFormatMatch match = standalone.match(
                PipelineFixtures.post("p", "acc", "glow", 100, 50, 10, 10), List.of(fingerprint), 0.4);

        assertEquals(1.0, match.confidence(), 1e-9);
        assertEquals(MatchStatus.AUTO_MATCHED, match.status());
    }
}
