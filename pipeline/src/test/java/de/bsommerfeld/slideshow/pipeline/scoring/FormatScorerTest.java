package de.bsommerfeld.slideshow.pipeline.scoring;

import de.bsommerfeld.slideshow.core.config.MatcherConfig;
import de.bsommerfeld.slideshow.core.config.ScoringConfig;
import de.bsommerfeld.slideshow.core.domain.FormatScore;
import de.bsommerfeld.slideshow.core.domain.MatchStatus;
import de.bsommerfeld.slideshow.core.domain.PostFormatMatch;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.db.MatchedPost;
import de.bsommerfeld.slideshow.db.SqlDatabaseService;
import de.bsommerfeld.slideshow.pipeline.PipelineFixtures;
import de.bsommerfeld.slideshow.pipeline.matching.PostMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormatScorerTest {

    @TempDir
    Path tempDir;

    private SqlDatabaseService db;
    private FormatScorer scorer;

    @BeforeEach
    void setUp() {
        db = new SqlDatabaseService(tempDir.resolve("score.db"));
        scorer = new FormatScorer(db, new ScoringConfig(), new PipelineEventBus());
    }

    @Test
    void squash_shouldBeZeroForNonPositiveInput() {
        assertEquals(0.0, FormatScorer.squash(0.0));
        assertEquals(0.0, FormatScorer.squash(-3.0));
    }

    @Test
    void squash_shouldIncreaseMonotonicallyBelowOne() {
        double previous = 0.0;
        for (double x = 0.5; x < 1e6; x *= 3) {
            double value = FormatScorer.squash(x);
            assertTrue(value > previous);
            assertTrue(value < 1.0);
            previous = value;
        }
        assertEquals(0.5, FormatScorer.squash(1.0));
    }

    @Test
    void computeScores_shouldCombineSquashedTerms() {
        MatchedPost post = new MatchedPost("p1", "acc", "alpha", 1_000, 100, 10, 20);

        List<FormatScore> scores = scorer.computeScores(List.of(post));

        assertEquals(1, scores.size());
        FormatScore score = scores.get(0);
        assertEquals(0.0, score.normalizedViews());
        assertEquals(20.0, score.sharesPer1k(), 1e-9);
        assertEquals(10.0, score.commentsPer1k(), 1e-9);
        assertEquals(100.0, score.likesPer1k(), 1e-9);
        // 0.30 * squash(1) + 0.15 * squash(0.5) + 0.15 * squash(1)
        assertEquals(0.15 + 0.05 + 0.075, score.proxyScore(), 1e-9);
        assertEquals(1, score.sampleSize());
    }

    @Test
    void computeScores_shouldNormalizeViewsPerAccount() {
        List<FormatScore> scores = scorer.computeScores(List.of(
                new MatchedPost("p1", "acc", "alpha", 10_000, 1_200, 150, 120),
                new MatchedPost("p2", "acc", "beta", 8_000, 500, 60, 40),
                new MatchedPost("p3", "acc", "alpha", 25_000, 3_500, 400, 500),
                new MatchedPost("q1", "other", "alpha", 500, 5, 0, 0)));

        assertEquals(3, scores.size());
        FormatScore alpha = scores.get(0);
        FormatScore beta = scores.get(1);
        assertEquals("alpha", alpha.formatName());
        assertEquals(2, alpha.sampleSize());
        assertEquals("beta", beta.formatName());
        // z-scores of one account sum to zero
        assertEquals(0.0, alpha.normalizedViews() * 2 + beta.normalizedViews(), 1e-9);
        assertTrue(alpha.proxyScore() > beta.proxyScore());

        FormatScore lone = scores.get(2);
        assertEquals("other", lone.accountHandle());
        assertEquals(0.0, lone.normalizedViews());
        scores.forEach(s -> assertTrue(s.proxyScore() >= 0.0 && s.proxyScore() < 1.0));
    }

    @Test
    void computeScores_shouldZeroViewsWhenAllEqual() {
        List<FormatScore> scores = scorer.computeScores(List.of(
                new MatchedPost("p1", "acc", "alpha", 5_000, 10, 1, 1),
                new MatchedPost("p2", "acc", "beta", 5_000, 20, 2, 2)));

        scores.forEach(s -> assertEquals(0.0, s.normalizedViews()));
    }

    @Test
    void computeScores_shouldGuardZeroViews() {
        List<FormatScore> scores = scorer.computeScores(List.of(
                new MatchedPost("p1", "acc", "alpha", 0, 0, 0, 1)));

        assertEquals(1_000.0, scores.get(0).sharesPer1k(), 1e-9);
    }

    @Test
    void scoreAll_shouldOnlyUseAutoMatchedAndApprovedPosts() {
        db.upsertPost(PipelineFixtures.post("p1", "acc", "x", 1_000, 10, 1, 1));
        db.upsertPost(PipelineFixtures.post("p2", "acc", "y", 2_000, 20, 2, 2));
        db.upsertPost(PipelineFixtures.post("p3", "acc", "z", 3_000, 30, 3, 3));
        db.upsertMatches(List.of(
                new PostFormatMatch("p1", "alpha", "1", 0.9, MatchStatus.AUTO_MATCHED, List.of()),
                new PostFormatMatch("p2", "beta", "1", 0.9, MatchStatus.APPROVED, List.of()),
                new PostFormatMatch("p3", null, null, 0.1, MatchStatus.NEEDS_REVIEW, List.of())));

        ScoringSummary summary = scorer.scoreAll();

        assertEquals(new ScoringSummary(2, 2), summary);
        assertEquals(2, db.getScores(List.of()).size());
    }

    @Test
    void scoreAll_shouldDropScoresOfPostsNoLongerMatched() {
        PipelineFixtures.seedAlphaBeta(db);
        db.upsertPost(PipelineFixtures.post("p1", "acc", "alpha glow routine", 10_000, 1_200, 150, 120));
        PostMatcher matcher = new PostMatcher(db, new MatcherConfig(), new PipelineEventBus());

        matcher.matchAll(0.0);
        scorer.scoreAll();
        assertEquals(1, db.getScores(List.of()).size());

        matcher.matchAll(1.01);
        ScoringSummary summary = scorer.scoreAll();

        assertEquals(new ScoringSummary(0, 0), summary);
        assertTrue(db.getScores(List.of()).isEmpty());
    }
}
