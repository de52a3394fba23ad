package de.bsommerfeld.slideshow.pipeline.matching;

import com.google.inject.Singleton;
import de.bsommerfeld.slideshow.core.config.MatcherConfig;
import de.bsommerfeld.slideshow.core.domain.CrawlPost;
import de.bsommerfeld.slideshow.core.domain.MatchStatus;
import de.bsommerfeld.slideshow.core.domain.PostFormatMatch;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.StageCompletedEvent;
import de.bsommerfeld.slideshow.core.exception.MissingPrerequisiteException;
import de.bsommerfeld.slideshow.db.DatabaseService;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Assigns every crawled post its most similar format.
 *
 * <p>
 * Confidence is {@code textWeight * jaccard(caption, fingerprint)} plus
 * {@code structureWeight * exp(-(avgSlides - target)^2 / priorWidth)}, clamped
 * to {@code [0, 1]}. The target slide count depends on the post's engagement
 * density. A best confidence below the threshold leaves the post for manual
 * review without a format.
 */
@Singleton
public class PostMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(PostMatcher.class);

    private final DatabaseService database;
    private final MatcherConfig config;
    private final PipelineEventBus eventBus;

    @Inject
    public PostMatcher(DatabaseService database, MatcherConfig config, PipelineEventBus eventBus) {
        this.database = database;
        this.config = config;
        this.eventBus = eventBus;
    }

    /** Matches with the configured threshold. */
    public Map<String, Integer> matchAll() {
        return matchAll(config.getThreshold());
    }

    /**
     * Recomputes the match of every crawled post and overwrites the stored
     * results.
     *
     * @return number of matches per status wire name
     * @throws MissingPrerequisiteException if no formats have been normalized
     */
    public Map<String, Integer> matchAll(double threshold) {
        List<FormatFingerprint> fingerprints = FingerprintBuilder.build(database.getFormatExamples(),
                database.getFormatSlides());
        if (fingerprints.isEmpty())
            throw new MissingPrerequisiteException("No formats available. Run ingest-assets first.");

        List<CrawlPost> posts = database.getAllPosts();
        LOG.info("Matching {} posts against {} formats (threshold {})", posts.size(), fingerprints.size(),
                threshold);

        List<PostFormatMatch> matches = new ArrayList<>(posts.size());
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CrawlPost post : posts) {
            PostFormatMatch match = match(post, fingerprints, threshold);
            matches.add(match);
            counts.merge(match.status().wireName(), 1, Integer::sum);
        }
        database.upsertMatches(matches);

        LOG.info("Matching finished: {}", counts);
        eventBus.post(new StageCompletedEvent("match-posts", counts));
        return counts;
    }

    PostFormatMatch match(CrawlPost post, List<FormatFingerprint> fingerprints, double threshold) {
        Set<String> captionTokens = Tokens.tokenize(post.caption());
        double target = post.engagementDensity() > config.getDenseEngagementCutoff()
                ? config.getDenseTargetSlides()
                : config.getSparseTargetSlides();

        FormatFingerprint best = null;
        double bestConfidence = -1.0;
        double bestText = 0.0;
        double bestPrior = 0.0;
        for (FormatFingerprint fingerprint : fingerprints) {
            double text = Tokens.jaccard(captionTokens, fingerprint.tokens());
            double delta = fingerprint.avgSlideCount() - target;
            double prior = Math.exp(-(delta * delta) / config.getPriorWidth());
            double confidence = clamp(config.getTextWeight() * text + config.getStructureWeight() * prior);
            // strict comparison keeps the first format on ties
            if (confidence > bestConfidence) {
                best = fingerprint;
                bestConfidence = confidence;
                bestText = text;
                bestPrior = prior;
            }
        }

        List<String> reasons = List.of(
                "caption_token_similarity=" + format(bestText),
                "structure_prior=" + format(bestPrior));
        if (best == null || bestConfidence < threshold)
            return new PostFormatMatch(post.postId(), null, null, Math.max(bestConfidence, 0.0),
                    MatchStatus.NEEDS_REVIEW, reasons);
        return new PostFormatMatch(post.postId(), best.formatName(), best.firstExampleId(), bestConfidence,
                MatchStatus.AUTO_MATCHED, reasons);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
