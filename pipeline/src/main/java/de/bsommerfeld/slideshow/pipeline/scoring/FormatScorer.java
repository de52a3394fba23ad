package de.bsommerfeld.slideshow.pipeline.scoring;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import com.google.inject.Singleton;
import de.bsommerfeld.slideshow.core.config.ScoringConfig;
import de.bsommerfeld.slideshow.core.domain.FormatScore;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.StageCompletedEvent;
import de.bsommerfeld.slideshow.db.DatabaseService;
import de.bsommerfeld.slideshow.db.MatchedPost;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the proxy virality score of every (format, account) pair from the
 * posts matched to it.
 *
 * <p>
 * Views are z-scored against the account's own mean and sample standard
 * deviation so that large and small accounts compare. Each averaged term is
 * passed through {@link #squash(double)} before the weighted sum, which keeps
 * the score in {@code [0, 1)}.
 */
@Singleton
public class FormatScorer {

    private static final Logger LOG = LoggerFactory.getLogger(FormatScorer.class);

    private final DatabaseService database;
    private final ScoringConfig config;
    private final PipelineEventBus eventBus;

    @Inject
    public FormatScorer(DatabaseService database, ScoringConfig config, PipelineEventBus eventBus) {
        this.database = database;
        this.config = config;
        this.eventBus = eventBus;
    }

    public ScoringSummary scoreAll() {
        List<MatchedPost> posts = database.getScorablePosts();
        List<FormatScore> scores = computeScores(posts);
        database.replaceScores(scores);

        ScoringSummary summary = new ScoringSummary(scores.size(), posts.size());
        LOG.info("Scored {} format/account pairs from {} posts", summary.formatAccountScores(),
                summary.postsUsed());
        eventBus.post(new StageCompletedEvent("score-formats", summary));
        return summary;
    }

    /**
     * @return one score per (format, account), ordered by account then format
     */
    List<FormatScore> computeScores(List<MatchedPost> posts) {
        ImmutableListMultimap<String, MatchedPost> byAccount = Multimaps.index(posts, MatchedPost::accountHandle);

        Map<String, double[]> accountStats = new HashMap<>();
        for (String account : byAccount.keySet())
            accountStats.put(account, meanAndStdDev(byAccount.get(account)));

        Map<String, Map<String, List<MatchedPost>>> groups = new TreeMap<>();
        for (MatchedPost post : posts)
            groups.computeIfAbsent(post.accountHandle(), k -> new TreeMap<>())
                    .computeIfAbsent(post.formatName(), k -> new ArrayList<>())
                    .add(post);

        List<FormatScore> scores = new ArrayList<>();
        for (Map.Entry<String, Map<String, List<MatchedPost>>> account : groups.entrySet()) {
            double[] stats = accountStats.get(account.getKey());
            for (Map.Entry<String, List<MatchedPost>> format : account.getValue().entrySet())
                scores.add(score(format.getKey(), account.getKey(), format.getValue(), stats[0], stats[1]));
        }
        return scores;
    }

    private FormatScore score(String formatName, String account, List<MatchedPost> group, double mu, double sigma) {
        double normViews = 0.0;
        double shares = 0.0;
        double comments = 0.0;
        double likes = 0.0;
        for (MatchedPost post : group) {
            double denominator = Math.max(1L, post.views());
            normViews += sigma == 0.0 ? 0.0 : (post.views() - mu) / sigma;
            shares += post.shares() / denominator * 1000.0;
            comments += post.comments() / denominator * 1000.0;
            likes += post.likes() / denominator * 1000.0;
        }
        int n = group.size();
        normViews /= n;
        shares /= n;
        comments /= n;
        likes /= n;

        double proxy = config.getViewsWeight() * squash(normViews)
                + config.getSharesWeight() * squash(shares / config.getSharesScale())
                + config.getCommentsWeight() * squash(comments / config.getCommentsScale())
                + config.getLikesWeight() * squash(likes / config.getLikesScale());

        return new FormatScore(formatName, account, normViews, shares, comments, likes, proxy, n);
    }

    /** {@code x / (1 + x)} for positive input, 0 otherwise. */
    public static double squash(double x) {
        if (x <= 0.0)
            return 0.0;
        return x / (1.0 + x);
    }

    /** Mean and sample standard deviation ({@code n - 1}); deviation is 0 below two samples. */
    static double[] meanAndStdDev(List<MatchedPost> posts) {
        double mean = posts.stream().mapToLong(MatchedPost::views).average().orElse(0.0);
        if (posts.size() < 2)
            return new double[] { mean, 0.0 };
        double sumSq = 0.0;
        for (MatchedPost post : posts) {
            double d = post.views() - mean;
            sumSq += d * d;
        }
        return new double[] { mean, Math.sqrt(sumSq / (posts.size() - 1)) };
    }
}
