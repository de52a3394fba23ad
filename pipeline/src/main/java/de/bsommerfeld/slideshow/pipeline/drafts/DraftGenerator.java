package de.bsommerfeld.slideshow.pipeline.drafts;

import com.google.inject.Singleton;
import de.bsommerfeld.slideshow.core.config.DraftConfig;
import de.bsommerfeld.slideshow.core.domain.Draft;
import de.bsommerfeld.slideshow.core.domain.DraftSlide;
import de.bsommerfeld.slideshow.core.domain.FormatScore;
import de.bsommerfeld.slideshow.core.domain.SlideRole;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.StageCompletedEvent;
import de.bsommerfeld.slideshow.core.exception.NoRankedFormatsException;
import de.bsommerfeld.slideshow.db.DatabaseService;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Generates review-only drafts by sampling ranked formats.
 *
 * <p>
 * Each draft exploits (uniform pick among the top {@code exploit-pool-size}
 * formats) or, with probability {@code exploreRatio} and only when more than
 * two formats are ranked, explores the formats below the exploit pool. The
 * random source is an explicit argument; the same seed over the same store
 * picks the same formats and copy.
 */
@Singleton
public class DraftGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(DraftGenerator.class);

    static final List<SlideRole> DEFAULT_ROLES = List.of(SlideRole.HOOK, SlideRole.SETUP, SlideRole.PROOF,
            SlideRole.REVEAL, SlideRole.CTA);

    private final DatabaseService database;
    private final DraftConfig config;
    private final PipelineEventBus eventBus;

    @Inject
    public DraftGenerator(DatabaseService database, DraftConfig config, PipelineEventBus eventBus) {
        this.database = database;
        this.config = config;
        this.eventBus = eventBus;
    }

    /** Generates with a generator seeded from the configured seed. */
    public List<Draft> generate(DraftRequest request) {
        return generate(request, new Random(config.getSeed()));
    }

    /**
     * @return the persisted drafts in generation order
     * @throws NoRankedFormatsException if no scores exist for the scope
     */
    public List<Draft> generate(DraftRequest request, Random random) {
        List<RankedFormat> ranked = rankFormats(request.accountScope());
        if (ranked.isEmpty())
            throw new NoRankedFormatsException(request.accountScope());

        LOG.info("Generating {} drafts for '{}' from {} ranked formats", request.count(), request.topic(),
                ranked.size());
        Instant now = Instant.now();
        Map<String, List<SlideRole>> structures = new LinkedHashMap<>();
        List<Draft> drafts = new ArrayList<>(request.count());

        for (int i = 0; i < request.count(); i++) {
            boolean explore = random.nextDouble() < request.exploreRatio() && ranked.size() > 2;
            List<RankedFormat> pool = explore ? explorePool(ranked) : exploitPool(ranked);
            RankedFormat chosen = pool.get(random.nextInt(pool.size()));

            List<SlideRole> roles = structures.computeIfAbsent(chosen.formatName(), this::resolveStructure);
            SlideTextTemplates templates = new SlideTextTemplates(request.topic(), random);
            List<DraftSlide> slides = new ArrayList<>(roles.size());
            for (int idx = 1; idx <= roles.size(); idx++) {
                SlideRole role = roles.get(idx - 1);
                slides.add(new DraftSlide(idx, role, templates.textFor(role, idx, random)));
            }

            List<String> rationale = List.of(
                    "format=" + chosen.formatName(),
                    "mode=" + (explore ? "explore" : "exploit"),
                    "predicted_proxy_score=" + String.format(Locale.ROOT, "%.3f", chosen.score()));
            String caption = request.topic() + " | format: " + chosen.formatName() + " " + config.getHashtags();

            drafts.add(new Draft(newDraftId(), request.topic(), config.getObjective(), chosen.formatName(),
                    chosen.score(), rationale, caption, Draft.STATUS_REVIEW, now, slides));
        }

        database.saveDrafts(drafts);
        eventBus.post(new StageCompletedEvent("make-drafts", drafts.size()));
        return drafts;
    }

    /**
     * Formats ranked by {@code Σ score·max(1, n) / Σ max(1, n)} over the scoped
     * accounts, best first. Ties keep name order.
     */
    List<RankedFormat> rankFormats(List<String> accountScope) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (FormatScore score : database.getScores(accountScope)) {
            int weight = Math.max(1, score.sampleSize());
            double[] acc = sums.computeIfAbsent(score.formatName(), k -> new double[2]);
            acc[0] += score.proxyScore() * weight;
            acc[1] += weight;
        }

        List<RankedFormat> ranked = new ArrayList<>(sums.size());
        sums.forEach((name, acc) -> ranked.add(new RankedFormat(name, acc[0] / acc[1])));
        ranked.sort(Comparator.comparingDouble(RankedFormat::score).reversed()
                .thenComparing(RankedFormat::formatName));
        return ranked;
    }

    private List<RankedFormat> exploitPool(List<RankedFormat> ranked) {
        return ranked.subList(0, Math.min(config.getExploitPoolSize(), ranked.size()));
    }

    // never empty: at least the last ranked format remains
    private List<RankedFormat> explorePool(List<RankedFormat> ranked) {
        return ranked.subList(Math.min(config.getExploitPoolSize(), ranked.size() - 1), ranked.size());
    }

    /**
     * Canonical role sequence of a format: its first stored roles with
     * immediate repeats collapsed, forced to open with a hook and close with a
     * call to action, and bounded by {@code max-roles}.
     */
    List<SlideRole> resolveStructure(String formatName) {
        List<SlideRole> stored = database.getRolesForFormat(formatName);
        if (stored.isEmpty())
            return DEFAULT_ROLES;
        return canonicalize(stored, config.getMaxRoles());
    }

    static List<SlideRole> canonicalize(List<SlideRole> stored, int maxRoles) {
        int max = Math.max(2, maxRoles);
        List<SlideRole> roles = new ArrayList<>();
        for (SlideRole role : stored.subList(0, Math.min(max, stored.size()))) {
            if (roles.isEmpty() || roles.get(roles.size() - 1) != role)
                roles.add(role);
        }
        if (roles.isEmpty() || roles.get(0) != SlideRole.HOOK)
            roles.add(0, SlideRole.HOOK);
        if (roles.get(roles.size() - 1) != SlideRole.CTA)
            roles.add(SlideRole.CTA);
        if (roles.size() > max) {
            roles = new ArrayList<>(roles.subList(0, max - 1));
            if (roles.get(roles.size() - 1) != SlideRole.CTA)
                roles.add(SlideRole.CTA);
        }
        return List.copyOf(roles);
    }

    private static String newDraftId() {
        return "d_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
