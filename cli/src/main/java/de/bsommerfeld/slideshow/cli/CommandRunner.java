package de.bsommerfeld.slideshow.cli;

import de.bsommerfeld.slideshow.core.config.DraftConfig;
import de.bsommerfeld.slideshow.core.domain.Draft;
import de.bsommerfeld.slideshow.crawler.AccountsFile;
import de.bsommerfeld.slideshow.crawler.ProfileCrawler;
import de.bsommerfeld.slideshow.db.DatabaseService;
import de.bsommerfeld.slideshow.pipeline.assets.AssetsNormalizer;
import de.bsommerfeld.slideshow.pipeline.drafts.DraftGenerator;
import de.bsommerfeld.slideshow.pipeline.drafts.DraftRequest;
import de.bsommerfeld.slideshow.pipeline.export.DraftExporter;
import de.bsommerfeld.slideshow.pipeline.export.ManifestSlide;
import de.bsommerfeld.slideshow.pipeline.matching.PostMatcher;
import de.bsommerfeld.slideshow.pipeline.scoring.FormatScorer;
import jakarta.inject.Inject;
import jakarta.inject.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Maps a parsed command line onto one pipeline operation and returns the
 * object to print as its JSON summary.
 */
public class CommandRunner {

    private static final Logger LOG = LoggerFactory.getLogger(CommandRunner.class);

    private final DatabaseService database;
    private final Provider<ProfileCrawler> crawler;
    private final Provider<AssetsNormalizer> normalizer;
    private final Provider<PostMatcher> matcher;
    private final Provider<FormatScorer> scorer;
    private final Provider<DraftGenerator> generator;
    private final Provider<DraftExporter> exporter;
    private final DraftConfig draftConfig;

    @Inject
    public CommandRunner(DatabaseService database, Provider<ProfileCrawler> crawler,
            Provider<AssetsNormalizer> normalizer, Provider<PostMatcher> matcher, Provider<FormatScorer> scorer,
            Provider<DraftGenerator> generator, Provider<DraftExporter> exporter, DraftConfig draftConfig) {
        this.database = database;
        this.crawler = crawler;
        this.normalizer = normalizer;
        this.matcher = matcher;
        this.scorer = scorer;
        this.generator = generator;
        this.exporter = exporter;
        this.draftConfig = draftConfig;
    }

    Object execute(CommandLine cmd) {
        switch (cmd.command()) {
            case "init-db":
                return initDb();
            case "backfill":
                return backfill(cmd);
            case "ingest-assets":
                return normalizer.get().normalize(Path.of(cmd.require("assets-root")), cmd.flag("with-ocr"));
            case "match-posts":
                return cmd.doubleOption("threshold")
                        .map(t -> matcher.get().matchAll(t))
                        .orElseGet(() -> matcher.get().matchAll());
            case "score-formats":
                return scorer.get().scoreAll();
            case "make-drafts":
                return makeDrafts(cmd);
            case "export-draft":
                return exportDraft(cmd);
            case "report":
                return database.getReport();
            default:
                throw new UsageException("Unknown command: " + cmd.command());
        }
    }

    private Object initDb() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("ok", true);
        result.put("db", database.getDatabasePath().toAbsolutePath().toString());
        return result;
    }

    private Object backfill(CommandLine cmd) {
        List<String> accounts = AccountsFile.read(Path.of(cmd.require("accounts-file")));
        if (cmd.flag("headed"))
            LOG.warn("--headed has no effect, profiles are fetched over plain HTTP");
        return crawler.get().crawl(accounts, cmd.intOption("max-posts-per-account").orElse(null));
    }

    private Object makeDrafts(CommandLine cmd) {
        DraftRequest request = new DraftRequest(
                cmd.require("topic"),
                cmd.intOption("count").orElseThrow(() -> new UsageException("make-drafts requires --count")),
                cmd.listOption("account-scope"),
                cmd.doubleOption("explore-ratio").orElse(draftConfig.getExploreRatio()));
        long seed = cmd.longOption("seed").orElse(draftConfig.getSeed());

        List<Draft> drafts = generator.get().generate(request, new Random(seed));
        List<Map<String, Object>> result = new ArrayList<>(drafts.size());
        for (Draft draft : drafts)
            result.add(summarize(draft));
        return result;
    }

    private static Map<String, Object> summarize(Draft draft) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("draft_id", draft.draftId());
        summary.put("format_name", draft.formatName());
        summary.put("predicted_score", draft.predictedScore());
        summary.put("caption", draft.caption());
        summary.put("rationale", draft.rationale());
        summary.put("slides", draft.slides().stream()
                .map(s -> new ManifestSlide(s.index(), s.role().wireName(), s.text()))
                .toList());
        return summary;
    }

    private Object exportDraft(CommandLine cmd) {
        String draftId = cmd.require("draft-id");
        Path manifest = cmd.option("output-root")
                .map(root -> exporter.get().export(draftId, Path.of(root)))
                .orElseGet(() -> exporter.get().export(draftId));
        return Map.of("manifest", manifest.toString());
    }
}
