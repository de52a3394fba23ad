package de.bsommerfeld.slideshow.cli;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.slideshow.core.config.CrawlerConfig;
import de.bsommerfeld.slideshow.core.config.DraftConfig;
import de.bsommerfeld.slideshow.core.config.ExportConfig;
import de.bsommerfeld.slideshow.core.config.GlobalConfig;
import de.bsommerfeld.slideshow.core.config.MatcherConfig;
import de.bsommerfeld.slideshow.core.config.OcrConfig;
import de.bsommerfeld.slideshow.core.config.ScoringConfig;
import de.bsommerfeld.slideshow.core.util.StorageUtils;
import de.bsommerfeld.slideshow.crawler.HttpProfileBrowser;
import de.bsommerfeld.slideshow.crawler.ProfileBrowser;
import de.bsommerfeld.slideshow.db.DatabaseService;
import de.bsommerfeld.slideshow.db.SqlDatabaseService;
import de.bsommerfeld.slideshow.pipeline.assets.OcrExtractor;
import de.bsommerfeld.slideshow.pipeline.assets.TesseractOcrExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module for the command line application. The configuration is loaded
 * before the injector is built and bound as instances.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final GlobalConfig config;
    private final Path databaseOverride;

    /**
     * @param config           loaded configuration
     * @param databaseOverride {@code --db} value, or {@code null}
     */
    public AppModule(GlobalConfig config, Path databaseOverride) {
        this.config = config;
        this.databaseOverride = databaseOverride;
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);

        // Sub-configs for direct injection
        bind(CrawlerConfig.class).toInstance(config.getCrawler());
        bind(OcrConfig.class).toInstance(config.getOcr());
        bind(MatcherConfig.class).toInstance(config.getMatcher());
        bind(ScoringConfig.class).toInstance(config.getScoring());
        bind(DraftConfig.class).toInstance(config.getDrafts());
        bind(ExportConfig.class).toInstance(config.getExport());

        bind(ProfileBrowser.class).to(HttpProfileBrowser.class);
        bind(OcrExtractor.class).to(TesseractOcrExtractor.class);
    }

    @Provides
    @Singleton
    DatabaseService provideDatabase() {
        Path path = resolveDatabasePath(config, databaseOverride);
        LOG.info("Using database {}", path.toAbsolutePath());
        return new SqlDatabaseService(path);
    }

    /** {@code --db} wins over {@code [storage] database-path}, which wins over the app-data default. */
    static Path resolveDatabasePath(GlobalConfig config, Path override) {
        if (override != null)
            return override;
        String configured = config.getStorage().getDatabasePath();
        if (configured != null && !configured.isBlank())
            return Path.of(configured);
        return StorageUtils.getDefaultDatabasePath();
    }
}
