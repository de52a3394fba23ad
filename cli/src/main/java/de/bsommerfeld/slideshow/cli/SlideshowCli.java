package de.bsommerfeld.slideshow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.slideshow.core.config.ConfigLoader;
import de.bsommerfeld.slideshow.core.config.GlobalConfig;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point of {@code slideshow-machine}. Prints one JSON document per
 * invocation to standard output; logs go to standard error and the log file.
 *
 * <p>
 * Exit status: 0 on success, 1 when the command failed, 2 on a malformed
 * command line.
 */
public final class SlideshowCli {

    static {
        // LOG_DIR must be set before logback initializes
        Path logDir = StorageUtils.getLogsDir(StorageUtils.APP_NAME);
        try {
            if (!Files.exists(logDir)) {
                Files.createDirectories(logDir);
            }
            if (System.getProperty("LOG_DIR") == null) {
                System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
            }
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SlideshowCli.class);

    static final String USAGE = String.join("\n",
            "Usage: slideshow-machine [--db PATH] [--config PATH] <command> [options]",
            "",
            "Commands:",
            "  init-db",
            "  backfill --accounts-file PATH [--max-posts-per-account N] [--headed]",
            "  ingest-assets --assets-root DIR [--with-ocr]",
            "  match-posts [--threshold F]",
            "  score-formats",
            "  make-drafts --topic T --count N [--account-scope a,b] [--explore-ratio F] [--seed N]",
            "  export-draft --draft-id ID [--output-root DIR]",
            "  report");

    static final ObjectMapper JSON = JsonMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private SlideshowCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one command.
     *
     * @return the process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLine cmd;
        try {
            cmd = CommandLine.parse(args);
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }
        if (cmd.flag("help")) {
            out.println(USAGE);
            return 0;
        }

        try {
            Path configPath = cmd.option("config").map(Path::of).orElse(StorageUtils.getDefaultConfigPath());
            GlobalConfig config = ConfigLoader.load(configPath);
            Injector injector = Guice.createInjector(
                    new AppModule(config, cmd.option("db").map(Path::of).orElse(null)));
            injector.getInstance(PipelineEventBus.class).register(new ProgressLogger());

            Object result = injector.getInstance(CommandRunner.class).execute(cmd);
            out.println(toJson(result));
            return 0;
        } catch (UsageException | IllegalArgumentException e) {
            out.println(toJson(error(e)));
            err.println(USAGE);
            return 2;
        } catch (RuntimeException e) {
            LOG.error("{} failed", cmd.command(), e);
            out.println(toJson(error(e)));
            return 1;
        }
    }

    private static Map<String, Object> error(RuntimeException e) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("ok", false);
        error.put("error", e.getClass().getSimpleName());
        error.put("message", e.getMessage());
        return error;
    }

    static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
