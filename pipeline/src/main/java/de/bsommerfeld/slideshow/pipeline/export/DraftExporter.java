package de.bsommerfeld.slideshow.pipeline.export;

import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.slideshow.core.config.ExportConfig;
import de.bsommerfeld.slideshow.core.domain.Draft;
import de.bsommerfeld.slideshow.core.domain.ExportRecord;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.StageCompletedEvent;
import de.bsommerfeld.slideshow.core.exception.DraftNotFoundException;
import de.bsommerfeld.slideshow.db.DatabaseService;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Writes a stored draft to {@code <output-root>/<draft id>/} as
 * {@code manifest.json} plus a single-row {@code uploader_row.csv} and appends
 * an export audit row. Re-exporting overwrites both files.
 */
@Singleton
public class DraftExporter {

    private static final Logger LOG = LoggerFactory.getLogger(DraftExporter.class);

    static final String MANIFEST_FILE = "manifest.json";
    static final String UPLOADER_FILE = "uploader_row.csv";
    static final String UPLOADER_HEADER = "file_type,account_id,mode,caption,video_path,image_paths,platform,client_ref";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .build();

    private final DatabaseService database;
    private final ExportConfig config;
    private final PipelineEventBus eventBus;

    @Inject
    public DraftExporter(DatabaseService database, ExportConfig config, PipelineEventBus eventBus) {
        this.database = database;
        this.config = config;
        this.eventBus = eventBus;
    }

    /** Exports below the configured output root. */
    public Path export(String draftId) {
        return export(draftId, Path.of(config.getOutputRoot()));
    }

    /**
     * @return path of the written manifest
     * @throws DraftNotFoundException if no draft has the id
     */
    public Path export(String draftId, Path outputRoot) {
        Draft draft = database.findDraft(draftId).orElseThrow(() -> new DraftNotFoundException(draftId));

        Path outputDir = outputRoot.resolve(draftId).toAbsolutePath();
        Path manifestPath = outputDir.resolve(MANIFEST_FILE);
        try {
            Files.createDirectories(outputDir);
            MAPPER.writeValue(manifestPath.toFile(), DraftManifest.of(draft));
            Files.writeString(outputDir.resolve(UPLOADER_FILE), uploaderCsv(draft), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export draft " + draftId + " to " + outputDir, e);
        }

        database.recordExport(new ExportRecord(draftId, outputDir.toString(), manifestPath.toString(),
                Instant.now()));
        LOG.info("Exported draft {} to {}", draftId, outputDir);
        eventBus.post(new StageCompletedEvent("export-draft", manifestPath));
        return manifestPath;
    }

    String uploaderCsv(Draft draft) {
        return UPLOADER_HEADER + "\n"
                + "slideshow,," + config.getMode() + ",\"" + escapeCsv(draft.caption()) + "\",,\"\","
                + config.getPlatform() + "," + draft.draftId() + "\n";
    }

    static String escapeCsv(String value) {
        return value == null ? "" : value.replace("\"", "\"\"");
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }
}
