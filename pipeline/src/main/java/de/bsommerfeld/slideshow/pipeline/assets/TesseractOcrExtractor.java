package de.bsommerfeld.slideshow.pipeline.assets;

import com.google.inject.Singleton;
import de.bsommerfeld.slideshow.core.config.OcrConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs the local {@code tesseract} binary as
 * {@code tesseract <image> stdout --dpi <dpi>}. Output is collected through a
 * temporary file so the timeout also bounds reading.
 *
 * <p>
 * A missing binary, a timeout, a non-zero exit code or blank output all
 * yield {@link Optional#empty()}.
 */
@Singleton
public class TesseractOcrExtractor implements OcrExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(TesseractOcrExtractor.class);

    private final OcrConfig config;

    @Inject
    public TesseractOcrExtractor(OcrConfig config) {
        this.config = config;
    }

    @Override
    public Optional<String> extract(Path image) {
        Path output = null;
        try {
            output = Files.createTempFile("slideshow-ocr", ".txt");
            ProcessBuilder pb = new ProcessBuilder(command(image));
            pb.redirectOutput(output.toFile());
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);

            Process process = pb.start();
            if (!process.waitFor(config.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                LOG.warn("OCR timed out after {}s for {}", config.getTimeoutSeconds(), image);
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                LOG.debug("OCR exited with {} for {}", process.exitValue(), image);
                return Optional.empty();
            }
            return clean(Files.readString(output, StandardCharsets.UTF_8), config.getMaxChars());
        } catch (IOException e) {
            LOG.debug("OCR unavailable for {}: {}", image, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            deleteQuietly(output);
        }
    }

    List<String> command(Path image) {
        return List.of(config.getCommand(), image.toString(), "stdout", "--dpi", String.valueOf(config.getDpi()));
    }

    /** Collapses whitespace and truncates; blank text is empty. */
    static Optional<String> clean(String raw, int maxChars) {
        if (raw == null)
            return Optional.empty();
        String text = raw.strip().replaceAll("\\s+", " ");
        if (text.isEmpty())
            return Optional.empty();
        return Optional.of(text.length() > maxChars ? text.substring(0, maxChars) : text);
    }

    private static void deleteQuietly(Path file) {
        if (file == null)
            return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.debug("Could not delete OCR temp file {}", file, e);
        }
    }
}
