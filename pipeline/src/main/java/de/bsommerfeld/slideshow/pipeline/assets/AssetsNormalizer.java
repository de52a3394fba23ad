package de.bsommerfeld.slideshow.pipeline.assets;

import com.google.inject.Singleton;
import de.bsommerfeld.slideshow.core.domain.FormatExample;
import de.bsommerfeld.slideshow.core.domain.FormatSlide;
import de.bsommerfeld.slideshow.core.domain.NormalizationIssue;
import de.bsommerfeld.slideshow.core.domain.SlideRole;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.event.PipelineEvents.StageCompletedEvent;
import de.bsommerfeld.slideshow.core.exception.MissingPrerequisiteException;
import de.bsommerfeld.slideshow.db.DatabaseService;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rebuilds the reference corpus tables from
 * {@code <assets-root>/formats/<format name>/<example>.<slide>.<ext>}.
 *
 * <p>
 * The directory is the single source of truth: every run replaces examples,
 * slides and issues wholesale in one transaction. Image files whose names do
 * not follow the convention become {@code non_standard_filename} issues;
 * other files are ignored. Slides are ordered by index and their role is
 * inferred from their position within the example.
 */
@Singleton
public class AssetsNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(AssetsNormalizer.class);

    static final String FORMATS_DIR = "formats";
    static final String DUPLICATE_SLIDE_INDEX = "duplicate_slide_index";

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp");
    private static final Pattern SLIDE_FILE = Pattern.compile("^(\\d+)\\.(\\d{1,9})\\.([A-Za-z]+)$");

    private final DatabaseService database;
    private final OcrExtractor ocr;
    private final PipelineEventBus eventBus;

    @Inject
    public AssetsNormalizer(DatabaseService database, OcrExtractor ocr, PipelineEventBus eventBus) {
        this.database = database;
        this.ocr = ocr;
        this.eventBus = eventBus;
    }

    /**
     * @param assetsRoot directory containing {@code formats/}
     * @param withOcr    run OCR on every stored slide
     * @throws MissingPrerequisiteException if {@code formats/} does not exist
     */
    public NormalizationResult normalize(Path assetsRoot, boolean withOcr) {
        Path formatsDir = assetsRoot.resolve(FORMATS_DIR);
        if (!Files.isDirectory(formatsDir))
            throw new MissingPrerequisiteException("Missing formats directory: " + formatsDir);

        LOG.info("Normalizing corpus at {} (ocr: {})", formatsDir.toAbsolutePath(), withOcr);
        Instant now = Instant.now();
        List<NormalizationIssue> issues = new ArrayList<>();
        Map<String, Map<String, TreeMap<Integer, Path>>> groups = new LinkedHashMap<>();

        for (Path formatDir : sortedChildren(formatsDir, Files::isDirectory)) {
            String formatName = formatDir.getFileName().toString();
            for (Path file : sortedChildren(formatDir, Files::isRegularFile)) {
                String fileName = file.getFileName().toString();
                if (!isImage(fileName))
                    continue;

                Matcher m = SLIDE_FILE.matcher(fileName);
                if (!m.matches()) {
                    issues.add(issue(formatName, file, NormalizationIssue.NON_STANDARD_FILENAME, fileName, now));
                    continue;
                }

                String exampleId = m.group(1);
                int slideIndex = Integer.parseInt(m.group(2));
                TreeMap<Integer, Path> slides = groups
                        .computeIfAbsent(formatName, k -> new LinkedHashMap<>())
                        .computeIfAbsent(exampleId, k -> new TreeMap<>());
                if (slides.containsKey(slideIndex)) {
                    issues.add(issue(formatName, file, DUPLICATE_SLIDE_INDEX,
                            fileName + " repeats slide " + slideIndex + " of example " + exampleId, now));
                    continue;
                }
                slides.put(slideIndex, file);
            }
        }

        List<FormatExample> examples = new ArrayList<>();
        List<FormatSlide> slides = new ArrayList<>();
        for (Map.Entry<String, Map<String, TreeMap<Integer, Path>>> format : groups.entrySet()) {
            for (Map.Entry<String, TreeMap<Integer, Path>> example : format.getValue().entrySet()) {
                TreeMap<Integer, Path> ordered = example.getValue();
                examples.add(new FormatExample(format.getKey(), example.getKey(), ordered.size()));

                int position = 0;
                for (Map.Entry<Integer, Path> slide : ordered.entrySet()) {
                    position++;
                    Path file = slide.getValue().toAbsolutePath();
                    String ocrText = withOcr ? ocr.extract(file).orElse(null) : null;
                    SlideRole role = SlideRole.inferFromPosition(position, ordered.size());
                    slides.add(new FormatSlide(format.getKey(), example.getKey(), slide.getKey(),
                            file.toString(), ocrText, role));
                }
            }
        }

        database.replaceCorpus(examples, slides, issues);

        NormalizationResult result = new NormalizationResult(groups.size(), examples.size(), slides.size(),
                issues.size());
        LOG.info("Corpus normalized: {}", result);
        eventBus.post(new StageCompletedEvent("ingest-assets", result));
        return result;
    }

    private static boolean isImage(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && IMAGE_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static NormalizationIssue issue(String formatName, Path file, String type, String detail,
            Instant now) {
        LOG.debug("Corpus issue in {}: {} ({})", formatName, type, detail);
        return new NormalizationIssue(formatName, file.toAbsolutePath().toString(), type, detail, now);
    }

    private static List<Path> sortedChildren(Path dir, Predicate<Path> filter) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.filter(filter)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }
}
