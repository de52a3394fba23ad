package de.bsommerfeld.slideshow.pipeline.assets;

import de.bsommerfeld.slideshow.core.domain.FormatExample;
import de.bsommerfeld.slideshow.core.domain.FormatSlide;
import de.bsommerfeld.slideshow.core.domain.NormalizationIssue;
import de.bsommerfeld.slideshow.core.domain.SlideRole;
import de.bsommerfeld.slideshow.core.event.PipelineEventBus;
import de.bsommerfeld.slideshow.core.exception.MissingPrerequisiteException;
import de.bsommerfeld.slideshow.db.SqlDatabaseService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssetsNormalizerTest {

    @TempDir
    Path tempDir;

    @Mock
    private OcrExtractor ocr;

    private SqlDatabaseService db;
    private AssetsNormalizer normalizer;
    private Path assetsRoot;

    @BeforeEach
    void setUp() throws IOException {
        db = new SqlDatabaseService(tempDir.resolve("assets.db"));
        normalizer = new AssetsNormalizer(db, ocr, new PipelineEventBus());
        assetsRoot = tempDir.resolve("assets");

        touch("alpha", "1.1.png", "1.2.png", "1.3.png", "2.1.jpg", "2.2.JPG", "cover.png", "notes.txt");
        touch("beta", "7.1.webp", "7.2.webp", "7.3.webp", "7.4.webp");
    }

    private void touch(String format, String... names) throws IOException {
        Path dir = Files.createDirectories(assetsRoot.resolve("formats").resolve(format));
        for (String name : names)
            Files.createFile(dir.resolve(name));
    }

    @Test
    void normalize_shouldGroupSlidesByFormatAndExample() {
        NormalizationResult result = normalizer.normalize(assetsRoot, false);

        assertEquals(new NormalizationResult(2, 3, 9, 1), result);
        assertEquals(List.of(
                new FormatExample("alpha", "1", 3),
                new FormatExample("alpha", "2", 2),
                new FormatExample("beta", "7", 4)), db.getFormatExamples());
        verifyNoInteractions(ocr);
    }

    @Test
    void normalize_shouldInferRolesFromPosition() {
        normalizer.normalize(assetsRoot, false);

        List<SlideRole> roles = db.getFormatSlides().stream().map(FormatSlide::role).toList();
        assertEquals(List.of(
                SlideRole.HOOK, SlideRole.SETUP, SlideRole.CTA,
                SlideRole.HOOK, SlideRole.CTA,
                SlideRole.HOOK, SlideRole.SETUP, SlideRole.REVEAL, SlideRole.CTA), roles);
    }

    @Test
    void normalize_shouldRecordNonStandardImageNamesOnly() {
        normalizer.normalize(assetsRoot, false);

        List<NormalizationIssue> issues = db.getNormalizationIssues();
        assertEquals(1, issues.size());
        NormalizationIssue issue = issues.get(0);
        assertEquals("alpha", issue.formatName());
        assertEquals(NormalizationIssue.NON_STANDARD_FILENAME, issue.issueType());
        assertEquals("cover.png", issue.detail());
        assertTrue(issue.filePath().endsWith("cover.png"));
    }

    @Test
    void normalize_shouldFlagDuplicateSlideIndex() throws IOException {
        touch("beta", "7.02.webp");

        NormalizationResult result = normalizer.normalize(assetsRoot, false);

        assertEquals(9, result.slides());
        assertEquals(2, result.issues());
        assertTrue(db.getNormalizationIssues().stream()
                .anyMatch(i -> AssetsNormalizer.DUPLICATE_SLIDE_INDEX.equals(i.issueType())));
    }

    @Test
    void normalize_shouldAttachOcrTextWhenEnabled() {
        when(ocr.extract(any())).thenReturn(Optional.empty());
        when(ocr.extract(argThat(p -> p.endsWith("1.1.png")))).thenReturn(Optional.of("glow routine"));

        normalizer.normalize(assetsRoot, true);

        List<FormatSlide> slides = db.getFormatSlides();
        assertEquals("glow routine", slides.get(0).ocrText());
        assertNull(slides.get(1).ocrText());
        verify(ocr, times(9)).extract(any());
    }

    @Test
    void normalize_shouldReplacePreviousCorpus() throws IOException {
        normalizer.normalize(assetsRoot, false);
        Files.delete(assetsRoot.resolve("formats/alpha/2.1.jpg"));
        Files.delete(assetsRoot.resolve("formats/alpha/2.2.JPG"));
        Files.delete(assetsRoot.resolve("formats/alpha/cover.png"));

        NormalizationResult result = normalizer.normalize(assetsRoot, false);

        assertEquals(new NormalizationResult(2, 2, 7, 0), result);
        assertEquals(7, db.getFormatSlides().size());
        assertTrue(db.getNormalizationIssues().isEmpty());
    }

    @Test
    void normalize_shouldRejectMissingFormatsDirectory() {
        assertThrows(MissingPrerequisiteException.class,
                () -> normalizer.normalize(tempDir.resolve("nowhere"), false));
    }
}
