package de.bsommerfeld.slideshow.db;

import de.bsommerfeld.slideshow.core.domain.CrawlFailure;
import de.bsommerfeld.slideshow.core.domain.CrawlPost;
import de.bsommerfeld.slideshow.core.domain.Draft;
import de.bsommerfeld.slideshow.core.domain.ExportRecord;
import de.bsommerfeld.slideshow.core.domain.FormatExample;
import de.bsommerfeld.slideshow.core.domain.FormatScore;
import de.bsommerfeld.slideshow.core.domain.FormatSlide;
import de.bsommerfeld.slideshow.core.domain.MatchStatus;
import de.bsommerfeld.slideshow.core.domain.NormalizationIssue;
import de.bsommerfeld.slideshow.core.domain.PostFormatMatch;
import de.bsommerfeld.slideshow.core.domain.SlideRole;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the pipeline. Every method is one short-lived
 * transaction; a failing write is rolled back and surfaces as
 * {@link de.bsommerfeld.slideshow.core.exception.StorageException}.
 *
 * <p>
 * Each table has exactly one writer:
 * <ul>
 * <li>crawler: {@link #upsertPost}, {@link #recordFailure}</li>
 * <li>assets normalizer: {@link #replaceCorpus}</li>
 * <li>matcher: {@link #upsertMatches}</li>
 * <li>scorer: {@link #replaceScores}</li>
 * <li>draft generator: {@link #saveDrafts}</li>
 * <li>exporter: {@link #recordExport}</li>
 * </ul>
 */
public interface DatabaseService {

    /** Location of the backing store. */
    Path getDatabasePath();

    // -- Crawl --

    /**
     * Inserts the post or overwrites every column of the row with the same
     * {@code post_id}.
     */
    void upsertPost(CrawlPost post);

    /** Appends a diagnostic row; failures are never updated or deleted. */
    void recordFailure(CrawlFailure failure);

    /** All crawled posts ordered by post id. */
    List<CrawlPost> getAllPosts();

    List<CrawlFailure> getFailures();

    // -- Corpus --

    /**
     * Deletes the current examples, slides and issues and inserts the given
     * ones in a single transaction. On failure the previous corpus stays
     * intact.
     */
    void replaceCorpus(List<FormatExample> examples, List<FormatSlide> slides, List<NormalizationIssue> issues);

    /** Ordered by format name, then example id. */
    List<FormatExample> getFormatExamples();

    /** Ordered by format name, example id, slide index. */
    List<FormatSlide> getFormatSlides();

    List<NormalizationIssue> getNormalizationIssues();

    /**
     * Stored roles of every slide of the format, ordered by example id and
     * slide index. Slides without a role are skipped.
     */
    List<SlideRole> getRolesForFormat(String formatName);

    // -- Matching --

    /** Upserts all matches keyed by post id in one transaction. */
    void upsertMatches(List<PostFormatMatch> matches);

    Optional<PostFormatMatch> getMatch(String postId);

    /**
     * Changes the review status of an existing match.
     *
     * @return {@code false} if no match exists for the post
     */
    boolean updateMatchStatus(String postId, MatchStatus status);

    /**
     * Posts whose match is {@code auto_matched} or {@code approved} with a
     * non-null format.
     */
    List<MatchedPost> getScorablePosts();

    // -- Scoring --

    /**
     * Replaces the whole score table with the given rows in one transaction.
     * An empty list clears it.
     */
    void replaceScores(List<FormatScore> scores);

    /**
     * Stored scores, restricted to the given account handles. An empty scope
     * returns every score.
     */
    List<FormatScore> getScores(Collection<String> accountScope);

    // -- Drafts & exports --

    /** Inserts the drafts with their slides in one transaction. */
    void saveDrafts(List<Draft> drafts);

    Optional<Draft> findDraft(String draftId);

    void recordExport(ExportRecord export);

    List<ExportRecord> getExports(String draftId);

    PipelineReport getReport();
}
