package de.bsommerfeld.slideshow.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.slideshow.core.domain.CrawlFailure;
import de.bsommerfeld.slideshow.core.domain.CrawlPost;
import de.bsommerfeld.slideshow.core.domain.Draft;
import de.bsommerfeld.slideshow.core.domain.DraftSlide;
import de.bsommerfeld.slideshow.core.domain.ExportRecord;
import de.bsommerfeld.slideshow.core.domain.FormatExample;
import de.bsommerfeld.slideshow.core.domain.FormatScore;
import de.bsommerfeld.slideshow.core.domain.FormatSlide;
import de.bsommerfeld.slideshow.core.domain.MatchStatus;
import de.bsommerfeld.slideshow.core.domain.NormalizationIssue;
import de.bsommerfeld.slideshow.core.domain.PostFormatMatch;
import de.bsommerfeld.slideshow.core.domain.SlideRole;
import de.bsommerfeld.slideshow.core.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite-backed {@link DatabaseService}.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on construction; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. The pipeline never runs two writers against the same file, so
 * pooling provides no benefit.
 *
 * <h3>Transaction boundaries</h3>
 * Multi-statement writes (corpus replacement, batch upserts, draft saves)
 * use explicit transactions with rollback-on-failure. Single-statement
 * writes use auto-commit. Every {@link SQLException} is rethrown as
 * {@link StorageException}.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final Path databasePath;
    private final String dbUrl;

    public SqlDatabaseService(Path databasePath) {
        this.databasePath = databasePath.toAbsolutePath();
        Path parent = this.databasePath.getParent();
        try {
            if (parent != null && !Files.exists(parent))
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StorageException("Failed to create database directory " + parent, e);
        }
        this.dbUrl = "jdbc:sqlite:" + this.databasePath;
        initialize();
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl);
    }

    @Override
    public Path getDatabasePath() {
        return databasePath;
    }

    private void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
            }
            applySchema(conn);
        } catch (SQLException e) {
            throw new StorageException("Database initialization failed", e);
        }
    }

    /**
     * Applies the full DDL from {@code schema.sql}. Splits on semicolons at
     * line ends and executes each statement individually inside one
     * transaction.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql;
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (schemaStream == null)
                throw new SQLException("schema.sql not found on classpath");
            schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema.sql", e);
        }

        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                String statement = stripComments(sql);
                if (statement.isEmpty())
                    continue;
                stmt.execute(statement);
            }
            conn.commit();
            LOG.debug("Database schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    private static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder();
        for (String line : sql.split("\\r?\\n")) {
            if (line.trim().startsWith("--"))
                continue;
            sb.append(line).append('\n');
        }
        return sb.toString().trim();
    }

    // =====================================================================
    // Crawl
    // =====================================================================

    @Override
    public void upsertPost(CrawlPost post) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-post"))) {
            ps.setString(1, post.postId());
            ps.setString(2, post.postUrl());
            ps.setString(3, post.accountHandle());
            ps.setString(4, toText(post.postedAt()));
            ps.setString(5, post.caption());
            ps.setLong(6, post.views());
            ps.setLong(7, post.likes());
            ps.setLong(8, post.comments());
            ps.setLong(9, post.shares());
            ps.setString(10, toText(post.collectedAt()));
            ps.setString(11, post.source());
            ps.setDouble(12, post.confidence());
            ps.executeUpdate();
            LOG.debug("[DB] Upserted post {} of @{}", post.postId(), post.accountHandle());
        } catch (SQLException e) {
            throw new StorageException("Failed to save post " + post.postId(), e);
        }
    }

    @Override
    public void recordFailure(CrawlFailure failure) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-failure"))) {
            ps.setString(1, failure.accountHandle());
            ps.setString(2, failure.postUrl());
            ps.setString(3, failure.reason());
            ps.setString(4, toText(failure.collectedAt()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to record crawl failure for @" + failure.accountHandle(), e);
        }
    }

    @Override
    public List<CrawlPost> getAllPosts() {
        List<CrawlPost> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-posts"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                result.add(mapPost(rs));
        } catch (SQLException e) {
            throw new StorageException("Failed to load posts", e);
        }
        return result;
    }

    @Override
    public List<CrawlFailure> getFailures() {
        List<CrawlFailure> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-failures"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(new CrawlFailure(
                        rs.getString("account_handle"), rs.getString("post_url"),
                        rs.getString("reason"), toInstant(rs.getString("collected_at"))));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load crawl failures", e);
        }
        return result;
    }

    // =====================================================================
    // Corpus
    // =====================================================================

    /**
     * Full replace: three deletes followed by the bulk inserts, committed
     * together.
     */
    @Override
    public void replaceCorpus(List<FormatExample> examples, List<FormatSlide> slides,
            List<NormalizationIssue> issues) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (Statement stmt = conn.createStatement()) {
                    stmt.executeUpdate(SqlLoader.load("delete-format-examples"));
                    stmt.executeUpdate(SqlLoader.load("delete-format-slides"));
                    stmt.executeUpdate(SqlLoader.load("delete-normalization-issues"));
                }
                insertExamples(conn, examples);
                insertSlides(conn, slides);
                insertIssues(conn, issues);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.info("[DB] Replaced corpus: {} examples, {} slides, {} issues.",
                    examples.size(), slides.size(), issues.size());
        } catch (SQLException e) {
            LOG.error("Corpus replacement rolled back", e);
            throw new StorageException("Failed to replace format corpus", e);
        }
    }

    private void insertExamples(Connection conn, List<FormatExample> examples) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-format-example"))) {
            for (FormatExample e : examples) {
                ps.setString(1, e.formatName());
                ps.setString(2, e.exampleId());
                ps.setInt(3, e.slideCount());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertSlides(Connection conn, List<FormatSlide> slides) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-format-slide"))) {
            for (FormatSlide s : slides) {
                ps.setString(1, s.formatName());
                ps.setString(2, s.exampleId());
                ps.setInt(3, s.slideIndex());
                ps.setString(4, s.filePath());
                ps.setString(5, s.ocrText());
                ps.setString(6, s.role() != null ? s.role().wireName() : null);
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertIssues(Connection conn, List<NormalizationIssue> issues) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-normalization-issue"))) {
            for (NormalizationIssue i : issues) {
                ps.setString(1, i.formatName());
                ps.setString(2, i.filePath());
                ps.setString(3, i.issueType());
                ps.setString(4, i.detail());
                ps.setString(5, toText(i.createdAt()));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    @Override
    public List<FormatExample> getFormatExamples() {
        List<FormatExample> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-format-examples"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(new FormatExample(
                        rs.getString("format_name"), rs.getString("example_id"), rs.getInt("slide_count")));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load format examples", e);
        }
        return result;
    }

    @Override
    public List<FormatSlide> getFormatSlides() {
        List<FormatSlide> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-format-slides"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String role = rs.getString("role");
                result.add(new FormatSlide(
                        rs.getString("format_name"), rs.getString("example_id"),
                        rs.getInt("slide_index"), rs.getString("file_path"),
                        rs.getString("ocr_text"), role != null ? SlideRole.fromWire(role) : null));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load format slides", e);
        }
        return result;
    }

    @Override
    public List<NormalizationIssue> getNormalizationIssues() {
        List<NormalizationIssue> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-normalization-issues"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(new NormalizationIssue(
                        rs.getString("format_name"), rs.getString("file_path"),
                        rs.getString("issue_type"), rs.getString("detail"),
                        toInstant(rs.getString("created_at"))));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load normalization issues", e);
        }
        return result;
    }

    @Override
    public List<SlideRole> getRolesForFormat(String formatName) {
        List<SlideRole> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-roles-for-format"))) {
            ps.setString(1, formatName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    result.add(SlideRole.fromWire(rs.getString("role")));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load roles for format " + formatName, e);
        }
        return result;
    }

    // =====================================================================
    // Matching
    // =====================================================================

    @Override
    public void upsertMatches(List<PostFormatMatch> matches) {
        if (matches == null || matches.isEmpty())
            return;

        String now = Instant.now().toString();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-match"))) {
                for (PostFormatMatch m : matches) {
                    ps.setString(1, m.postId());
                    ps.setString(2, m.formatName());
                    ps.setString(3, m.exampleId());
                    ps.setDouble(4, m.confidence());
                    ps.setString(5, m.status().wireName());
                    ps.setString(6, toJson(m.reasons()));
                    ps.setString(7, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.debug("[DB] Upserted {} matches.", matches.size());
        } catch (SQLException e) {
            LOG.error("Match upsert rolled back", e);
            throw new StorageException("Failed to save matches", e);
        }
    }

    @Override
    public Optional<PostFormatMatch> getMatch(String postId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-match"))) {
            ps.setString(1, postId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new PostFormatMatch(
                            rs.getString("post_id"), rs.getString("format_name"),
                            rs.getString("example_id"), rs.getDouble("confidence"),
                            MatchStatus.fromWire(rs.getString("status")),
                            fromJson(rs.getString("reasons_json"))));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load match for post " + postId, e);
        }
        return Optional.empty();
    }

    @Override
    public boolean updateMatchStatus(String postId, MatchStatus status) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-match-status"))) {
            ps.setString(1, status.wireName());
            ps.setString(2, Instant.now().toString());
            ps.setString(3, postId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to update match status of post " + postId, e);
        }
    }

    @Override
    public List<MatchedPost> getScorablePosts() {
        List<MatchedPost> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-scorable-posts"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(new MatchedPost(
                        rs.getString("post_id"), rs.getString("account_handle"),
                        rs.getString("format_name"), rs.getLong("views"),
                        rs.getLong("likes"), rs.getLong("comments"), rs.getLong("shares")));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load scorable posts", e);
        }
        return result;
    }

    // =====================================================================
    // Scoring
    // =====================================================================

    /**
     * Scores are derived data: the previous run is deleted and the new rows
     * inserted in the same transaction.
     */
    @Override
    public void replaceScores(List<FormatScore> scores) {
        List<FormatScore> rows = scores == null ? List.of() : scores;

        String now = Instant.now().toString();
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement();
                    PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-score"))) {
                stmt.executeUpdate(SqlLoader.load("delete-format-scores"));
                for (FormatScore s : rows) {
                    ps.setString(1, s.formatName());
                    ps.setString(2, s.accountHandle());
                    ps.setDouble(3, s.normalizedViews());
                    ps.setDouble(4, s.sharesPer1k());
                    ps.setDouble(5, s.commentsPer1k());
                    ps.setDouble(6, s.likesPer1k());
                    ps.setDouble(7, s.proxyScore());
                    ps.setInt(8, s.sampleSize());
                    ps.setString(9, now);
                    ps.addBatch();
                }
                if (!rows.isEmpty())
                    ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.debug("[DB] Replaced format scores with {} rows.", rows.size());
        } catch (SQLException e) {
            LOG.error("Score replacement rolled back", e);
            throw new StorageException("Failed to save format scores", e);
        }
    }

    @Override
    public List<FormatScore> getScores(Collection<String> accountScope) {
        Set<String> scope = accountScope == null ? Set.of() : new HashSet<>(accountScope);
        List<FormatScore> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-scores"));
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String account = rs.getString("account_handle");
                if (!scope.isEmpty() && !scope.contains(account))
                    continue;
                result.add(new FormatScore(
                        rs.getString("format_name"), account,
                        rs.getDouble("normalized_views"), rs.getDouble("shares_per_1k"),
                        rs.getDouble("comments_per_1k"), rs.getDouble("likes_per_1k"),
                        rs.getDouble("proxy_score"), rs.getInt("sample_size")));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load format scores", e);
        }
        return result;
    }

    // =====================================================================
    // Drafts & exports
    // =====================================================================

    @Override
    public void saveDrafts(List<Draft> drafts) {
        if (drafts == null || drafts.isEmpty())
            return;

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement psDraft = conn.prepareStatement(SqlLoader.load("insert-draft"));
                    PreparedStatement psSlide = conn.prepareStatement(SqlLoader.load("insert-draft-slide"))) {
                for (Draft d : drafts) {
                    psDraft.setString(1, d.draftId());
                    psDraft.setString(2, d.topic());
                    psDraft.setString(3, d.objective());
                    psDraft.setString(4, d.formatName());
                    psDraft.setDouble(5, d.predictedScore());
                    psDraft.setString(6, toJson(d.rationale()));
                    psDraft.setString(7, d.caption());
                    psDraft.setString(8, d.status());
                    psDraft.setString(9, toText(d.createdAt()));
                    psDraft.addBatch();

                    for (DraftSlide s : d.slides()) {
                        psSlide.setString(1, d.draftId());
                        psSlide.setInt(2, s.index());
                        psSlide.setString(3, s.role().wireName());
                        psSlide.setString(4, s.text());
                        psSlide.addBatch();
                    }
                }
                psDraft.executeBatch();
                psSlide.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            LOG.info("[DB] Saved {} drafts.", drafts.size());
        } catch (SQLException e) {
            LOG.error("Draft save rolled back", e);
            throw new StorageException("Failed to save drafts", e);
        }
    }

    @Override
    public Optional<Draft> findDraft(String draftId) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-draft"))) {
            ps.setString(1, draftId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                return Optional.of(new Draft(
                        rs.getString("draft_id"), rs.getString("topic"),
                        rs.getString("objective"), rs.getString("format_name"),
                        rs.getDouble("predicted_score"), fromJson(rs.getString("rationale_json")),
                        rs.getString("caption"), rs.getString("status"),
                        toInstant(rs.getString("created_at")), loadDraftSlides(conn, draftId)));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load draft " + draftId, e);
        }
    }

    private List<DraftSlide> loadDraftSlides(Connection conn, String draftId) throws SQLException {
        List<DraftSlide> slides = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-draft-slides"))) {
            ps.setString(1, draftId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    slides.add(new DraftSlide(
                            rs.getInt("slide_index"), SlideRole.fromWire(rs.getString("role")),
                            rs.getString("text")));
                }
            }
        }
        return slides;
    }

    @Override
    public void recordExport(ExportRecord export) {
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-export"))) {
            ps.setString(1, export.draftId());
            ps.setString(2, export.outputDir());
            ps.setString(3, export.manifestPath());
            ps.setString(4, toText(export.createdAt()));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to record export of draft " + export.draftId(), e);
        }
    }

    @Override
    public List<ExportRecord> getExports(String draftId) {
        List<ExportRecord> result = new ArrayList<>();
        try (Connection conn = getConnection();
                PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-exports-for-draft"))) {
            ps.setString(1, draftId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new ExportRecord(
                            rs.getString("draft_id"), rs.getString("output_dir"),
                            rs.getString("manifest_path"), toInstant(rs.getString("created_at"))));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load exports of draft " + draftId, e);
        }
        return result;
    }

    @Override
    public PipelineReport getReport() {
        try (Connection conn = getConnection()) {
            Map<String, Long> matches = new LinkedHashMap<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-matches-by-status"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    matches.put(rs.getString("status"), rs.getLong("c"));
            }
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-rows"));
                    ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new PipelineReport(
                        rs.getLong("posts"), rs.getLong("crawl_failures"),
                        rs.getLong("normalization_issues"), matches,
                        rs.getLong("format_scores"), rs.getLong("drafts"), rs.getLong("exports"));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to build report", e);
        }
    }

    // =====================================================================
    // ResultSet → Domain Mapping
    // =====================================================================

    private CrawlPost mapPost(ResultSet rs) throws SQLException {
        return new CrawlPost(
                rs.getString("post_id"), rs.getString("post_url"),
                rs.getString("account_handle"), toInstant(rs.getString("posted_at")),
                rs.getString("caption"), rs.getLong("views"), rs.getLong("likes"),
                rs.getLong("comments"), rs.getLong("shares"),
                toInstant(rs.getString("collected_at")), rs.getString("source"),
                rs.getDouble("confidence"));
    }

    private static String toText(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant toInstant(String text) {
        return text != null && !text.isEmpty() ? Instant.parse(text) : null;
    }

    private static String toJson(List<String> values) throws SQLException {
        try {
            return JSON.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to serialize list column", e);
        }
    }

    private static List<String> fromJson(String json) throws SQLException {
        if (json == null || json.isEmpty())
            return List.of();
        try {
            return JSON.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt list column: " + json, e);
        }
    }
}
