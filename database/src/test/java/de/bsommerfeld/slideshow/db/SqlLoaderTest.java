package de.bsommerfeld.slideshow.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SqlLoader reads from "sql/{name}.sql". The schema.sql lives at the root
 * classpath level and is NOT loaded through SqlLoader.
 */
class SqlLoaderTest {

    @Test
    void load_shouldReturnUpsertPost() {
        String sql = SqlLoader.load("upsert-post");
        assertNotNull(sql);
        assertTrue(sql.toLowerCase().contains("on conflict(post_id)"));
    }

    @Test
    void load_shouldReturnScorablePostsJoin() {
        String sql = SqlLoader.load("select-scorable-posts");
        assertTrue(sql.toLowerCase().contains("join post_format_matches"));
        assertTrue(sql.contains("'auto_matched'"));
        assertTrue(sql.contains("'approved'"));
    }

    @Test
    void load_shouldTrimTrailingWhitespace() {
        String sql = SqlLoader.load("insert-export");
        assertEquals(sql.trim(), sql);
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = SqlLoader.load("upsert-score");
        String second = SqlLoader.load("upsert-score");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        assertThrows(IllegalStateException.class,
                () -> SqlLoader.load("nonexistent-sql-file"));
    }
}
