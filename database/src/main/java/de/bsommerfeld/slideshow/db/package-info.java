/**
 * Persistence layer of the pipeline, backed by a single SQLite file.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Crawler / Pipeline stages / CLI]
 *        │
 *        ▼
 *   DatabaseService      ← interface, one method per conceptual operation
 *        │
 *        ▼
 *   SqlDatabaseService   ← JDBC, one short-lived connection per call
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 *   crawl_posts            PK post_id                 upserted by the crawler
 *   crawl_failures         append-only                crawler diagnostics
 *   format_examples        UQ (format, example)       replaced per normalization
 *   format_slides          UQ (format, example, idx)  replaced per normalization
 *   normalization_issues   advisory                   replaced per normalization
 *   post_format_matches    PK post_id                 upserted by the matcher
 *   format_scores          UQ (format, account)       replaced per scoring run
 *   drafts                 PK draft_id                inserted by the generator
 *   draft_slides           UQ (draft, idx)            inserted with their draft
 *   exports                append-only                export audit trail
 * </pre>
 *
 * List columns ({@code reasons_json}, {@code rationale_json}) hold JSON arrays
 * and timestamps are ISO-8601 UTC text. Engagement counters carry
 * {@code CHECK (... >= 0)} constraints.
 *
 * <h2>SQL files</h2>
 * The DDL lives in {@code schema.sql}; every statement is a file under
 * {@code sql/} named {@code <verb>-<entity>.sql} and loaded through
 * {@link de.bsommerfeld.slideshow.db.SqlLoader}.
 */
package de.bsommerfeld.slideshow.db;
