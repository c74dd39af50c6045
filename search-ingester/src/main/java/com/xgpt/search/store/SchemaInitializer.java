package com.xgpt.search.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the SQLite tables the ingester writes to. Every statement is idempotent, so this
 * runs on every startup and before every test.
 *
 * Timestamps are stored as epoch milliseconds.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring SQLite schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS users
            (
                id                  INTEGER PRIMARY KEY AUTOINCREMENT,
                username            TEXT    NOT NULL UNIQUE,
                display_name        TEXT,
                created_at          INTEGER NOT NULL,
                updated_at          INTEGER NOT NULL,
                last_scraped        INTEGER
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tweets
            (
                id                  TEXT    PRIMARY KEY,
                text                TEXT    NOT NULL,
                user_id             INTEGER NOT NULL REFERENCES users (id),
                username            TEXT    NOT NULL,
                created_at          INTEGER NOT NULL,
                scraped_at          INTEGER NOT NULL,
                is_retweet          INTEGER NOT NULL DEFAULT 0,
                is_reply            INTEGER NOT NULL DEFAULT 0,
                like_count          INTEGER NOT NULL DEFAULT 0,
                retweet_count       INTEGER NOT NULL DEFAULT 0,
                reply_count         INTEGER NOT NULL DEFAULT 0,
                metadata            TEXT
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS search_topics
            (
                id                  INTEGER PRIMARY KEY AUTOINCREMENT,
                name                TEXT    NOT NULL UNIQUE,
                variants            TEXT    NOT NULL,
                created_at          INTEGER NOT NULL,
                updated_at          INTEGER NOT NULL,
                last_searched       INTEGER,
                total_tweets_found  INTEGER NOT NULL DEFAULT 0
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS search_sessions
            (
                id                  INTEGER PRIMARY KEY AUTOINCREMENT,
                topic_id            INTEGER REFERENCES search_topics (id),
                query               TEXT    NOT NULL,
                variants            TEXT    NOT NULL,
                search_mode         TEXT    NOT NULL DEFAULT 'Latest',
                max_tweets          INTEGER NOT NULL,
                date_start          INTEGER,
                date_end            INTEGER,
                cursor              TEXT,
                last_tweet_id       TEXT,
                tweets_collected    INTEGER NOT NULL DEFAULT 0,
                total_processed     INTEGER NOT NULL DEFAULT 0,
                duplicates_skipped  INTEGER NOT NULL DEFAULT 0,
                users_created       INTEGER NOT NULL DEFAULT 0,
                status              TEXT    NOT NULL DEFAULT 'pending',
                started_at          INTEGER NOT NULL,
                completed_at        INTEGER,
                error_message       TEXT,
                embeddings_generated INTEGER NOT NULL DEFAULT 0
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS tweet_search_origins
            (
                id                  INTEGER PRIMARY KEY AUTOINCREMENT,
                tweet_id            TEXT    NOT NULL UNIQUE REFERENCES tweets (id),
                search_session_id   INTEGER NOT NULL REFERENCES search_sessions (id),
                matched_variant     TEXT    NOT NULL,
                found_at            INTEGER NOT NULL
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS jobs
            (
                id                  TEXT    PRIMARY KEY,
                type                TEXT    NOT NULL,
                status              TEXT    NOT NULL,
                progress_current    INTEGER NOT NULL DEFAULT 0,
                progress_total      INTEGER NOT NULL DEFAULT 0,
                progress_message    TEXT,
                started_at          INTEGER NOT NULL,
                completed_at        INTEGER,
                metadata            TEXT,
                error_message       TEXT
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_tweets_user_id ON tweets (user_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_search_sessions_status ON search_sessions (status)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_search_sessions_started_at ON search_sessions (started_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_tweet_search_origins_session ON tweet_search_origins (search_session_id)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs (status)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_jobs_started_at ON jobs (started_at)");

        log.info("SQLite schema ready.");
    }
}
