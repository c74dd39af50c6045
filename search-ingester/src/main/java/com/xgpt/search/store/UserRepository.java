package com.xgpt.search.store;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;

/**
 * Minimal author rows for tweets discovered by search. Full profiles are filled in by the
 * user scraper, which is not part of this module.
 */
@Repository
@RequiredArgsConstructor
public class UserRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * @param id      row id of the user
     * @param created true only when this call inserted the row
     */
    public record EnsureResult(long id, boolean created) {
    }

    /**
     * Looks the user up by username, inserting a basic row if none exists. An existing row
     * gets its display name refreshed when one is supplied.
     */
    public EnsureResult ensureUser(String username, String displayName) {
        Instant now = clock.instant();
        int inserted = jdbcTemplate.update("""
                INSERT INTO users (username, display_name, created_at, updated_at, last_scraped)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (username) DO NOTHING
                """,
                username, displayName, now.toEpochMilli(), now.toEpochMilli(), now.toEpochMilli());

        if (inserted == 0 && displayName != null) {
            jdbcTemplate.update(
                    "UPDATE users SET display_name = ?, updated_at = ?, last_scraped = ? WHERE username = ?",
                    displayName, now.toEpochMilli(), now.toEpochMilli(), username);
        }

        Long id = jdbcTemplate.queryForObject("SELECT id FROM users WHERE username = ?", Long.class, username);
        if (id == null) {
            throw new IllegalStateException("User row missing after upsert: " + username);
        }
        return new EnsureResult(id, inserted > 0);
    }
}
