package com.xgpt.search.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgpt.search.model.SearchMode;
import com.xgpt.search.model.SearchSession;
import com.xgpt.search.model.SearchStats;
import com.xgpt.search.model.SessionStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.xgpt.search.store.SqlValues.flag;
import static com.xgpt.search.store.SqlValues.instant;
import static com.xgpt.search.store.SqlValues.millis;
import static com.xgpt.search.store.SqlValues.nullableLong;
import static com.xgpt.search.store.SqlValues.stringList;
import static com.xgpt.search.store.SqlValues.toJson;

@Repository
@RequiredArgsConstructor
public class SearchSessionRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Inserts the session and stores the generated id on it.
     */
    public SearchSession create(SearchSession session) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement("""
                    INSERT INTO search_sessions
                    (topic_id, query, variants, search_mode, max_tweets, date_start, date_end,
                     status, started_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, Statement.RETURN_GENERATED_KEYS);
            setNullableLong(ps, 1, session.getTopicId());
            ps.setString(2, session.getQuery());
            ps.setString(3, toJson(objectMapper, session.getVariants()));
            ps.setString(4, session.getSearchMode().getApiValue());
            ps.setInt(5, session.getMaxTweets());
            setNullableLong(ps, 6, millis(session.getDateStart()));
            setNullableLong(ps, 7, millis(session.getDateEnd()));
            ps.setString(8, session.getStatus().getValue());
            ps.setLong(9, session.getStartedAt().toEpochMilli());
            return ps;
        }, keys);

        Number id = keys.getKey();
        if (id == null) {
            throw new IllegalStateException("No id generated for search session");
        }
        session.setId(id.longValue());
        return session;
    }

    public Optional<SearchSession> findById(long id) {
        List<SearchSession> rows = jdbcTemplate.query(
                "SELECT * FROM search_sessions WHERE id = ?", sessionMapper(), id);
        return rows.stream().findFirst();
    }

    public List<SearchSession> findPaused() {
        return jdbcTemplate.query(
                "SELECT * FROM search_sessions WHERE status = ? ORDER BY started_at DESC",
                sessionMapper(), SessionStatus.PAUSED.getValue());
    }

    /**
     * Reopens a session for another run. Counters and the checkpoint are kept.
     */
    public void markRunning(long id) {
        jdbcTemplate.update(
                "UPDATE search_sessions SET status = ?, completed_at = NULL, error_message = NULL WHERE id = ?",
                SessionStatus.RUNNING.getValue(), id);
    }

    public void saveCheckpoint(long id, String cursor, String lastTweetId, SearchStats stats) {
        jdbcTemplate.update("""
                UPDATE search_sessions
                SET cursor = ?, last_tweet_id = ?, tweets_collected = ?, total_processed = ?,
                    duplicates_skipped = ?, users_created = ?
                WHERE id = ?
                """,
                cursor == null ? "" : cursor,
                lastTweetId,
                stats.getTweetsCollected(),
                stats.getTotalProcessed(),
                stats.getDuplicatesSkipped(),
                stats.getUsersCreated(),
                id);
    }

    /**
     * Writes the final counters and status of a run. {@code completedAt} is null when the
     * session is only paused.
     */
    public void finish(long id, SearchStats stats, SessionStatus status, Instant completedAt, String errorMessage) {
        jdbcTemplate.update("""
                UPDATE search_sessions
                SET tweets_collected = ?, total_processed = ?, duplicates_skipped = ?, users_created = ?,
                    status = ?, completed_at = ?, error_message = ?
                WHERE id = ?
                """,
                stats.getTweetsCollected(),
                stats.getTotalProcessed(),
                stats.getDuplicatesSkipped(),
                stats.getUsersCreated(),
                status.getValue(),
                millis(completedAt),
                errorMessage,
                id);
    }

    public void markEmbeddingsGenerated(long id) {
        jdbcTemplate.update("UPDATE search_sessions SET embeddings_generated = ? WHERE id = ?", flag(true), id);
    }

    /**
     * @return number of sessions deleted
     */
    public int deleteStartedBefore(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM search_sessions WHERE started_at < ?", cutoff.toEpochMilli());
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private RowMapper<SearchSession> sessionMapper() {
        return (rs, rowNum) -> SearchSession.builder()
                .id(rs.getLong("id"))
                .topicId(nullableLong(rs, "topic_id"))
                .query(rs.getString("query"))
                .variants(stringList(objectMapper, rs.getString("variants")))
                .searchMode(SearchMode.fromValue(rs.getString("search_mode")))
                .maxTweets(rs.getInt("max_tweets"))
                .dateStart(instant(rs, "date_start"))
                .dateEnd(instant(rs, "date_end"))
                .cursor(rs.getString("cursor"))
                .lastTweetId(rs.getString("last_tweet_id"))
                .tweetsCollected(rs.getInt("tweets_collected"))
                .totalProcessed(rs.getInt("total_processed"))
                .duplicatesSkipped(rs.getInt("duplicates_skipped"))
                .usersCreated(rs.getInt("users_created"))
                .status(SessionStatus.fromValue(rs.getString("status")))
                .startedAt(instant(rs, "started_at"))
                .completedAt(instant(rs, "completed_at"))
                .errorMessage(rs.getString("error_message"))
                .embeddingsGenerated(rs.getInt("embeddings_generated") != 0)
                .build();
    }
}
