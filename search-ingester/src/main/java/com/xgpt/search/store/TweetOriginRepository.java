package com.xgpt.search.store;

import com.xgpt.search.model.TweetSearchOrigin;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.xgpt.search.store.SqlValues.instant;

/**
 * Which session first discovered each tweet, and through which variant. The UNIQUE
 * constraint on tweet_id makes the first recorded origin permanent.
 */
@Repository
@RequiredArgsConstructor
public class TweetOriginRepository {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /**
     * @return false when the tweet already has an origin; the existing row is not changed
     */
    public boolean recordOrigin(String tweetId, long sessionId, String matchedVariant) {
        int rows = jdbcTemplate.update("""
                INSERT INTO tweet_search_origins (tweet_id, search_session_id, matched_variant, found_at)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (tweet_id) DO NOTHING
                """,
                tweetId, sessionId, matchedVariant, clock.millis());
        return rows > 0;
    }

    public Optional<TweetSearchOrigin> findByTweetId(String tweetId) {
        List<TweetSearchOrigin> rows = jdbcTemplate.query(
                "SELECT * FROM tweet_search_origins WHERE tweet_id = ?",
                (rs, rowNum) -> TweetSearchOrigin.builder()
                        .id(rs.getLong("id"))
                        .tweetId(rs.getString("tweet_id"))
                        .searchSessionId(rs.getLong("search_session_id"))
                        .matchedVariant(rs.getString("matched_variant"))
                        .foundAt(instant(rs, "found_at"))
                        .build(),
                tweetId);
        return rows.stream().findFirst();
    }

    public List<String> findTweetIdsBySession(long sessionId) {
        return jdbcTemplate.queryForList(
                "SELECT tweet_id FROM tweet_search_origins WHERE search_session_id = ? ORDER BY id",
                String.class, sessionId);
    }

    /**
     * Tweets first found by a session, counted per matched variant, most productive first.
     */
    public Map<String, Integer> variantBreakdown(long sessionId) {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        jdbcTemplate.query("""
                SELECT matched_variant, COUNT(*) AS tweet_count
                FROM tweet_search_origins
                WHERE search_session_id = ?
                GROUP BY matched_variant
                ORDER BY tweet_count DESC, matched_variant
                """,
                rs -> {
                    breakdown.put(rs.getString("matched_variant"), rs.getInt("tweet_count"));
                },
                sessionId);
        return breakdown;
    }
}
