package com.xgpt.search.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgpt.search.model.SearchTopic;
import com.xgpt.search.service.TopicConflictException;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.xgpt.search.store.SqlValues.instant;
import static com.xgpt.search.store.SqlValues.stringList;
import static com.xgpt.search.store.SqlValues.toJson;

@Repository
@RequiredArgsConstructor
public class SearchTopicRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Optional<SearchTopic> findByName(String name) {
        List<SearchTopic> rows = jdbcTemplate.query(
                "SELECT * FROM search_topics WHERE name = ?", topicMapper(), name);
        return rows.stream().findFirst();
    }

    public Optional<SearchTopic> findById(long id) {
        List<SearchTopic> rows = jdbcTemplate.query(
                "SELECT * FROM search_topics WHERE id = ?", topicMapper(), id);
        return rows.stream().findFirst();
    }

    /**
     * @throws TopicConflictException if a topic with this name already exists
     */
    public SearchTopic create(String name, List<String> variants) {
        Instant now = clock.instant();
        int inserted = jdbcTemplate.update("""
                INSERT INTO search_topics (name, variants, created_at, updated_at, total_tweets_found)
                VALUES (?, ?, ?, ?, 0)
                ON CONFLICT (name) DO NOTHING
                """,
                name, toJson(objectMapper, variants), now.toEpochMilli(), now.toEpochMilli());
        if (inserted == 0) {
            throw new TopicConflictException(name);
        }
        return findByName(name)
                .orElseThrow(() -> new IllegalStateException("Topic row missing after insert: " + name));
    }

    /**
     * Adds a finished run's collected count to the topic total and stamps lastSearched.
     */
    public void recordSearch(long topicId, int tweetsFound) {
        long now = clock.millis();
        jdbcTemplate.update("""
                UPDATE search_topics
                SET total_tweets_found = total_tweets_found + ?, last_searched = ?, updated_at = ?
                WHERE id = ?
                """,
                tweetsFound, now, now, topicId);
    }

    private RowMapper<SearchTopic> topicMapper() {
        return (rs, rowNum) -> SearchTopic.builder()
                .id(rs.getLong("id"))
                .name(rs.getString("name"))
                .variants(stringList(objectMapper, rs.getString("variants")))
                .createdAt(instant(rs, "created_at"))
                .updatedAt(instant(rs, "updated_at"))
                .lastSearched(instant(rs, "last_searched"))
                .totalTweetsFound(rs.getInt("total_tweets_found"))
                .build();
    }
}
