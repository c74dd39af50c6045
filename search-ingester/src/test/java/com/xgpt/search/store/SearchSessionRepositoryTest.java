package com.xgpt.search.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgpt.search.model.SearchMode;
import com.xgpt.search.model.SearchSession;
import com.xgpt.search.model.SearchStats;
import com.xgpt.search.model.SessionStatus;
import com.xgpt.search.support.SqliteTestDatabase;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SearchSessionRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-01-10T09:00:00Z");

    private SqliteTestDatabase database;
    private SearchSessionRepository repository;

    @BeforeEach
    void setUp() {
        database = new SqliteTestDatabase();
        repository = new SearchSessionRepository(database.jdbcTemplate(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void createAssignsIdAndStoresConfiguration() {
        SearchSession created = repository.create(session(NOW));

        assertThat(created.getId()).isNotNull();
        SearchSession loaded = repository.findById(created.getId()).orElseThrow();
        assertThat(loaded.getQuery()).isEqualTo("\"AGI\" OR \"GPT-5\" -filter:retweets");
        assertThat(loaded.getVariants()).containsExactly("AGI", "GPT-5");
        assertThat(loaded.getSearchMode()).isEqualTo(SearchMode.TOP);
        assertThat(loaded.getMaxTweets()).isEqualTo(100);
        assertThat(loaded.getDateStart()).isEqualTo(NOW.minus(Duration.ofDays(7)));
        assertThat(loaded.getDateEnd()).isEqualTo(NOW);
        assertThat(loaded.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(loaded.getTopicId()).isNull();
        assertThat(loaded.hasCheckpoint()).isFalse();
        assertThat(loaded.getCompletedAt()).isNull();
    }

    @Test
    void checkpointStoresCursorLastIdAndCounters() {
        long id = repository.create(session(NOW)).getId();
        SearchStats stats = stats(50, 60, 10, 4);

        repository.saveCheckpoint(id, "cursor-2", "1050", stats);

        SearchSession loaded = repository.findById(id).orElseThrow();
        assertThat(loaded.getCursor()).isEqualTo("cursor-2");
        assertThat(loaded.getLastTweetId()).isEqualTo("1050");
        assertThat(loaded.getTweetsCollected()).isEqualTo(50);
        assertThat(loaded.getTotalProcessed()).isEqualTo(60);
        assertThat(loaded.getDuplicatesSkipped()).isEqualTo(10);
        assertThat(loaded.getUsersCreated()).isEqualTo(4);
        assertThat(loaded.hasCheckpoint()).isTrue();
    }

    @Test
    void pausedSessionsAreListedNewestFirstAndCanBeReopened() {
        long older = repository.create(session(NOW.minus(Duration.ofHours(2)))).getId();
        long newer = repository.create(session(NOW)).getId();
        repository.create(session(NOW));

        repository.finish(older, stats(1, 1, 0, 1), SessionStatus.PAUSED, null, null);
        repository.finish(newer, stats(2, 2, 0, 1), SessionStatus.PAUSED, null, null);

        assertThat(repository.findPaused()).extracting(SearchSession::getId).containsExactly(newer, older);

        repository.markRunning(older);
        SearchSession reopened = repository.findById(older).orElseThrow();
        assertThat(reopened.getStatus()).isEqualTo(SessionStatus.RUNNING);
        assertThat(reopened.getTweetsCollected()).isEqualTo(1);
    }

    @Test
    void finishRecordsFailureDetails() {
        long id = repository.create(session(NOW)).getId();
        Instant completed = NOW.plus(Duration.ofMinutes(3));

        repository.finish(id, stats(5, 9, 4, 2), SessionStatus.FAILED, completed, "Authentication failed");

        SearchSession loaded = repository.findById(id).orElseThrow();
        assertThat(loaded.getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(loaded.getCompletedAt()).isEqualTo(completed);
        assertThat(loaded.getErrorMessage()).isEqualTo("Authentication failed");
        assertThat(loaded.getDuplicatesSkipped()).isEqualTo(4);
    }

    @Test
    void embeddingsFlagIsSetSeparately() {
        long id = repository.create(session(NOW)).getId();

        repository.markEmbeddingsGenerated(id);

        assertThat(repository.findById(id).orElseThrow().isEmbeddingsGenerated()).isTrue();
    }

    @Test
    void deleteStartedBeforeRemovesOnlyOlderSessions() {
        repository.create(session(NOW.minus(Duration.ofDays(40))));
        repository.create(session(NOW.minus(Duration.ofDays(31))));
        long recent = repository.create(session(NOW.minus(Duration.ofDays(2)))).getId();

        int deleted = repository.deleteStartedBefore(NOW.minus(Duration.ofDays(30)));

        assertThat(deleted).isEqualTo(2);
        assertThat(repository.findById(recent)).isPresent();
        assertThat(database.count("search_sessions")).isEqualTo(1);
    }

    private static SearchSession session(Instant startedAt) {
        return SearchSession.builder()
                .query("\"AGI\" OR \"GPT-5\" -filter:retweets")
                .variants(List.of("AGI", "GPT-5"))
                .searchMode(SearchMode.TOP)
                .maxTweets(100)
                .dateStart(NOW.minus(Duration.ofDays(7)))
                .dateEnd(NOW)
                .status(SessionStatus.RUNNING)
                .startedAt(startedAt)
                .build();
    }

    private static SearchStats stats(int collected, int processed, int duplicates, int users) {
        SearchStats stats = new SearchStats();
        stats.setTweetsCollected(collected);
        stats.setTotalProcessed(processed);
        stats.setDuplicatesSkipped(duplicates);
        stats.setUsersCreated(users);
        return stats;
    }
}
