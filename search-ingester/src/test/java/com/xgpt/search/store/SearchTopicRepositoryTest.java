package com.xgpt.search.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgpt.search.model.SearchTopic;
import com.xgpt.search.service.TopicConflictException;
import com.xgpt.search.support.MutableClock;
import com.xgpt.search.support.SqliteTestDatabase;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SearchTopicRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-01-10T09:00:00Z");

    private SqliteTestDatabase database;
    private MutableClock clock;
    private SearchTopicRepository repository;

    @BeforeEach
    void setUp() {
        database = new SqliteTestDatabase();
        clock = new MutableClock(NOW);
        repository = new SearchTopicRepository(database.jdbcTemplate(), new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void createStoresVariantsInOrder() {
        SearchTopic topic = repository.create("frontier-ai", List.of("GPT-5", "AGI", "foundation models"));

        assertThat(topic.getId()).isNotNull();
        assertThat(topic.getVariants()).containsExactly("GPT-5", "AGI", "foundation models");
        assertThat(topic.getCreatedAt()).isEqualTo(NOW);
        assertThat(topic.getLastSearched()).isNull();
        assertThat(repository.findByName("frontier-ai")).contains(topic);
    }

    @Test
    void secondCreateWithSameNameConflicts() {
        repository.create("frontier-ai", List.of("AGI"));

        assertThatThrownBy(() -> repository.create("frontier-ai", List.of("GPT-5")))
                .isInstanceOf(TopicConflictException.class)
                .hasMessageContaining("frontier-ai");
        assertThat(repository.findByName("frontier-ai").orElseThrow().getVariants()).containsExactly("AGI");
    }

    @Test
    void recordSearchAccumulatesTotalsAndStampsLastSearched() {
        SearchTopic topic = repository.create("frontier-ai", List.of("AGI"));
        clock.advance(Duration.ofMinutes(5));

        repository.recordSearch(topic.getId(), 12);
        repository.recordSearch(topic.getId(), 3);

        SearchTopic updated = repository.findById(topic.getId()).orElseThrow();
        assertThat(updated.getTotalTweetsFound()).isEqualTo(15);
        assertThat(updated.getLastSearched()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        assertThat(updated.getUpdatedAt()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
    }

    @Test
    void findByNameReturnsEmptyForUnknownTopic() {
        assertThat(repository.findByName("nothing")).isEmpty();
    }
}
