package com.xgpt.search.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.xgpt.search.model.DateRange;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class QueryBuilderTest {

    private static final Instant NOW = Instant.parse("2024-12-29T12:00:00Z");

    private final QueryBuilder queryBuilder = new QueryBuilder(
            QueryBuilder.DEFAULT_MAX_LENGTH, QueryBuilder.DEFAULT_OVERHEAD, ZoneOffset.UTC,
            Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void parseVariantsTrimsAndDropsEmptyEntries() {
        assertThat(queryBuilder.parseVariants(" AGI, GPT-5 ,, foundation models ,"))
                .containsExactly("AGI", "GPT-5", "foundation models");
        assertThat(queryBuilder.parseVariants(null)).isEmpty();
        assertThat(queryBuilder.parseVariants(" , ")).isEmpty();
    }

    @Test
    void buildQueryQuotesVariantsAndAppendsRetweetFilter() {
        assertThat(queryBuilder.buildQuery(List.of("AGI", "GPT-5"), null))
                .isEqualTo("\"AGI\" OR \"GPT-5\" -filter:retweets");
    }

    @Test
    void buildQueryAddsUtcDateBounds() {
        DateRange range = new DateRange(Instant.parse("2024-12-22T12:00:00Z"), NOW);

        assertThat(queryBuilder.buildQuery(List.of("AGI"), range))
                .isEqualTo("\"AGI\" since:2024-12-22 until:2024-12-29 -filter:retweets");
    }

    @Test
    void splitQueryPartitionsVariantsInOrderWithinBudget() {
        List<String> variants = IntStream.rangeClosed(1, 40)
                .mapToObj(i -> "variant number " + i)
                .collect(Collectors.toList());

        List<List<String>> groups = queryBuilder.splitQuery(variants);

        assertThat(groups).hasSizeGreaterThan(1);
        List<String> flattened = new ArrayList<>();
        groups.forEach(flattened::addAll);
        assertThat(flattened).isEqualTo(variants);

        int budget = QueryBuilder.DEFAULT_MAX_LENGTH - QueryBuilder.DEFAULT_OVERHEAD;
        for (List<String> group : groups) {
            int cost = group.stream().mapToInt(v -> ("\"" + v + "\" OR ").length()).sum();
            assertThat(cost).isLessThanOrEqualTo(budget);
        }
    }

    @Test
    void splitQueryKeepsShortListInOneGroup() {
        assertThat(queryBuilder.splitQuery(List.of("AGI", "GPT-5")))
                .containsExactly(List.of("AGI", "GPT-5"));
    }

    @Test
    void splitQueryGivesOversizedVariantItsOwnGroup() {
        String huge = "x".repeat(400);

        List<List<String>> groups = queryBuilder.splitQuery(List.of("AGI", huge, "GPT-5"));

        assertThat(groups).containsExactly(List.of("AGI"), List.of(huge), List.of("GPT-5"));
    }

    @Test
    void splitQueryHonoursExplicitMaxLength() {
        // budget 150 - 100 = 50; each "variantN" costs 14 characters
        List<List<String>> groups = queryBuilder.splitQuery(
                List.of("variant1", "variant2", "variant3", "variant4", "variant5"), 150);

        assertThat(groups).containsExactly(
                List.of("variant1", "variant2", "variant3"),
                List.of("variant4", "variant5"));
    }

    @Test
    void matchVariantPrefersLongestCaseInsensitiveMatch() {
        List<String> variants = List.of("AI", "OpenAI", "open ai models");

        assertThat(queryBuilder.matchVariant("Big news from openai today", variants)).contains("OpenAI");
        assertThat(queryBuilder.matchVariant("Open AI Models are here", variants)).contains("open ai models");
        assertThat(queryBuilder.matchVariant("nothing relevant", variants)).isEmpty();
    }

    @Test
    void matchVariantBreaksLengthTiesByInputOrder() {
        assertThat(queryBuilder.matchVariant("gpt5 and agi2 both", List.of("agi2", "gpt5"))).contains("agi2");
        assertThat(queryBuilder.matchVariant("gpt5 and agi2 both", List.of("gpt5", "agi2"))).contains("gpt5");
    }

    @Test
    void calculateDateRangeCountsDaysBackFromNow() {
        DateRange range = queryBuilder.calculateDateRange(7, null, null);

        assertThat(range.start()).isEqualTo(Instant.parse("2024-12-22T12:00:00Z"));
        assertThat(range.end()).isEqualTo(NOW);
    }

    @Test
    void calculateDateRangeParsesExplicitDaysInConfiguredZone() {
        QueryBuilder dublin = new QueryBuilder(450, 100, ZoneId.of("Europe/Dublin"), Clock.fixed(NOW, ZoneOffset.UTC));

        DateRange range = dublin.calculateDateRange(null, "2024-07-01", "2024-07-02");

        assertThat(range.start()).isEqualTo(Instant.parse("2024-06-30T23:00:00Z"));
        assertThat(range.end()).isEqualTo(Instant.parse("2024-07-01T23:00:00Z"));
    }

    @Test
    void calculateDateRangeFillsMissingBounds() {
        assertThat(queryBuilder.calculateDateRange(null, "2024-12-01", null))
                .isEqualTo(new DateRange(Instant.parse("2024-12-01T00:00:00Z"), NOW));
        assertThat(queryBuilder.calculateDateRange(null, null, "2024-12-01"))
                .isEqualTo(new DateRange(Instant.EPOCH, Instant.parse("2024-12-01T00:00:00Z")));
        assertThat(queryBuilder.calculateDateRange(null, null, null)).isNull();
    }

    @Test
    void calculateDateRangeRejectsDaysCombinedWithExplicitDates() {
        assertThatThrownBy(() -> queryBuilder.calculateDateRange(7, "2024-12-01", null))
                .isInstanceOf(SearchValidationException.class)
                .hasMessageContaining("--days")
                .hasMessageContaining("--since/--until");
    }

    @Test
    void calculateDateRangeRejectsMalformedDatesAndNonPositiveDays() {
        assertThatThrownBy(() -> queryBuilder.calculateDateRange(null, "12/01/2024", null))
                .isInstanceOf(SearchValidationException.class)
                .hasMessageContaining("--since");
        assertThatThrownBy(() -> queryBuilder.calculateDateRange(0, null, null))
                .isInstanceOf(SearchValidationException.class);
        assertThatThrownBy(() -> queryBuilder.calculateDateRange(null, "2024-12-10", "2024-12-01"))
                .isInstanceOf(SearchValidationException.class);
    }

    @Test
    void parseDurationDaysAcceptsOnlyDaySuffix() {
        assertThat(queryBuilder.parseDurationDays("30d")).isEqualTo(30);
        assertThat(queryBuilder.parseDurationDays(" 7d ")).isEqualTo(7);
        assertThatThrownBy(() -> queryBuilder.parseDurationDays("30"))
                .isInstanceOf(SearchValidationException.class)
                .hasMessageContaining("30d");
        assertThatThrownBy(() -> queryBuilder.parseDurationDays("2w"))
                .isInstanceOf(SearchValidationException.class);
    }
}
