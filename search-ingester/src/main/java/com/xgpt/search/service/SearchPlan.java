package com.xgpt.search.service;

import com.xgpt.search.model.DateRange;
import com.xgpt.search.model.SearchMode;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The exact queries a search would send, computed without touching the source or the store.
 */
public record SearchPlan(
        List<String> variants,
        List<String> queries,
        DateRange dateRange,
        SearchMode mode,
        int maxTweets) {

    static final int QUERY_LIMIT = 500;

    private static final DateTimeFormatter DISPLAY_DATE =
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH);

    public int totalQueryLength() {
        return queries.stream().mapToInt(String::length).sum();
    }

    /**
     * Dry-run preview. Dates are shown in {@code zone}.
     */
    public String describe(ZoneId zone) {
        StringBuilder out = new StringBuilder("Dry Run - Query Preview\n\n");
        out.append("Variants (").append(variants.size()).append("): ")
                .append(variants.stream().map(v -> "\"" + v + "\"").collect(Collectors.joining(", ")))
                .append('\n');

        if (dateRange != null) {
            out.append("Date range: ")
                    .append(DISPLAY_DATE.format(dateRange.start().atZone(zone)))
                    .append(" to ")
                    .append(DISPLAY_DATE.format(dateRange.end().atZone(zone)))
                    .append(" (local time)\n");
        }

        out.append("Search mode: ").append(mode.getApiValue()).append('\n');
        out.append("Max tweets: ").append(maxTweets).append("\n\n");

        if (queries.size() > 1) {
            out.append("Search queries (").append(queries.size()).append(" splits due to length):\n");
            for (int i = 0; i < queries.size(); i++) {
                out.append("  ").append(i + 1).append(". ").append(queries.get(i)).append('\n');
            }
        } else {
            out.append("Search query:\n").append(queries.get(0)).append('\n');
        }

        out.append("\nTotal query length: ").append(totalQueryLength()).append('/').append(QUERY_LIMIT).append(" characters");
        return out.toString();
    }
}
