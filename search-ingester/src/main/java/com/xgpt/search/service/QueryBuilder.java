package com.xgpt.search.service;

import com.xgpt.search.config.SearchIngesterProperties;
import com.xgpt.search.model.DateRange;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds search API query strings from variant lists.
 *
 * All methods are deterministic for the same inputs, which is what lets a resumed
 * session rebuild exactly the sub-queries it started with.
 */
@Component
public class QueryBuilder {

    public static final int DEFAULT_MAX_LENGTH = 450;
    public static final int DEFAULT_OVERHEAD = 100;
    static final String EXCLUSION_FILTER = " -filter:retweets";

    private static final DateTimeFormatter UTC_DAY = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    private static final Pattern DURATION = Pattern.compile("^(\\d+)d$");

    private final int maxLength;
    private final int overhead;
    private final ZoneId zone;
    private final Clock clock;

    public QueryBuilder() {
        this(DEFAULT_MAX_LENGTH, DEFAULT_OVERHEAD, ZoneId.systemDefault(), Clock.systemUTC());
    }

    @Autowired
    public QueryBuilder(SearchIngesterProperties properties, Clock clock) {
        this(properties.getSearch().getMaxQueryLength(),
                properties.getSearch().getQueryOverhead(),
                properties.getSearch().getZone(),
                clock);
    }

    public QueryBuilder(int maxLength, int overhead, ZoneId zone, Clock clock) {
        this.maxLength = maxLength;
        this.overhead = overhead;
        this.zone = zone;
        this.clock = clock;
    }

    /**
     * "AGI, GPT-5, foundation models" -> ["AGI", "GPT-5", "foundation models"]
     */
    public List<String> parseVariants(String input) {
        if (input == null) {
            return List.of();
        }
        return Arrays.stream(input.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * ["AGI", "GPT-5"] + range -> "\"AGI\" OR \"GPT-5\" since:2024-12-22 until:2024-12-29 -filter:retweets"
     */
    public String buildQuery(List<String> variants, DateRange dateRange) {
        StringBuilder query = new StringBuilder(variants.stream()
                .map(v -> "\"" + v + "\"")
                .collect(Collectors.joining(" OR ")));

        if (dateRange != null) {
            query.append(" since:").append(UTC_DAY.format(dateRange.start()))
                    .append(" until:").append(UTC_DAY.format(dateRange.end()));
        }

        query.append(EXCLUSION_FILTER);
        return query.toString();
    }

    public List<List<String>> splitQuery(List<String> variants) {
        return splitQuery(variants, maxLength);
    }

    /**
     * Greedily packs variants into groups so every built sub-query stays under the API's
     * length limit. Order is preserved across and within groups. A variant too long for
     * any group still gets a group of its own.
     */
    public List<List<String>> splitQuery(List<String> variants, int maxLength) {
        List<List<String>> groups = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentLength = 0;
        int budget = maxLength - overhead;

        for (String variant : variants) {
            int addition = ("\"" + variant + "\" OR ").length();
            if (currentLength + addition > budget && !current.isEmpty()) {
                groups.add(current);
                current = new ArrayList<>();
                currentLength = 0;
            }
            current.add(variant);
            currentLength += addition;
        }

        if (!current.isEmpty()) {
            groups.add(current);
        }
        return groups;
    }

    public List<String> buildQueries(List<String> variants, DateRange dateRange) {
        return splitQuery(variants).stream()
                .map(group -> buildQuery(group, dateRange))
                .collect(Collectors.toList());
    }

    /**
     * Picks the variant that best explains why a tweet matched. Longer variants are more
     * specific and win; equal lengths keep input order.
     */
    public Optional<String> matchVariant(String text, List<String> variants) {
        if (text == null) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return variants.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .filter(v -> lower.contains(v.toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    /**
     * Resolves the command's date options. {@code since}/{@code until} are calendar days in the
     * configured zone; {@code days} counts back from now.
     *
     * @return the range, or null when no date option was given
     */
    public DateRange calculateDateRange(Integer days, String since, String until) {
        boolean explicit = isPresent(since) || isPresent(until);
        if (days != null && explicit) {
            throw new SearchValidationException(
                    "Cannot use --days with --since/--until. Choose one date method.");
        }

        Instant now = clock.instant();
        if (days != null) {
            if (days <= 0) {
                throw new SearchValidationException("--days must be greater than 0");
            }
            return new DateRange(now.minus(days, ChronoUnit.DAYS), now);
        }

        if (explicit) {
            Instant start = isPresent(since) ? parseLocalDate(since, "--since") : Instant.EPOCH;
            Instant end = isPresent(until) ? parseLocalDate(until, "--until") : now;
            if (start.isAfter(end)) {
                throw new SearchValidationException("--since must not be after --until");
            }
            return new DateRange(start, end);
        }

        return null;
    }

    /**
     * "30d" -> 30
     */
    public int parseDurationDays(String duration) {
        Matcher matcher = duration == null ? null : DURATION.matcher(duration.trim());
        if (matcher == null || !matcher.matches()) {
            throw new SearchValidationException(
                    "Invalid duration format. Use format like \"30d\" for 30 days.");
        }
        return Integer.parseInt(matcher.group(1));
    }

    private Instant parseLocalDate(String value, String flag) {
        try {
            return LocalDate.parse(value.trim()).atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new SearchValidationException(flag + " must be a date in YYYY-MM-DD format, got \"" + value + "\"");
        }
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
