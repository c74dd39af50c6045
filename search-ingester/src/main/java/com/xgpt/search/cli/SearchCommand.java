package com.xgpt.search.cli;

import com.xgpt.search.config.SearchIngesterProperties;
import com.xgpt.search.model.DateRange;
import com.xgpt.search.model.SearchMode;
import com.xgpt.search.service.ErrorClassifier;
import com.xgpt.search.service.QueryBuilder;
import com.xgpt.search.service.SearchOutcome;
import com.xgpt.search.service.SearchPlan;
import com.xgpt.search.service.SearchRequest;
import com.xgpt.search.service.SearchSessionEngine;
import com.xgpt.search.service.SearchValidationException;
import com.xgpt.search.service.TopicConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The {@code search} command: validates options, then plans, runs, resumes or cleans up
 * sessions through {@link SearchSessionEngine}. Runs synchronously on the calling thread.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchCommand {

    static final String NO_RESULTS = """
            No tweets found. Try broader variants or different date range.

            Suggestions:
            - Add more variant spellings
            - Extend the date range with --days
            - Try --mode=top for popular tweets""";

    private final SearchSessionEngine engine;
    private final QueryBuilder queryBuilder;
    private final ErrorClassifier errorClassifier;
    private final SearchIngesterProperties properties;

    public CommandResult execute(SearchCommandOptions options) {
        if (options.isCleanup()) {
            return cleanup(options.getOlderThan());
        }
        if (options.getResume() != null) {
            return resume(options.getResume(), options.isJson());
        }
        if (options.getQuery() == null || options.getQuery().isBlank()) {
            return CommandResult.failure("Search query required");
        }

        try {
            SearchRequest request = toRequest(options);
            if (options.isDryRun()) {
                return dryRun(engine.planSearch(request));
            }
            return format(engine.startSearch(request), options.isJson());

        } catch (SearchValidationException | TopicConflictException e) {
            return CommandResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Search command failed: {}", e.getMessage(), e);
            return CommandResult.failure(errorClassifier.classify(e).friendlyMessage() + ": " + e.getMessage());
        }
    }

    /**
     * Parses and validates options into an engine request. Performs no I/O.
     *
     * @throws SearchValidationException for conflicting or malformed options
     */
    public SearchRequest toRequest(SearchCommandOptions options) {
        List<String> variants = queryBuilder.parseVariants(options.getQuery());
        if (variants.isEmpty()) {
            throw new SearchValidationException("At least one search variant required");
        }
        int maxTweets = options.getMaxTweets() != null
                ? options.getMaxTweets()
                : properties.getSearch().getDefaultMaxTweets();
        DateRange range = queryBuilder.calculateDateRange(options.getDays(), options.getSince(), options.getUntil());

        return SearchRequest.builder()
                .variants(variants)
                .topicName(options.getName() == null || options.getName().isBlank() ? null : options.getName().trim())
                .maxTweets(maxTweets)
                .dateRange(range)
                .mode(parseMode(options.getMode()))
                .embed(options.isEmbed())
                .build();
    }

    public CommandResult dryRun(SearchPlan plan) {
        return CommandResult.ok(plan.describe(properties.getSearch().getZone()), plan);
    }

    // ── Modes ─────────────────────────────────────────────────────────────────

    private CommandResult resume(long sessionId, boolean json) {
        try {
            return format(engine.resumeSearch(sessionId), json);
        } catch (SearchValidationException e) {
            return CommandResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Resume of session {} failed: {}", sessionId, e.getMessage(), e);
            return CommandResult.failure(errorClassifier.classify(e).friendlyMessage() + ": " + e.getMessage());
        }
    }

    private CommandResult cleanup(String olderThan) {
        if (olderThan == null || olderThan.isBlank()) {
            return CommandResult.failure("Please specify --older-than (e.g., --older-than=30d)");
        }
        try {
            int days = queryBuilder.parseDurationDays(olderThan);
            int deleted = engine.cleanupSessions(days);
            return CommandResult.ok("Deleted " + deleted + " search sessions older than " + days + " days",
                    Map.of("deleted", deleted, "olderThanDays", days));
        } catch (SearchValidationException e) {
            return CommandResult.failure(e.getMessage());
        }
    }

    // ── Output ────────────────────────────────────────────────────────────────

    private CommandResult format(SearchOutcome outcome, boolean json) {
        switch (outcome.status()) {
            case FAILED:
                return CommandResult.failure("Search failed (session " + outcome.sessionId() + "): "
                        + outcome.errorMessage(), outcome.stats());
            case PAUSED:
                return CommandResult.ok("Search paused (session " + outcome.sessionId() + ") after "
                        + outcome.stats().getTweetsCollected() + " tweets. Resume with --resume="
                        + outcome.sessionId(), outcome.stats());
            default:
                break;
        }

        if (json) {
            return CommandResult.ok("Search completed", outcome.stats());
        }
        if (outcome.nothingFound()) {
            return CommandResult.ok(NO_RESULTS);
        }
        return CommandResult.ok(String.format("[ok] Search complete: %d new tweets, %d duplicates, %d users created",
                outcome.stats().getTweetsCollected(),
                outcome.stats().getDuplicatesSkipped(),
                outcome.stats().getUsersCreated()), outcome.stats());
    }

    private static SearchMode parseMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return SearchMode.LATEST;
        }
        String normalised = mode.trim().toLowerCase(Locale.ROOT);
        if (!normalised.equals("latest") && !normalised.equals("top")) {
            throw new SearchValidationException("Invalid --mode \"" + mode + "\". Use latest or top.");
        }
        return SearchMode.fromValue(normalised);
    }
}
