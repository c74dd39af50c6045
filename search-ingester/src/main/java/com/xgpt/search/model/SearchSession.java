package com.xgpt.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * One planned or executed search run. Stored in the search_sessions table.
 *
 * Configuration fields are fixed once the session is running; the cursor pair and the
 * counters are only ever written by the engine that owns the run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchSession {

    private Long id;
    private Long topicId;

    // ── Configuration ────────────────────────────────────────────────────────
    private String query;               // sub-queries joined with " | "
    private List<String> variants;
    private SearchMode searchMode;
    private int maxTweets;
    private Instant dateStart;
    private Instant dateEnd;

    // ── Resume support ───────────────────────────────────────────────────────
    private String cursor;
    private String lastTweetId;

    // ── Results ──────────────────────────────────────────────────────────────
    private int tweetsCollected;
    private int totalProcessed;
    private int duplicatesSkipped;
    private int usersCreated;

    private SessionStatus status;
    private Instant startedAt;
    private Instant completedAt;
    private String errorMessage;
    private boolean embeddingsGenerated;

    public DateRange getDateRange() {
        if (dateStart == null || dateEnd == null) {
            return null;
        }
        return new DateRange(dateStart, dateEnd);
    }

    public boolean hasCheckpoint() {
        return lastTweetId != null && !lastTweetId.isBlank();
    }
}
