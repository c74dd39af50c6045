package com.xgpt.search.service;

import com.xgpt.search.model.SearchStats;
import com.xgpt.search.model.SessionStatus;

/**
 * How one execution of a session ended.
 *
 * @param errorMessage set when {@code status} is FAILED
 */
public record SearchOutcome(
        long sessionId,
        String jobId,
        SessionStatus status,
        SearchStats stats,
        String errorMessage) {

    public boolean nothingFound() {
        return stats.getTweetsCollected() == 0 && stats.getTotalProcessed() == 0;
    }
}
