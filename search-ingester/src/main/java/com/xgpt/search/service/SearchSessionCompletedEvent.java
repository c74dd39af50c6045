package com.xgpt.search.service;

import com.xgpt.search.model.SearchStats;
import com.xgpt.search.model.SessionStatus;

/**
 * Published once per execution when a session stops running, whatever its final status.
 */
public record SearchSessionCompletedEvent(
        long sessionId,
        SessionStatus status,
        SearchStats stats,
        boolean embeddingRequested) {
}
