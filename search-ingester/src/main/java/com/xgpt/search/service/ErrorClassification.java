package com.xgpt.search.service;

import java.time.Duration;

/**
 * @param suggestedDelay initial delay before a retry, {@link Duration#ZERO} when not retryable
 */
public record ErrorClassification(
        ErrorCategory category,
        boolean retryable,
        Duration suggestedDelay,
        String friendlyMessage) {
}
