package com.xgpt.search.service;

import java.time.Duration;

/**
 * The search API refused a request because the caller exceeded its rate limit.
 * {@code retryAfter} is the reset window the API advertised, or null if it sent none.
 */
public class RateLimitException extends SearchSourceException {

    private final Duration retryAfter;

    public RateLimitException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
