package com.xgpt.search.model;

import java.time.Instant;

/**
 * Inclusive search window. Bounds are rendered as UTC calendar days in the query string.
 */
public record DateRange(Instant start, Instant end) {
}
