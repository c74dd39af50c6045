package com.xgpt.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Result ordering requested from the search API. The stored value is the API's own spelling.
 */
public enum SearchMode {
    LATEST("Latest"),
    TOP("Top");

    private final String apiValue;

    SearchMode(String apiValue) {
        this.apiValue = apiValue;
    }

    @JsonValue
    public String getApiValue() {
        return apiValue;
    }

    /**
     * Accepts the command-line spelling ("latest", "top") as well as the stored one ("Latest", "Top").
     * Anything unrecognised falls back to LATEST, matching the command default.
     */
    public static SearchMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return LATEST;
        }
        return "top".equals(value.trim().toLowerCase(Locale.ROOT)) ? TOP : LATEST;
    }
}
