package com.xgpt.search.jobs;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobType {
    SCRAPE,
    SEARCH,
    EMBED,
    DISCOVER;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobType fromValue(String value) {
        return JobType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
