package com.xgpt.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static SessionStatus fromValue(String value) {
        return SessionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
