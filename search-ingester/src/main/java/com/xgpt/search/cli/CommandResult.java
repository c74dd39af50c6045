package com.xgpt.search.cli;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one command invocation. {@code data} carries the structured payload printed
 * with {@code --json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResult(boolean success, String message, Object data) {

    public static CommandResult ok(String message) {
        return new CommandResult(true, message, null);
    }

    public static CommandResult ok(String message, Object data) {
        return new CommandResult(true, message, data);
    }

    public static CommandResult failure(String message) {
        return new CommandResult(false, message, null);
    }

    public static CommandResult failure(String message, Object data) {
        return new CommandResult(false, message, data);
    }
}
