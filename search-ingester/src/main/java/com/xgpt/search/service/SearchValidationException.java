package com.xgpt.search.service;

/**
 * Invalid search input or a request the current session state does not allow.
 * Never retried; surfaced to the caller as-is.
 */
public class SearchValidationException extends RuntimeException {

    public SearchValidationException(String message) {
        super(message);
    }
}
