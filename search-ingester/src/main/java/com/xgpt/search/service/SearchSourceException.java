package com.xgpt.search.service;

/**
 * Failure raised by the search source while fetching a page of results.
 */
public class SearchSourceException extends RuntimeException {

    public SearchSourceException(String message) {
        super(message);
    }

    public SearchSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
