package com.xgpt.search.service;

public class SourceAuthenticationException extends SearchSourceException {

    public SourceAuthenticationException(String message) {
        super(message);
    }

    public SourceAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
