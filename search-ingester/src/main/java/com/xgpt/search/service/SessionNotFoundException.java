package com.xgpt.search.service;

public class SessionNotFoundException extends SearchValidationException {

    public SessionNotFoundException(long sessionId) {
        super("Search session " + sessionId + " not found");
    }
}
