package com.xgpt.search.service;

public class TopicConflictException extends RuntimeException {

    public TopicConflictException(String name) {
        super("Topic \"" + name + "\" already exists. Use --name to search with it, or choose a different name.");
    }
}
