package com.xgpt.search.jobs;

@FunctionalInterface
public interface JobSubscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
