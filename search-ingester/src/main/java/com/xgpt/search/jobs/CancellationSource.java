package com.xgpt.search.jobs;

/**
 * Write side of a cancellation signal. Package-private so only the tracking service raises it.
 */
final class CancellationSource implements CancellationToken {

    private volatile boolean cancelled;

    void cancel() {
        cancelled = true;
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled;
    }
}
