package com.xgpt.search.jobs;

/**
 * Read side of a job's cancellation signal. Operations poll it at safe points; only the
 * tracking service can raise it.
 */
public interface CancellationToken {

    boolean isCancellationRequested();
}
