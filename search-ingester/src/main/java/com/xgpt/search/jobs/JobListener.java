package com.xgpt.search.jobs;

import java.util.List;

/**
 * Receives a snapshot of every tracked job after each change. Called on the thread that
 * made the change while the tracking lock is held, so implementations must not block;
 * hand any I/O to another thread.
 */
@FunctionalInterface
public interface JobListener {

    void onJobsChanged(List<Job> jobs);
}
