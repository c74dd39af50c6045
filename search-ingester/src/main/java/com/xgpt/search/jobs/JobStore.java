package com.xgpt.search.jobs;

import java.time.Instant;
import java.util.List;

/**
 * Persistence port for job rows. Written behind the in-memory registry and read back only
 * during startup recovery.
 */
public interface JobStore {

    void save(Job job);

    /**
     * Marks every job still running that started before {@code cutoff} as failed.
     *
     * @return number of rows updated
     */
    int failStaleRunning(Instant cutoff, Instant completedAt, String errorMessage);

    /**
     * @return number of rows deleted
     */
    int deleteStartedBefore(Instant cutoff);

    /**
     * Rows still running, plus rows that finished at or after {@code completedSince}.
     */
    List<Job> findVisible(Instant completedSince);
}
