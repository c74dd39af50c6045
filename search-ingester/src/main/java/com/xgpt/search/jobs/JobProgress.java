package com.xgpt.search.jobs;

public record JobProgress(long current, long total, String message) {

    public static JobProgress starting(JobType type) {
        return new JobProgress(0, 0, "Starting " + type.getValue() + "...");
    }
}
