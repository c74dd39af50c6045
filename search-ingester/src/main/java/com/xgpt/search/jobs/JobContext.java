package com.xgpt.search.jobs;

/**
 * What a running operation sees of its own job: its id, its cancellation token and a
 * progress sink bound to that id.
 */
public final class JobContext {

    private final String jobId;
    private final CancellationToken cancellationToken;
    private final JobTrackingService tracker;

    JobContext(String jobId, CancellationToken cancellationToken, JobTrackingService tracker) {
        this.jobId = jobId;
        this.cancellationToken = cancellationToken;
        this.tracker = tracker;
    }

    public String getJobId() {
        return jobId;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public boolean isCancelled() {
        return cancellationToken.isCancellationRequested();
    }

    public void updateProgress(long current, long total, String message) {
        tracker.updateProgress(jobId, current, total, message);
    }
}
