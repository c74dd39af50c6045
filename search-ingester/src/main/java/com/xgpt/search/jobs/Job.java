package com.xgpt.search.jobs;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Handle on one running or recently finished background operation.
 *
 * Instances held by {@link JobTrackingService} are never handed out; callers receive copies
 * taken under the service lock.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    private String id;              // <type>-<epochMillis>
    private JobType type;
    private JobStatus status;
    private JobProgress progress;
    private Instant startedAt;
    private Instant completedAt;    // null while running
    private Map<String, Object> metadata;
    private String errorMessage;

    public Job copy() {
        return toBuilder().build();
    }
}
