package com.xgpt.search.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgpt.search.jobs.Job;
import com.xgpt.search.jobs.JobProgress;
import com.xgpt.search.jobs.JobStatus;
import com.xgpt.search.jobs.JobStore;
import com.xgpt.search.jobs.JobType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.xgpt.search.store.SqlValues.instant;
import static com.xgpt.search.store.SqlValues.millis;
import static com.xgpt.search.store.SqlValues.toJson;

@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcJobStore implements JobStore {

    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void save(Job job) {
        JobProgress progress = job.getProgress() != null ? job.getProgress() : new JobProgress(0, 0, null);
        jdbcTemplate.update("""
                INSERT INTO jobs
                (id, type, status, progress_current, progress_total, progress_message,
                 started_at, completed_at, metadata, error_message)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    status = excluded.status,
                    progress_current = excluded.progress_current,
                    progress_total = excluded.progress_total,
                    progress_message = excluded.progress_message,
                    completed_at = excluded.completed_at,
                    metadata = excluded.metadata,
                    error_message = excluded.error_message
                """,
                job.getId(),
                job.getType().getValue(),
                job.getStatus().getValue(),
                progress.current(),
                progress.total(),
                progress.message(),
                millis(job.getStartedAt()),
                millis(job.getCompletedAt()),
                toJson(objectMapper, job.getMetadata()),
                job.getErrorMessage());
    }

    @Override
    public int failStaleRunning(Instant cutoff, Instant completedAt, String errorMessage) {
        return jdbcTemplate.update("""
                UPDATE jobs SET status = ?, completed_at = ?, error_message = ?
                WHERE status = ? AND started_at < ?
                """,
                JobStatus.FAILED.getValue(),
                completedAt.toEpochMilli(),
                errorMessage,
                JobStatus.RUNNING.getValue(),
                cutoff.toEpochMilli());
    }

    @Override
    public int deleteStartedBefore(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM jobs WHERE started_at < ?", cutoff.toEpochMilli());
    }

    @Override
    public List<Job> findVisible(Instant completedSince) {
        return jdbcTemplate.query("""
                SELECT * FROM jobs
                WHERE status = ? OR completed_at >= ?
                ORDER BY started_at, id
                """,
                jobMapper(),
                JobStatus.RUNNING.getValue(),
                completedSince.toEpochMilli());
    }

    private RowMapper<Job> jobMapper() {
        return (rs, rowNum) -> Job.builder()
                .id(rs.getString("id"))
                .type(JobType.fromValue(rs.getString("type")))
                .status(JobStatus.fromValue(rs.getString("status")))
                .progress(new JobProgress(
                        rs.getLong("progress_current"),
                        rs.getLong("progress_total"),
                        rs.getString("progress_message")))
                .startedAt(instant(rs, "started_at"))
                .completedAt(instant(rs, "completed_at"))
                .metadata(readMetadata(rs.getString("id"), rs.getString("metadata")))
                .errorMessage(rs.getString("error_message"))
                .build();
    }

    private Map<String, Object> readMetadata(String jobId, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable metadata on job {}: {}", jobId, e.getMessage());
            return Map.of();
        }
    }
}
