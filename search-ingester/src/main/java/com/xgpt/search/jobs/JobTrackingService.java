package com.xgpt.search.jobs;

import com.xgpt.search.config.SearchIngesterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry of running and recently finished background jobs.
 *
 * In-memory state is authoritative for liveness and ordering. Every mutation is mirrored to
 * the {@link JobStore} on a best-effort basis; a persistence failure is logged and never
 * reaches the operation that reported progress. The store is read back only by
 * {@link #initialize()}.
 *
 * Mutation, persistence and listener notification for one call all happen under a single
 * lock, so subscribers observe updates to a job in the order they were issued.
 */
@Service
@Slf4j
public class JobTrackingService {

    static final String INTERRUPTED_MESSAGE = "Job was interrupted before completing (process restart)";

    private final JobStore store;
    private final Clock clock;
    private final ScheduledExecutorService evictionScheduler;
    private final Duration gracePeriod;
    private final Duration staleThreshold;
    private final Duration retention;

    private final Object lock = new Object();
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, CancellationSource> tokens = new HashMap<>();
    private final List<JobListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<CompletableFuture<Void>> initialization = new AtomicReference<>();

    public JobTrackingService(JobStore store,
                              SearchIngesterProperties properties,
                              Clock clock,
                              @Qualifier("jobEvictionScheduler") ScheduledExecutorService evictionScheduler) {
        this.store = store;
        this.clock = clock;
        this.evictionScheduler = evictionScheduler;
        this.gracePeriod = properties.getJobs().getGracePeriod();
        this.staleThreshold = properties.getJobs().getStaleThreshold();
        this.retention = properties.getJobs().getRetention();
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    public JobContext createJob(JobType type, Map<String, Object> metadata) {
        CancellationSource token = new CancellationSource();
        String id;
        synchronized (lock) {
            Instant now = clock.instant();
            id = allocateId(type, now);
            Job job = Job.builder()
                    .id(id)
                    .type(type)
                    .status(JobStatus.RUNNING)
                    .progress(JobProgress.starting(type))
                    .startedAt(now)
                    .metadata(metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                    .build();
            jobs.put(id, job);
            tokens.put(id, token);
            persist(job);
            notifyListeners();
        }
        log.info("Job {} started", id);
        return new JobContext(id, token, this);
    }

    public void updateProgress(String id, long current, long total, String message) {
        synchronized (lock) {
            Job job = jobs.get(id);
            if (job == null || job.getStatus().isTerminal()) {
                return;
            }
            job.setProgress(new JobProgress(current, total, message));
            persist(job);
            notifyListeners();
        }
    }

    /**
     * Moves a running job to completed or failed. A job reaches a terminal status once; later
     * calls (including after a cancellation) are ignored.
     *
     * @return whether this call performed the transition
     */
    public boolean completeJob(String id, boolean success, String errorMessage) {
        synchronized (lock) {
            Job job = jobs.get(id);
            if (job == null || job.getStatus().isTerminal()) {
                return false;
            }
            job.setStatus(success ? JobStatus.COMPLETED : JobStatus.FAILED);
            job.setCompletedAt(clock.instant());
            job.setErrorMessage(success ? null : errorMessage);
            tokens.remove(id);
            persist(job);
            notifyListeners();
            scheduleEviction(id);
        }
        log.info("Job {} {}", id, success ? "completed" : "failed" + (errorMessage != null ? ": " + errorMessage : ""));
        return true;
    }

    public boolean completeJob(String id, boolean success) {
        return completeJob(id, success, null);
    }

    /**
     * Signals the job's cancellation token and marks it cancelled. The operation itself stops
     * at its next safe point; nothing here interrupts work in flight.
     *
     * @return false if the job is unknown or no longer running
     */
    public boolean cancelJob(String id) {
        synchronized (lock) {
            Job job = jobs.get(id);
            if (job == null || job.getStatus() != JobStatus.RUNNING) {
                return false;
            }
            CancellationSource token = tokens.remove(id);
            if (token != null) {
                token.cancel();
            }
            job.setStatus(JobStatus.CANCELLED);
            job.setCompletedAt(clock.instant());
            persist(job);
            notifyListeners();
            scheduleEviction(id);
        }
        log.info("Job {} cancelled", id);
        return true;
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public List<Job> getActiveJobs() {
        synchronized (lock) {
            return jobs.values().stream()
                    .filter(j -> j.getStatus() == JobStatus.RUNNING)
                    .map(Job::copy)
                    .toList();
        }
    }

    public List<Job> getAllJobs() {
        synchronized (lock) {
            return snapshot();
        }
    }

    public Optional<Job> getJob(String id) {
        synchronized (lock) {
            return Optional.ofNullable(jobs.get(id)).map(Job::copy);
        }
    }

    public JobSubscription subscribe(JobListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ── Recovery ──────────────────────────────────────────────────────────────

    /**
     * Startup recovery: fails jobs left running by a dead process, purges expired rows and
     * loads what is still worth showing. Runs once; concurrent and later callers share the
     * same future. A failed run is forgotten so the next call tries again.
     */
    public CompletableFuture<Void> initialize() {
        CompletableFuture<Void> attempt = new CompletableFuture<>();
        if (!initialization.compareAndSet(null, attempt)) {
            return initialization.get();
        }
        try {
            recover();
            attempt.complete(null);
        } catch (RuntimeException e) {
            log.warn("Job recovery failed: {}", e.getMessage(), e);
            initialization.set(null);
            attempt.completeExceptionally(e);
        }
        return attempt;
    }

    /**
     * Deletes persisted rows past the retention window.
     *
     * @return rows deleted, 0 when the store is unavailable
     */
    public int purgeExpired() {
        try {
            return store.deleteStartedBefore(clock.instant().minus(retention));
        } catch (RuntimeException e) {
            log.warn("Failed to purge expired job rows: {}", e.getMessage());
            return 0;
        }
    }

    private void recover() {
        Instant now = clock.instant();
        int failed = store.failStaleRunning(now.minus(staleThreshold), now, INTERRUPTED_MESSAGE);
        if (failed > 0) {
            log.warn("Marked {} stale running job(s) as failed", failed);
        }
        int purged = store.deleteStartedBefore(now.minus(retention));
        if (purged > 0) {
            log.info("Purged {} job row(s) older than {}", purged, retention);
        }

        List<Job> visible = store.findVisible(now.minus(gracePeriod));
        synchronized (lock) {
            for (Job job : visible) {
                if (jobs.putIfAbsent(job.getId(), job) == null && job.getStatus().isTerminal()) {
                    scheduleEviction(job.getId());
                }
            }
            notifyListeners();
        }
        log.info("Job tracking initialised ({} job(s) restored)", visible.size());
    }

    // ── Internal ──────────────────────────────────────────────────────────────

    private String allocateId(JobType type, Instant now) {
        String base = type.getValue() + "-" + now.toEpochMilli();
        String id = base;
        for (int n = 1; jobs.containsKey(id); n++) {
            id = base + "-" + n;
        }
        return id;
    }

    private void scheduleEviction(String id) {
        try {
            evictionScheduler.schedule(() -> evict(id), gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Eviction scheduler unavailable, job {} stays until shutdown", id);
        }
    }

    void evict(String id) {
        synchronized (lock) {
            Job job = jobs.get(id);
            if (job != null && job.getStatus().isTerminal()) {
                jobs.remove(id);
                notifyListeners();
            }
        }
    }

    private void persist(Job job) {
        try {
            store.save(job.copy());
        } catch (RuntimeException e) {
            log.warn("Failed to persist job {}: {}", job.getId(), e.getMessage());
        }
    }

    private void notifyListeners() {
        if (listeners.isEmpty()) {
            return;
        }
        List<Job> current = snapshot();
        for (JobListener listener : listeners) {
            try {
                listener.onJobsChanged(current);
            } catch (RuntimeException e) {
                log.warn("Job listener failed: {}", e.getMessage());
            }
        }
    }

    private List<Job> snapshot() {
        return jobs.values().stream().map(Job::copy).toList();
    }
}
