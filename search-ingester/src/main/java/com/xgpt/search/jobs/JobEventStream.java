package com.xgpt.search.jobs;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Server-sent event fan-out of job snapshots. Every change in {@link JobTrackingService}
 * is pushed to all open streams as a {@code jobs} event.
 * <p>
 * Snapshots are taken by the tracking service and written to the streams on the delivery
 * executor, so a slow client never holds up the threads that update jobs.
 */
@Component
@Slf4j
public class JobEventStream {

    static final String JOBS_EVENT = "jobs";
    static final String PING_EVENT = "ping";

    private final JobTrackingService jobTracking;
    private final Clock clock;
    private final Executor delivery;

    private final Set<SseEmitter> emitters = new CopyOnWriteArraySet<>();
    private JobSubscription subscription;

    public JobEventStream(JobTrackingService jobTracking,
                          Clock clock,
                          @Qualifier("jobStreamExecutor") Executor delivery) {
        this.jobTracking = jobTracking;
        this.clock = clock;
        this.delivery = delivery;
    }

    @PostConstruct
    public void start() {
        subscription = jobTracking.subscribe(this::broadcastJobs);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
        emitters.forEach(SseEmitter::complete);
        emitters.clear();
    }

    /**
     * Opens a stream that starts with the current snapshot.
     */
    public SseEmitter open() {
        return register(new SseEmitter(0L));
    }

    SseEmitter register(SseEmitter emitter) {
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        emitters.add(emitter);
        List<Job> jobs = jobTracking.getAllJobs();
        deliver(() -> send(emitter, JOBS_EVENT, jobs));
        return emitter;
    }

    public void ping() {
        Map<String, Object> payload = Map.of("timestamp", clock.millis());
        deliver(() -> emitters.forEach(emitter -> send(emitter, PING_EVENT, payload)));
    }

    private void broadcastJobs(List<Job> jobs) {
        deliver(() -> emitters.forEach(emitter -> send(emitter, JOBS_EVENT, jobs)));
    }

    private void deliver(Runnable task) {
        try {
            delivery.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Job stream delivery stopped: {}", e.getMessage());
        }
    }

    private void send(SseEmitter emitter, String name, Object data) {
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping job stream: {}", e.getMessage());
            emitters.remove(emitter);
            emitter.completeWithError(e);
        }
    }
}
