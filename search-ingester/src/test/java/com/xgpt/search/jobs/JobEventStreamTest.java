package com.xgpt.search.jobs;

import static org.assertj.core.api.Assertions.assertThat;

import com.xgpt.search.config.SearchIngesterProperties;
import com.xgpt.search.support.MutableClock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@ExtendWith(MockitoExtension.class)
class JobEventStreamTest {

    @Mock
    private JobStore store;

    @Mock
    private ScheduledExecutorService evictionScheduler;

    private MutableClock clock;
    private JobTrackingService jobTracking;
    private ExecutorService deliveryThread;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-10T09:00:00Z"));
        jobTracking = new JobTrackingService(store, new SearchIngesterProperties(), clock, evictionScheduler);
    }

    @AfterEach
    void tearDown() {
        if (deliveryThread != null) {
            deliveryThread.shutdownNow();
        }
    }

    @Test
    void changesAreQueuedForDeliveryInsteadOfWrittenByTheUpdatingThread() {
        Queue<Runnable> pending = new ArrayDeque<>();
        JobEventStream stream = new JobEventStream(jobTracking, clock, pending::add);
        stream.start();
        RecordingEmitter emitter = new RecordingEmitter(null);
        stream.register(emitter);

        JobContext context = jobTracking.createJob(JobType.SEARCH, null);
        jobTracking.updateProgress(context.getJobId(), 1, 10, "Collected 1 tweets");

        assertThat(emitter.events).isEmpty();
        assertThat(pending).hasSize(3);

        while (!pending.isEmpty()) {
            pending.poll().run();
        }
        assertThat(emitter.events).containsExactly("jobs", "jobs", "jobs");
    }

    @Test
    void stalledClientDoesNotHoldUpJobUpdates() throws Exception {
        deliveryThread = Executors.newSingleThreadExecutor();
        JobEventStream stream = new JobEventStream(jobTracking, clock, deliveryThread);
        stream.start();
        CountDownLatch released = new CountDownLatch(1);
        RecordingEmitter emitter = new RecordingEmitter(released);
        stream.register(emitter);
        assertThat(emitter.sending.await(5, TimeUnit.SECONDS)).isTrue();

        List<Job> jobs = CompletableFuture.supplyAsync(() -> {
            JobContext context = jobTracking.createJob(JobType.SEARCH, null);
            jobTracking.updateProgress(context.getJobId(), 5, 10, "Collected 5 tweets");
            jobTracking.cancelJob(context.getJobId());
            return jobTracking.getAllJobs();
        }).get(5, TimeUnit.SECONDS);

        assertThat(jobs).extracting(Job::getStatus).containsExactly(JobStatus.CANCELLED);
        released.countDown();
        deliveryThread.shutdown();
        assertThat(deliveryThread.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(emitter.events).hasSize(4).containsOnly("jobs");
    }

    @Test
    void pingGoesThroughTheSameQueue() {
        Queue<Runnable> pending = new ArrayDeque<>();
        JobEventStream stream = new JobEventStream(jobTracking, clock, pending::add);
        RecordingEmitter emitter = new RecordingEmitter(null);
        stream.register(emitter);

        stream.ping();
        while (!pending.isEmpty()) {
            pending.poll().run();
        }

        assertThat(emitter.events).containsExactly("jobs", "ping");
    }

    /** Records event names; optionally blocks each write until released. */
    private static final class RecordingEmitter extends SseEmitter {

        private final List<String> events = new CopyOnWriteArrayList<>();
        private final CountDownLatch sending = new CountDownLatch(1);
        private final CountDownLatch released;

        RecordingEmitter(CountDownLatch released) {
            super(0L);
            this.released = released;
        }

        @Override
        public void send(SseEventBuilder builder) {
            sending.countDown();
            if (released != null) {
                try {
                    released.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            String head = (String) builder.build().iterator().next().getData();
            events.add(head.substring("event:".length(), head.indexOf('\n')));
        }
    }
}
