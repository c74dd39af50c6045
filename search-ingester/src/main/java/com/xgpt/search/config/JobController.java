package com.xgpt.search.config;

import com.xgpt.search.jobs.Job;
import com.xgpt.search.jobs.JobEventStream;
import com.xgpt.search.jobs.JobTrackingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class JobController {

    private final JobTrackingService jobTracking;
    private final JobEventStream jobEventStream;

    @GetMapping("/jobs")
    public List<Job> all() {
        return jobTracking.getAllJobs();
    }

    @GetMapping("/jobs/active")
    public List<Job> active() {
        return jobTracking.getActiveJobs();
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<Job> job(@PathVariable String jobId) {
        return jobTracking.getJob(jobId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Live job list: a {@code jobs} event on every change, a {@code ping} event every 15s.
     */
    @GetMapping(path = "/jobs/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return jobEventStream.open();
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public Map<String, Object> cancel(@PathVariable String jobId) {
        return Map.of("jobId", jobId, "cancelled", jobTracking.cancelJob(jobId));
    }
}
