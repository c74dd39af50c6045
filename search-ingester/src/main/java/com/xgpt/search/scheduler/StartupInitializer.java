package com.xgpt.search.scheduler;

import com.xgpt.search.jobs.JobTrackingService;
import com.xgpt.search.model.SearchSession;
import com.xgpt.search.store.SchemaInitializer;
import com.xgpt.search.store.SearchSessionRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * On application startup:
 *  1. Ensure the database schema exists
 *  2. Recover job tracking state left by the previous process
 *  3. Report sessions that are waiting to be resumed
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StartupInitializer {

    private final SchemaInitializer schemaInitializer;
    private final JobTrackingService jobTracking;
    private final SearchSessionRepository sessionRepository;

    @PostConstruct
    public void onStartup() {
        schemaInitializer.ensureSchema();

        try {
            jobTracking.initialize().join();
        } catch (CompletionException e) {
            log.warn("Job tracking starts without recovered jobs: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }

        try {
            List<SearchSession> paused = sessionRepository.findPaused();
            if (!paused.isEmpty()) {
                log.info("{} paused search session(s) can be resumed: {}", paused.size(),
                        paused.stream().map(SearchSession::getId).toList());
            }
        } catch (Exception e) {
            log.warn("Could not list paused sessions: {}", e.getMessage());
        }
    }
}
