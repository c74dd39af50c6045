package com.xgpt.search.config;

import com.xgpt.search.cli.SearchCommand;
import com.xgpt.search.cli.SearchCommandOptions;
import com.xgpt.search.model.SearchSession;
import com.xgpt.search.service.QueryBuilder;
import com.xgpt.search.service.SearchLaunch;
import com.xgpt.search.service.SearchPlan;
import com.xgpt.search.service.SearchSessionEngine;
import com.xgpt.search.service.SearchValidationException;
import com.xgpt.search.service.SessionNotFoundException;
import com.xgpt.search.service.TopicConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class SearchController {

    private final SearchSessionEngine engine;
    private final SearchCommand searchCommand;
    private final QueryBuilder queryBuilder;

    // ── Search triggers ───────────────────────────────────────────────────────

    /**
     * Start a search in the background.
     *
     * POST /search {"query": "AGI, GPT-5", "maxTweets": 200, "days": 7}
     *
     * Progress is available from /jobs and /jobs/stream under the returned jobId.
     */
    @PostMapping("/search")
    public ResponseEntity<?> start(@RequestBody SearchCommandOptions options) {
        try {
            if (options.isDryRun()) {
                return dryRun(options);
            }
            SearchLaunch launch = engine.startSearchAsync(searchCommand.toRequest(options));
            return ResponseEntity.accepted().body(Map.of(
                    "status", "accepted",
                    "sessionId", launch.sessionId(),
                    "jobId", launch.jobId()));
        } catch (TopicConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (SearchValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Search start failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/search/dry-run")
    public ResponseEntity<?> dryRun(@RequestBody SearchCommandOptions options) {
        try {
            SearchPlan plan = engine.planSearch(searchCommand.toRequest(options));
            return ResponseEntity.ok(Map.of(
                    "message", searchCommand.dryRun(plan).message(),
                    "queries", plan.queries(),
                    "totalQueryLength", plan.totalQueryLength()));
        } catch (SearchValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/search/{sessionId}/resume")
    public ResponseEntity<?> resume(@PathVariable long sessionId) {
        try {
            SearchLaunch launch = engine.resumeSearchAsync(sessionId);
            return ResponseEntity.accepted().body(Map.of(
                    "status", "accepted",
                    "sessionId", launch.sessionId(),
                    "jobId", launch.jobId()));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (SearchValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Resume of session {} failed: {}", sessionId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Session API ───────────────────────────────────────────────────────────

    /**
     * DELETE /search/sessions?olderThan=30d
     */
    @DeleteMapping("/search/sessions")
    public ResponseEntity<?> cleanup(@RequestParam String olderThan) {
        try {
            int days = queryBuilder.parseDurationDays(olderThan);
            return ResponseEntity.ok(Map.of("deleted", engine.cleanupSessions(days), "olderThanDays", days));
        } catch (SearchValidationException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/search/sessions/paused")
    public List<SearchSession> paused() {
        return engine.findPausedSessions();
    }

    @GetMapping("/search/sessions/{sessionId}")
    public ResponseEntity<SearchSession> session(@PathVariable long sessionId) {
        return engine.getSession(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/search/sessions/{sessionId}/variants")
    public ResponseEntity<?> variants(@PathVariable long sessionId) {
        try {
            return ResponseEntity.ok(engine.getVariantBreakdown(sessionId));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }
}
