package com.xgpt.search.service;

import com.xgpt.search.config.SearchIngesterProperties;
import com.xgpt.search.jobs.JobContext;
import com.xgpt.search.jobs.JobTrackingService;
import com.xgpt.search.jobs.JobType;
import com.xgpt.search.model.DateRange;
import com.xgpt.search.model.SearchHit;
import com.xgpt.search.model.SearchMode;
import com.xgpt.search.model.SearchSession;
import com.xgpt.search.model.SearchStats;
import com.xgpt.search.model.SearchTopic;
import com.xgpt.search.model.SessionStatus;
import com.xgpt.search.model.TweetRecord;
import com.xgpt.search.store.SearchSessionRepository;
import com.xgpt.search.store.SearchTopicRepository;
import com.xgpt.search.store.TweetOriginRepository;
import com.xgpt.search.store.TweetRepository;
import com.xgpt.search.store.UserRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs search sessions end to end: builds the sub-queries, iterates the source, skips tweets
 * already stored, records which variant found each new tweet and checkpoints progress so an
 * interrupted session can be resumed.
 *
 * A session runs either on the calling thread ({@link #startSearch}, {@link #resumeSearch})
 * or on the search executor ({@link #startSearchAsync}, {@link #resumeSearchAsync}). All loop
 * state belongs to a single {@link Run}; nothing is shared between sessions.
 */
@Service
@Slf4j
public class SearchSessionEngine {

    static final String UNKNOWN_USER = "unknown";
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(10);

    private final QueryBuilder queryBuilder;
    private final ErrorClassifier errorClassifier;
    private final RetryBackoff retryBackoff;
    private final JobTrackingService jobTracking;
    private final SearchSource searchSource;
    private final SearchHitMapper hitMapper;
    private final TweetRepository tweetRepository;
    private final UserRepository userRepository;
    private final SearchSessionRepository sessionRepository;
    private final SearchTopicRepository topicRepository;
    private final TweetOriginRepository originRepository;
    private final ObjectProvider<SessionEmbedder> embedderProvider;
    private final ApplicationEventPublisher eventPublisher;
    private final ExecutorService searchExecutor;
    private final Clock clock;
    private final int checkpointInterval;

    private final Map<Long, Run> activeRuns = new ConcurrentHashMap<>();

    public SearchSessionEngine(QueryBuilder queryBuilder,
                               ErrorClassifier errorClassifier,
                               RetryBackoff retryBackoff,
                               JobTrackingService jobTracking,
                               SearchSource searchSource,
                               SearchHitMapper hitMapper,
                               TweetRepository tweetRepository,
                               UserRepository userRepository,
                               SearchSessionRepository sessionRepository,
                               SearchTopicRepository topicRepository,
                               TweetOriginRepository originRepository,
                               ObjectProvider<SessionEmbedder> embedderProvider,
                               ApplicationEventPublisher eventPublisher,
                               @Qualifier("searchExecutor") ExecutorService searchExecutor,
                               Clock clock,
                               SearchIngesterProperties properties) {
        this.queryBuilder = queryBuilder;
        this.errorClassifier = errorClassifier;
        this.retryBackoff = retryBackoff;
        this.jobTracking = jobTracking;
        this.searchSource = searchSource;
        this.hitMapper = hitMapper;
        this.tweetRepository = tweetRepository;
        this.userRepository = userRepository;
        this.sessionRepository = sessionRepository;
        this.topicRepository = topicRepository;
        this.originRepository = originRepository;
        this.embedderProvider = embedderProvider;
        this.eventPublisher = eventPublisher;
        this.searchExecutor = searchExecutor;
        this.clock = clock;
        this.checkpointInterval = Math.max(1, properties.getSearch().getCheckpointInterval());
    }

    // ── Planning ─────────────────────────────────────────────────────────────

    /**
     * Validates the request and computes its queries. Touches neither the source nor the store.
     */
    public SearchPlan planSearch(SearchRequest request) {
        List<String> variants = request.getVariants() == null ? List.of() : List.copyOf(request.getVariants());
        if (variants.isEmpty()) {
            throw new SearchValidationException("At least one search variant required");
        }
        if (request.getMaxTweets() <= 0) {
            throw new SearchValidationException("Max tweets must be greater than 0");
        }
        SearchMode mode = request.getMode() != null ? request.getMode() : SearchMode.LATEST;
        List<String> queries = queryBuilder.buildQueries(variants, request.getDateRange());
        return new SearchPlan(variants, queries, request.getDateRange(), mode, request.getMaxTweets());
    }

    // ── Start / resume ───────────────────────────────────────────────────────

    public SearchOutcome startSearch(SearchRequest request) {
        return execute(openNew(request));
    }

    public SearchLaunch startSearchAsync(SearchRequest request) {
        return submit(openNew(request));
    }

    /**
     * @throws SearchValidationException if the session is unknown, completed, already running
     *                                   or has no checkpoint to resume from
     */
    public SearchOutcome resumeSearch(long sessionId) {
        return execute(openResume(sessionId));
    }

    public SearchLaunch resumeSearchAsync(long sessionId) {
        return submit(openResume(sessionId));
    }

    // ── Session queries ──────────────────────────────────────────────────────

    public Optional<SearchSession> getSession(long sessionId) {
        return sessionRepository.findById(sessionId);
    }

    public List<SearchSession> findPausedSessions() {
        return sessionRepository.findPaused();
    }

    /**
     * Tweets first discovered by the session, counted per matched variant.
     */
    public Map<String, Integer> getVariantBreakdown(long sessionId) {
        if (sessionRepository.findById(sessionId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        return originRepository.variantBreakdown(sessionId);
    }

    /**
     * Deletes sessions started more than {@code olderThanDays} days ago.
     *
     * @return number of sessions deleted
     */
    public int cleanupSessions(int olderThanDays) {
        if (olderThanDays < 0) {
            throw new SearchValidationException("Cleanup age must not be negative");
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(olderThanDays));
        int deleted = sessionRepository.deleteStartedBefore(cutoff);
        log.info("Deleted {} search session(s) started before {}", deleted, cutoff);
        return deleted;
    }

    // ── Shutdown ─────────────────────────────────────────────────────────────

    /**
     * Cancels every session this process is running so each one stops at its next item and
     * is left paused, ready to resume.
     */
    @PreDestroy
    public void pauseAll() {
        if (activeRuns.isEmpty()) {
            return;
        }
        log.info("Pausing {} running search session(s) for shutdown", activeRuns.size());
        activeRuns.values().forEach(run -> jobTracking.cancelJob(run.job.getJobId()));

        Instant deadline = clock.instant().plus(SHUTDOWN_WAIT);
        try {
            while (!activeRuns.isEmpty() && clock.instant().isBefore(deadline)) {
                retryBackoff.sleep(Duration.ofMillis(100));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!activeRuns.isEmpty()) {
            log.warn("{} search session(s) did not pause before shutdown: {}", activeRuns.size(), activeRuns.keySet());
        }
    }

    // ── Opening a run ────────────────────────────────────────────────────────

    private Run openNew(SearchRequest request) {
        SearchPlan plan = planSearch(request);
        Long topicId = resolveTopic(request.getTopicName(), plan.variants());

        DateRange range = plan.dateRange();
        SearchSession session = sessionRepository.create(SearchSession.builder()
                .topicId(topicId)
                .query(String.join(" | ", plan.queries()))
                .variants(plan.variants())
                .searchMode(plan.mode())
                .maxTweets(plan.maxTweets())
                .dateStart(range != null ? range.start() : null)
                .dateEnd(range != null ? range.end() : null)
                .status(SessionStatus.RUNNING)
                .startedAt(clock.instant())
                .build());

        log.info("Starting search (session {}): variants={}, mode={}, max={}{}",
                session.getId(), plan.variants(), plan.mode().getApiValue(), plan.maxTweets(),
                range != null ? ", range=" + range.start() + ".." + range.end() : "");

        JobContext job = jobTracking.createJob(JobType.SEARCH, jobMetadata(session, request.getTopicName(), false));
        return register(new Run(session, plan.queries(), job, request.isEmbed(), null));
    }

    private Run openResume(long sessionId) {
        SearchSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (session.getStatus() == SessionStatus.COMPLETED) {
            throw new SearchValidationException("Search session " + sessionId + " is already completed");
        }
        if (activeRuns.containsKey(sessionId)) {
            throw new SearchValidationException("Search session " + sessionId + " is already running");
        }
        if (!session.hasCheckpoint()) {
            throw new SearchValidationException("No cursor saved for session " + sessionId + ". Cannot resume.");
        }

        List<String> queries = queryBuilder.buildQueries(session.getVariants(), session.getDateRange());
        sessionRepository.markRunning(sessionId);
        session.setStatus(SessionStatus.RUNNING);

        log.info("Resuming search session {}: {}/{} tweets collected, skipping ids up to {}",
                sessionId, session.getTweetsCollected(), session.getMaxTweets(), session.getLastTweetId());

        JobContext job = jobTracking.createJob(JobType.SEARCH, jobMetadata(session, null, true));
        return register(new Run(session, queries, job, false, session.getLastTweetId()));
    }

    private Run register(Run run) {
        if (activeRuns.putIfAbsent(run.session.getId(), run) != null) {
            jobTracking.completeJob(run.job.getJobId(), false, "Session is already running");
            throw new SearchValidationException("Search session " + run.session.getId() + " is already running");
        }
        return run;
    }

    private SearchLaunch submit(Run run) {
        try {
            searchExecutor.submit(() -> execute(run));
        } catch (RejectedExecutionException e) {
            log.error("Search executor rejected session {}: {}", run.session.getId(), e.getMessage());
            finish(run, SessionStatus.FAILED, "Search executor is not accepting work");
            throw new SearchSourceException("Search executor is not accepting work", e);
        }
        return new SearchLaunch(run.session.getId(), run.job.getJobId());
    }

    private Long resolveTopic(String name, List<String> variants) {
        if (name == null || name.isBlank()) {
            return null;
        }
        Optional<SearchTopic> existing = topicRepository.findByName(name);
        if (existing.isPresent()) {
            SearchTopic topic = existing.get();
            if (!topic.getVariants().equals(variants)) {
                log.warn("Topic \"{}\" keeps its original variants {}; this search uses {}",
                        name, topic.getVariants(), variants);
            }
            log.info("Using existing topic \"{}\"", name);
            return topic.getId();
        }
        try {
            SearchTopic created = topicRepository.create(name, variants);
            log.info("Created new topic \"{}\"", name);
            return created.getId();
        } catch (TopicConflictException e) {
            // Created concurrently by another session.
            return topicRepository.findByName(name).map(SearchTopic::getId).orElseThrow(() -> e);
        }
    }

    private Map<String, Object> jobMetadata(SearchSession session, String topicName, boolean resumed) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("sessionId", session.getId());
        metadata.put("variants", session.getVariants());
        metadata.put("maxTweets", session.getMaxTweets());
        metadata.put("mode", session.getSearchMode().getApiValue());
        if (topicName != null) {
            metadata.put("topic", topicName);
        }
        metadata.put("resumed", resumed);
        return metadata;
    }

    // ── Execution ────────────────────────────────────────────────────────────

    private SearchOutcome execute(Run run) {
        SessionStatus status = SessionStatus.COMPLETED;
        String errorMessage = null;
        boolean interrupted = false;
        try {
            for (int i = 0; i < run.queries.size(); i++) {
                if (run.targetReached()) {
                    break;
                }
                if (run.queries.size() > 1) {
                    String query = run.queries.get(i);
                    log.info("Query {}/{}: {}", i + 1, run.queries.size(),
                            query.length() > 80 ? query.substring(0, 80) + "..." : query);
                }
                if (runQuery(run, run.queries.get(i)) == QueryResult.CANCELLED) {
                    status = SessionStatus.PAUSED;
                    break;
                }
            }
        } catch (SessionFailedException e) {
            status = SessionStatus.FAILED;
            errorMessage = e.getMessage();
        } catch (InterruptedException e) {
            // Restored after the session row is written.
            interrupted = true;
            status = SessionStatus.PAUSED;
        } catch (RuntimeException e) {
            log.error("Search session {} failed: {}", run.session.getId(), e.getMessage(), e);
            status = SessionStatus.FAILED;
            errorMessage = errorClassifier.classify(e).friendlyMessage() + ": " + e.getMessage();
        }
        try {
            return finish(run, status, errorMessage);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Iterates one sub-query to exhaustion, the target, or cancellation. A failure while
     * fetching reopens the same sub-query from the last cursor the source handed out.
     */
    private QueryResult runQuery(Run run, String query) throws InterruptedException {
        String cursor = null;
        int retries = 0;
        int rateLimitWaits = 0;

        while (true) {
            SearchResults results = searchSource.search(query, run.session.getSearchMode(), cursor);
            try {
                while (true) {
                    if (run.job.isCancelled()) {
                        run.lastCursor = results.cursor() != null ? results.cursor() : cursor;
                        return QueryResult.CANCELLED;
                    }
                    if (!results.hasNext()) {
                        return QueryResult.EXHAUSTED;
                    }
                    SearchHit hit = results.next();
                    retries = 0;
                    rateLimitWaits = 0;

                    if (run.alreadyExamined(hit)) {
                        continue;
                    }
                    processHit(run, hit);
                    run.lastCursor = results.cursor();
                    if (run.stats.getTotalProcessed() % checkpointInterval == 0) {
                        checkpoint(run);
                    }
                    if (run.targetReached()) {
                        return QueryResult.TARGET_REACHED;
                    }
                }
            } catch (RuntimeException e) {
                if (results.cursor() != null) {
                    cursor = results.cursor();
                }
                ErrorClassification classification = errorClassifier.classify(e);
                switch (classification.category()) {
                    case RATE_LIMIT -> {
                        if (++rateLimitWaits > retryBackoff.getRateLimitMaxWaits()) {
                            throw new SessionFailedException("Rate limit persisted after "
                                    + retryBackoff.getRateLimitMaxWaits() + " waits: " + e.getMessage(), e);
                        }
                        Duration wait = retryBackoff.rateLimitWait(e);
                        log.warn("Rate limited on session {}. Waiting {}s for reset (wait {}/{})",
                                run.session.getId(), wait.toSeconds(), rateLimitWaits, retryBackoff.getRateLimitMaxWaits());
                        run.reportProgress("Rate limited, waiting " + wait.toSeconds() + "s for reset");
                        if (!retryBackoff.sleepUnless(wait, run.job::isCancelled)) {
                            run.lastCursor = cursor;
                            return QueryResult.CANCELLED;
                        }
                    }
                    case AUTHENTICATION, VALIDATION -> throw new SessionFailedException(
                            classification.friendlyMessage() + ": " + e.getMessage(), e);
                    default -> {
                        if (retries >= retryBackoff.getMaxAttempts()) {
                            throw new SessionFailedException(classification.friendlyMessage()
                                    + " (gave up after " + retries + " retries): " + e.getMessage(), e);
                        }
                        retries++;
                        Duration delay = retryBackoff.backoffDelay(classification, retries);
                        log.warn("Search query failed on session {} ({}), retry {}/{} in {}ms: {}",
                                run.session.getId(), classification.category(), retries,
                                retryBackoff.getMaxAttempts(), delay.toMillis(), e.getMessage());
                        if (!retryBackoff.sleepUnless(delay, run.job::isCancelled)) {
                            run.lastCursor = cursor;
                            return QueryResult.CANCELLED;
                        }
                    }
                }
            }
        }
    }

    private void processHit(Run run, SearchHit hit) {
        SearchStats stats = run.stats;
        stats.incrementProcessed();
        if (hit.getId() != null) {
            run.lastSeenId = hit.getId();
        }

        try {
            if (!hit.isAvailable()) {
                return;
            }
            if (tweetRepository.exists(hit.getId())) {
                stats.incrementDuplicates();
                return;
            }

            String username = hit.getUsername() != null ? hit.getUsername() : UNKNOWN_USER;
            UserRepository.EnsureResult user = userRepository.ensureUser(username, hit.getDisplayName());
            if (user.created()) {
                stats.incrementUsersCreated();
            }

            TweetRecord tweet = hitMapper.toTweet(hit, user.id(), username, clock.instant());
            if (!tweetRepository.insert(tweet)) {
                stats.incrementDuplicates();
                return;
            }

            String variant = queryBuilder.matchVariant(hit.getText(), run.variants())
                    .orElse(run.variants().get(0));
            if (!originRepository.recordOrigin(hit.getId(), run.session.getId(), variant)) {
                log.debug("Tweet {} already has an origin, keeping the first one", hit.getId());
            }
            stats.incrementCollected();
        } catch (RuntimeException e) {
            log.warn("Failed to store tweet {} for session {}: {}", hit.getId(), run.session.getId(), e.getMessage());
        } finally {
            run.reportProgress(null);
        }
    }

    private void checkpoint(Run run) {
        if (run.lastSeenId == null) {
            return;
        }
        try {
            sessionRepository.saveCheckpoint(run.session.getId(), run.lastCursor, run.lastSeenId, run.stats);
            log.info("Session {}: {}/{} tweets ({} new this run, {} duplicates, {} examined)",
                    run.session.getId(), run.stats.getTweetsCollected(), run.session.getMaxTweets(),
                    run.collectedThisRun(), run.stats.getDuplicatesSkipped(), run.stats.getTotalProcessed());
        } catch (RuntimeException e) {
            log.warn("Failed to checkpoint session {}: {}", run.session.getId(), e.getMessage());
        }
    }

    // ── Completion ───────────────────────────────────────────────────────────

    private SearchOutcome finish(Run run, SessionStatus status, String errorMessage) {
        long sessionId = run.session.getId();
        try {
            if (status == SessionStatus.PAUSED) {
                checkpoint(run);
            }
            Instant completedAt = status == SessionStatus.PAUSED ? null : clock.instant();
            sessionRepository.finish(sessionId, run.stats, status, completedAt, errorMessage);

            if (run.session.getTopicId() != null) {
                topicRepository.recordSearch(run.session.getTopicId(), run.collectedThisRun());
            }
            if (status == SessionStatus.COMPLETED && run.embed && run.collectedThisRun() > 0) {
                generateEmbeddings(run);
            }
        } catch (RuntimeException e) {
            log.error("Failed to finalise search session {}: {}", sessionId, e.getMessage(), e);
        }

        switch (status) {
            case COMPLETED -> {
                jobTracking.completeJob(run.job.getJobId(), true);
                log.info("Search complete (session {}): {} new tweets, {} duplicates, {} users created",
                        sessionId, run.collectedThisRun(), run.stats.getDuplicatesSkipped(), run.stats.getUsersCreated());
            }
            case FAILED -> {
                jobTracking.completeJob(run.job.getJobId(), false, errorMessage);
                log.error("Search session {} failed: {}", sessionId, errorMessage);
            }
            default -> {
                jobTracking.cancelJob(run.job.getJobId());
                log.info("Search session {} paused after {} examined; resume with --resume={}",
                        sessionId, run.stats.getTotalProcessed(), sessionId);
            }
        }

        activeRuns.remove(sessionId, run);
        eventPublisher.publishEvent(new SearchSessionCompletedEvent(sessionId, status, run.stats, run.embed));
        return new SearchOutcome(sessionId, run.job.getJobId(), status, run.stats, errorMessage);
    }

    private void generateEmbeddings(Run run) {
        SessionEmbedder embedder = embedderProvider.getIfAvailable();
        if (embedder == null) {
            log.warn("Embedding requested for session {} but no embedder is configured; skipping",
                    run.session.getId());
            return;
        }
        try {
            embedder.embed(run.session.getId(), originRepository.findTweetIdsBySession(run.session.getId()));
            sessionRepository.markEmbeddingsGenerated(run.session.getId());
            run.stats.setEmbeddingsGenerated(true);
        } catch (RuntimeException e) {
            log.warn("Embedding generation failed for session {}: {}", run.session.getId(), e.getMessage());
        }
    }

    // ── Run state ────────────────────────────────────────────────────────────

    private enum QueryResult {
        EXHAUSTED,
        TARGET_REACHED,
        CANCELLED
    }

    private static class SessionFailedException extends RuntimeException {
        SessionFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Loop state of one execution. Owned by the thread running it.
     */
    private static final class Run {

        final SearchSession session;
        final List<String> queries;
        final JobContext job;
        final boolean embed;
        final String skipThroughId;     // resume checkpoint, null for a new session
        final SearchStats stats;
        final int initialCollected;

        String lastSeenId;
        String lastCursor;

        Run(SearchSession session, List<String> queries, JobContext job, boolean embed, String skipThroughId) {
            this.session = session;
            this.queries = queries;
            this.job = job;
            this.embed = embed;
            this.skipThroughId = skipThroughId;
            this.stats = SearchStats.from(session);
            this.initialCollected = session.getTweetsCollected();
            this.lastSeenId = session.getLastTweetId();
            this.lastCursor = session.getCursor();
        }

        List<String> variants() {
            return session.getVariants();
        }

        boolean targetReached() {
            return stats.getTweetsCollected() >= session.getMaxTweets();
        }

        int collectedThisRun() {
            return stats.getTweetsCollected() - initialCollected;
        }

        boolean alreadyExamined(SearchHit hit) {
            return skipThroughId != null
                    && hit.getId() != null
                    && IdOrdering.isAtOrBefore(hit.getId(), skipThroughId);
        }

        void reportProgress(String message) {
            String text = message != null ? message : String.format("%d/%d tweets (%d new, %d duplicates)",
                    stats.getTotalProcessed(), session.getMaxTweets(), collectedThisRun(), stats.getDuplicatesSkipped());
            job.updateProgress(stats.getTweetsCollected(), session.getMaxTweets(), text);
        }
    }
}
