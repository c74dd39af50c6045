package com.xgpt.search.model;

import lombok.Data;

/**
 * Counters for one execution of a session. Owned by a single run, never shared.
 */
@Data
public class SearchStats {

    private Long sessionId;
    private int tweetsCollected;
    private int totalProcessed;
    private int duplicatesSkipped;
    private int usersCreated;
    private boolean embeddingsGenerated;

    public static SearchStats from(SearchSession session) {
        SearchStats stats = new SearchStats();
        stats.setSessionId(session.getId());
        stats.setTweetsCollected(session.getTweetsCollected());
        stats.setTotalProcessed(session.getTotalProcessed());
        stats.setDuplicatesSkipped(session.getDuplicatesSkipped());
        stats.setUsersCreated(session.getUsersCreated());
        return stats;
    }

    public void incrementProcessed() {
        totalProcessed++;
    }

    public void incrementCollected() {
        tweetsCollected++;
    }

    public void incrementDuplicates() {
        duplicatesSkipped++;
    }

    public void incrementUsersCreated() {
        usersCreated++;
    }
}
