package com.xgpt.search.service;

import java.util.List;

/**
 * Generates embeddings for tweets a session collected. Optional: when no bean implements it,
 * an {@code --embed} request is logged and skipped.
 */
public interface SessionEmbedder {

    void embed(long sessionId, List<String> tweetIds);
}
