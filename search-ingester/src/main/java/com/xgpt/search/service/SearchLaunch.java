package com.xgpt.search.service;

/**
 * Identifiers of a session that was accepted and handed to the search executor.
 */
public record SearchLaunch(long sessionId, String jobId) {
}
