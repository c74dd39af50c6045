package com.xgpt.search.service;

import java.time.Duration;

/**
 * Blocking wait used for backoff and rate-limit recovery.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
