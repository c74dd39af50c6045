package com.xgpt.search.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.xgpt.search.config.SearchIngesterProperties;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetryBackoffTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private SearchIngesterProperties properties;
    private RetryBackoff backoff;

    @BeforeEach
    void setUp() {
        properties = new SearchIngesterProperties();
        properties.getRetry().setJitter(0.0);
        properties.getRetry().setMaxDelay(Duration.ofSeconds(30));
        backoff = new RetryBackoff(properties, sleeps::add);
    }

    @Test
    void backoffGrowsExponentiallyFromSuggestedDelayUpToCap() {
        ErrorClassification network = new ErrorClassifier().classify(new ConnectException("refused"));

        assertThat(backoff.backoffDelay(network, 1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.backoffDelay(network, 2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.backoffDelay(network, 3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(backoff.backoffDelay(network, 10)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void rateLimitWaitPrefersAdvertisedReset() {
        assertThat(backoff.rateLimitWait(new RateLimitException("429", Duration.ofSeconds(42))))
                .isEqualTo(Duration.ofSeconds(42));
        assertThat(backoff.rateLimitWait(new RuntimeException("Rate limited, retry after 90 seconds")))
                .isEqualTo(Duration.ofSeconds(90));
        assertThat(backoff.rateLimitWait(new RateLimitException("429", null)))
                .isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void rateLimitWaitIsCapped() {
        properties.getRetry().setRateLimitMaxWait(Duration.ofMinutes(2));

        assertThat(backoff.rateLimitWait(new RateLimitException("429", Duration.ofHours(1))))
                .isEqualTo(Duration.ofMinutes(2));
    }

    @Test
    void sleepUnlessSleepsInSlicesAndStopsOnCancellation() throws InterruptedException {
        assertThat(backoff.sleepUnless(Duration.ofMillis(2500), () -> false)).isTrue();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofMillis(500));

        sleeps.clear();
        AtomicInteger checks = new AtomicInteger();
        assertThat(backoff.sleepUnless(Duration.ofSeconds(10), () -> checks.incrementAndGet() > 2)).isFalse();
        assertThat(sleeps).hasSize(2);
    }
}
