package com.xgpt.search.service;

import com.xgpt.search.config.SearchIngesterProperties;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.BooleanSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a classified failure into a concrete wait.
 *
 * Ordinary retries grow exponentially from the category's suggested delay with random
 * jitter, capped at {@code retry.max-delay}. Rate-limit waits honour the reset window the
 * source advertised, capped at {@code retry.rate-limit-max-wait}.
 */
@Component
public class RetryBackoff {

    private static final Pattern RETRY_AFTER = Pattern.compile("retry after (\\d+)", Pattern.CASE_INSENSITIVE);
    private static final double MULTIPLIER = 2.0;
    private static final Duration WAIT_SLICE = Duration.ofSeconds(1);

    private final SearchIngesterProperties.Retry config;
    private final Sleeper sleeper;

    public RetryBackoff(SearchIngesterProperties properties, Sleeper sleeper) {
        this.config = properties.getRetry();
        this.sleeper = sleeper;
    }

    /**
     * @param attempt 1 for the first retry
     */
    public Duration backoffDelay(ErrorClassification classification, int attempt) {
        long initial = Math.max(1, classification.suggestedDelay().toMillis());
        long max = config.getMaxDelay().toMillis();
        IntervalFunction intervals = IntervalFunction.ofExponentialRandomBackoff(
                initial, MULTIPLIER, config.getJitter(), max);
        long delay = intervals.apply(Math.max(1, attempt));
        return Duration.ofMillis(Math.min(delay, max));
    }

    public Duration rateLimitWait(Throwable error) {
        Duration wait = advertisedReset(error);
        if (wait == null || wait.isNegative() || wait.isZero()) {
            wait = config.getRateLimitDefaultWait();
        }
        Duration cap = config.getRateLimitMaxWait();
        return wait.compareTo(cap) > 0 ? cap : wait;
    }

    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        sleeper.sleep(duration);
    }

    /**
     * Sleeps in short slices so a cancellation requested mid-wait is noticed promptly.
     *
     * @return false if {@code cancelled} became true before the full duration elapsed
     */
    public boolean sleepUnless(Duration duration, BooleanSupplier cancelled) throws InterruptedException {
        Duration remaining = duration;
        while (remaining.compareTo(Duration.ZERO) > 0) {
            if (cancelled.getAsBoolean()) {
                return false;
            }
            Duration slice = remaining.compareTo(WAIT_SLICE) > 0 ? WAIT_SLICE : remaining;
            sleeper.sleep(slice);
            remaining = remaining.minus(slice);
        }
        return !cancelled.getAsBoolean();
    }

    public int getMaxAttempts() {
        return Math.max(1, config.getMaxAttempts());
    }

    public int getRateLimitMaxWaits() {
        return Math.max(1, config.getRateLimitMaxWaits());
    }

    private static Duration advertisedReset(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof RateLimitException rateLimit && rateLimit.getRetryAfter() != null) {
                return rateLimit.getRetryAfter();
            }
            if (t.getMessage() != null) {
                Matcher matcher = RETRY_AFTER.matcher(t.getMessage());
                if (matcher.find()) {
                    return Duration.ofSeconds(Long.parseLong(matcher.group(1)));
                }
            }
        }
        return null;
    }
}
