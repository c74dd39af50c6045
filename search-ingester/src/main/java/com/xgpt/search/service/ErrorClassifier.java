package com.xgpt.search.service;

import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Maps a failure to a retry category.
 *
 * Typed exceptions along the cause chain are checked first; otherwise the combined messages
 * (with any HTTP status code) are matched against pattern lists in a fixed order: network,
 * rate limit, temporary, authentication, validation. The first list that matches wins.
 */
@Component
public class ErrorClassifier {

    static final Duration RATE_LIMIT_DELAY = Duration.ofSeconds(60);
    static final Duration TEMPORARY_DELAY = Duration.ofSeconds(5);
    static final Duration NETWORK_DELAY = Duration.ofSeconds(2);
    static final Duration UNKNOWN_DELAY = Duration.ofSeconds(1);

    private static final List<Pattern> NETWORK = patterns(
            "ECONNREFUSED", "ENOTFOUND", "ETIMEDOUT", "ECONNRESET", "ENETUNREACH", "EHOSTUNREACH",
            "socket hang up", "network", "connection.*(failed|refused|reset)", "fetch failed",
            "request.*timeout", "read timed out", "connect timed out", "dns.*lookup.*failed");

    private static final List<Pattern> RATE_LIMIT = patterns(
            "rate.?limit", "too many requests", "\\b429\\b", "quota.*exceeded",
            "temporarily.*unavailable", "try again later");

    private static final List<Pattern> TEMPORARY = patterns(
            "\\b500\\b", "\\b502\\b", "\\b503\\b", "\\b504\\b", "internal.*server.*error",
            "service.*unavailable", "gateway.*timeout", "bad.*gateway", "temporarily");

    private static final List<Pattern> AUTHENTICATION = patterns(
            "\\b401\\b", "\\b403\\b", "unauthorized", "forbidden", "invalid.*token", "auth.*token",
            "authentication", "not.*logged.*in", "session.*expired");

    private static final List<Pattern> VALIDATION = patterns(
            "\\b400\\b", "\\b422\\b", "invalid.*input", "validation.*error", "required.*parameter",
            "missing.*argument", "invalid.*format", "user.*not.*found", "does.*not.*exist");

    public ErrorClassification classify(Throwable error) {
        ErrorClassification typed = classifyByType(error);
        if (typed != null) {
            return typed;
        }

        String text = describe(error);
        if (matchesAny(NETWORK, text)) {
            return network();
        }
        if (matchesAny(RATE_LIMIT, text)) {
            return rateLimit();
        }
        if (matchesAny(TEMPORARY, text)) {
            return temporary();
        }
        if (matchesAny(AUTHENTICATION, text)) {
            return authentication();
        }
        if (matchesAny(VALIDATION, text)) {
            return validation();
        }
        return new ErrorClassification(ErrorCategory.UNKNOWN, true, UNKNOWN_DELAY,
                "An unexpected error occurred. Retrying...");
    }

    public boolean isRetryable(Throwable error) {
        return classify(error).retryable();
    }

    private ErrorClassification classifyByType(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof RateLimitException) {
                return rateLimit();
            }
            if (t instanceof SourceAuthenticationException) {
                return authentication();
            }
            if (t instanceof SearchValidationException) {
                return validation();
            }
            if (t instanceof ConnectException || t instanceof UnknownHostException
                    || t instanceof SocketTimeoutException || t instanceof ResourceAccessException) {
                return network();
            }
            if (t instanceof HttpStatusCodeException http) {
                int status = http.getStatusCode().value();
                if (status == 429) {
                    return rateLimit();
                }
                if (status == 401 || status == 403) {
                    return authentication();
                }
                if (status == 400 || status == 404 || status == 422) {
                    return validation();
                }
                if (status >= 500) {
                    return temporary();
                }
            }
        }
        return null;
    }

    private static String describe(Throwable error) {
        StringBuilder text = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            text.append(t.getClass().getSimpleName()).append(": ");
            if (t.getMessage() != null) {
                text.append(t.getMessage());
            }
            text.append('\n');
        }
        return text.toString();
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        return patterns.stream().anyMatch(p -> p.matcher(text).find());
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    private static ErrorClassification network() {
        return new ErrorClassification(ErrorCategory.NETWORK, true, NETWORK_DELAY,
                "Network connection issue. Retrying...");
    }

    private static ErrorClassification rateLimit() {
        return new ErrorClassification(ErrorCategory.RATE_LIMIT, true, RATE_LIMIT_DELAY,
                "Rate limited by the search API. Waiting before retry...");
    }

    private static ErrorClassification temporary() {
        return new ErrorClassification(ErrorCategory.TEMPORARY, true, TEMPORARY_DELAY,
                "Search API temporarily unavailable. Retrying...");
    }

    private static ErrorClassification authentication() {
        return new ErrorClassification(ErrorCategory.AUTHENTICATION, false, Duration.ZERO,
                "Authentication failed. Please check the search API credentials.");
    }

    private static ErrorClassification validation() {
        return new ErrorClassification(ErrorCategory.VALIDATION, false, Duration.ZERO,
                "Invalid request. Please check your input.");
    }
}
