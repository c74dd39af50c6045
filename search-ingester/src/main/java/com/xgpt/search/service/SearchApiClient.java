package com.xgpt.search.service;

import com.xgpt.search.config.SearchIngesterProperties;
import com.xgpt.search.model.SearchApiPage;
import com.xgpt.search.model.SearchMode;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Thin client over the search API's paginated {@code /search} endpoint.
 *
 * Transient failures (timeouts, 5xx) are retried by Resilience4j. A 429 is not: it is turned
 * into a {@link RateLimitException} carrying the advertised reset so the session engine can
 * wait it out and reopen the query where it stopped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SearchApiClient {

    private final RestTemplate restTemplate;
    private final SearchIngesterProperties properties;
    private final Sleeper sleeper;

    /**
     * Fetch one page of results.
     *
     * @param cursor null for the first page
     * @return the page, never null
     */
    @Retry(name = "searchApi")
    public SearchApiPage fetchPage(String query, SearchMode mode, String cursor) {
        SearchIngesterProperties.Source source = properties.getSource();
        if (source.getBearerToken() == null || source.getBearerToken().isBlank()) {
            throw new SourceAuthenticationException("Search API authentication token is missing");
        }

        UriComponentsBuilder uri = UriComponentsBuilder
                .fromHttpUrl(source.getBaseUrl() + "/search")
                .queryParam("q", query)
                .queryParam("mode", mode.getApiValue())
                .queryParam("count", source.getPageSize());
        if (cursor != null && !cursor.isBlank()) {
            uri.queryParam("cursor", cursor);
        }
        URI url = uri.encode().build().toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(source.getBearerToken());

        log.debug("Calling search API: {}", url);
        try {
            applyRequestDelay();
            SearchApiPage page = restTemplate
                    .exchange(url, HttpMethod.GET, new HttpEntity<>(headers), SearchApiPage.class)
                    .getBody();
            if (page == null) {
                return new SearchApiPage();
            }
            log.debug("Search API returned {} items (next cursor: {})",
                    page.getItems() == null ? 0 : page.getItems().size(), page.getNextCursor());
            return page;

        } catch (HttpClientErrorException.TooManyRequests e) {
            Duration retryAfter = parseRetryAfter(e.getResponseHeaders());
            log.warn("Rate limited (429) by search API, reset in {}", retryAfter != null ? retryAfter : "unknown");
            throw new RateLimitException("Rate limit exceeded (429)", retryAfter);

        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
                    || e.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                throw new SourceAuthenticationException(
                        "Search API rejected credentials (" + e.getStatusCode().value() + ")", e);
            }
            log.error("Search API call failed for URL {}: {}", url, e.getMessage());
            throw e;

        } catch (RuntimeException e) {
            log.error("Search API call failed for URL {}: {}", url, e.getMessage());
            throw e;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void applyRequestDelay() {
        Duration delay = properties.getSource().getRequestDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    static Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
