package com.xgpt.search.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xgpt.search.model.SearchApiPage;
import com.xgpt.search.model.SearchHit;
import com.xgpt.search.model.TweetRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw search API items to {@link SearchHit}, and hits to database-ready tweets.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SearchHitMapper {

    // "Wed Oct 10 20:19:24 +0000 2018"
    private static final DateTimeFormatter LEGACY_DATE =
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH);

    private final ObjectMapper objectMapper;

    public SearchHit toHit(SearchApiPage.Item raw) {
        return SearchHit.builder()
                .id(emptyToNull(raw.getId()))
                .text(raw.getText())
                .username(emptyToNull(raw.getUsername()))
                .displayName(emptyToNull(raw.getName()))
                .createdAt(parseCreatedAt(raw.getCreatedAt()))
                .retweet(Boolean.TRUE.equals(raw.getRetweet()))
                .reply(Boolean.TRUE.equals(raw.getReply()))
                .quoted(Boolean.TRUE.equals(raw.getQuoted()))
                .quotedStatusId(emptyToNull(raw.getQuotedStatusId()))
                .conversationId(emptyToNull(raw.getConversationId()))
                .likes(raw.getLikes())
                .retweets(raw.getRetweets())
                .replies(raw.getReplies())
                .build();
    }

    /**
     * Convert a hit to a tweet row owned by {@code userId}.
     *
     * @param scrapedAt also used as the creation time when the source did not supply one
     */
    public TweetRecord toTweet(SearchHit hit, long userId, String username, Instant scrapedAt) {
        return TweetRecord.builder()
                .id(hit.getId())
                .text(collapseWhitespace(hit.getText()))
                .userId(userId)
                .username(username)
                .createdAt(hit.getCreatedAt() != null ? hit.getCreatedAt() : scrapedAt)
                .scrapedAt(scrapedAt)
                .retweet(hit.isRetweet())
                .reply(hit.isReply())
                .likes(orZero(hit.getLikes()))
                .retweets(orZero(hit.getRetweets()))
                .replies(orZero(hit.getReplies()))
                .metadata(metadataJson(hit))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static String collapseWhitespace(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }

    private String metadataJson(SearchHit hit) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("isQuoted", hit.isQuoted());
        metadata.put("quotedStatus", hit.getQuotedStatusId());
        metadata.put("conversationId", hit.getConversationId());
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise metadata for tweet {}: {}", hit.getId(), e.getMessage());
            return null;
        }
    }

    private Instant parseCreatedAt(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return ZonedDateTime.parse(value, LEGACY_DATE).toInstant();
            } catch (DateTimeParseException e2) {
                log.warn("Could not parse tweet timestamp: {}", value);
                return null;
            }
        }
    }

    private int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
