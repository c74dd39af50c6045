package com.xgpt.search.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * One item yielded by the search source. Any field may be missing when the source
 * reports a withheld or deleted tweet.
 */
@Data
@Builder
public class SearchHit {

    private String id;
    private String text;
    private String username;
    private String displayName;
    private Instant createdAt;
    private boolean retweet;
    private boolean reply;
    private boolean quoted;
    private String quotedStatusId;
    private String conversationId;
    private Integer likes;
    private Integer retweets;
    private Integer replies;

    public boolean isAvailable() {
        return id != null && !id.isBlank() && text != null && !text.isBlank();
    }
}
