package com.xgpt.search.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Normalised tweet ready for the tweets table.
 */
@Data
@Builder
public class TweetRecord {

    /** Source-assigned identifier, the primary key and the deduplication key */
    private String id;

    /** Body with runs of whitespace collapsed to single spaces */
    private String text;

    private long userId;

    /** Denormalised for faster lookups by author */
    private String username;

    private Instant createdAt;
    private Instant scrapedAt;

    private boolean retweet;
    private boolean reply;
    private int likes;
    private int retweets;
    private int replies;

    /** JSON blob with quote/conversation references */
    private String metadata;
}
