package com.xgpt.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Links a stored tweet to the session and variant that first discovered it.
 * At most one row exists per tweet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TweetSearchOrigin {

    private Long id;
    private String tweetId;
    private long searchSessionId;
    private String matchedVariant;
    private Instant foundAt;
}
