package com.xgpt.search.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Raw DTO matching one page of the search API's JSON response.
 * Kept separate from {@link SearchHit} to isolate API coupling.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchApiPage {

    private List<Item> items;

    @JsonProperty("next_cursor")
    private String nextCursor;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        private String id;
        private String text;
        private String username;
        private String name;

        @JsonProperty("created_at")
        private String createdAt;

        @JsonProperty("is_retweet")
        private Boolean retweet;

        @JsonProperty("is_reply")
        private Boolean reply;

        @JsonProperty("is_quoted")
        private Boolean quoted;

        @JsonProperty("quoted_status_id")
        private String quotedStatusId;

        @JsonProperty("conversation_id")
        private String conversationId;

        private Integer likes;
        private Integer retweets;
        private Integer replies;
    }
}
