package com.xgpt.search.service;

import com.xgpt.search.model.DateRange;
import com.xgpt.search.model.SearchMode;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Parameters of a new search, already parsed from the command or request body.
 */
@Data
@Builder
public class SearchRequest {

    private List<String> variants;
    private String topicName;           // optional, reuses or creates a named topic
    private int maxTweets;
    private DateRange dateRange;        // null for no date filter
    @Builder.Default
    private SearchMode mode = SearchMode.LATEST;
    private boolean embed;
}
