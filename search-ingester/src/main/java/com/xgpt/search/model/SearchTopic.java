package com.xgpt.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Named, reusable set of search variants. Variants never change after creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchTopic {

    private Long id;
    private String name;
    private List<String> variants;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastSearched;
    private int totalTweetsFound;
}
