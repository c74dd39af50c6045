package com.xgpt.search.cli;

import lombok.Data;

/**
 * Options of the {@code search} command. Shared by the command line and the HTTP API.
 */
@Data
public class SearchCommandOptions {

    /** Comma-separated variants, e.g. "AGI, GPT-5, foundation models" */
    private String query;
    private String name;
    private Integer maxTweets;
    private Integer days;
    private String since;               // YYYY-MM-DD
    private String until;               // YYYY-MM-DD
    private String mode;                // latest | top
    private boolean embed;
    private boolean dryRun;
    private boolean json;
    private Long resume;
    private boolean cleanup;
    private String olderThan;           // e.g. 30d
}
