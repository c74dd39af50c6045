package com.xgpt.search.service;

import com.xgpt.search.model.SearchHit;

import java.util.Iterator;

/**
 * Results of one query, fetched page by page as the caller iterates. {@code hasNext()} and
 * {@code next()} may throw whatever the source raised while fetching a page; the iteration
 * can then be reopened from {@link #cursor()}.
 */
public interface SearchResults extends Iterator<SearchHit> {

    /**
     * Position from which a new iteration continues with the first item this one has not
     * returned yet. Null until the source has handed out a cursor.
     */
    String cursor();
}
