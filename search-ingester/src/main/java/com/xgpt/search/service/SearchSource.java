package com.xgpt.search.service;

import com.xgpt.search.model.SearchMode;

/**
 * External, cursor-paginated search API.
 */
public interface SearchSource {

    /**
     * Opens a lazy iteration over the results of one query. No request is made until the
     * first call to {@code hasNext()}.
     *
     * @param startCursor cursor returned by an earlier {@link SearchResults#cursor()}, or null
     *                    to start from the first page
     */
    SearchResults search(String query, SearchMode mode, String startCursor);
}
