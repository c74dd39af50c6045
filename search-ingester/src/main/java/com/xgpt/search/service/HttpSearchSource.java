package com.xgpt.search.service;

import com.xgpt.search.model.SearchApiPage;
import com.xgpt.search.model.SearchHit;
import com.xgpt.search.model.SearchMode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * {@link SearchSource} backed by {@link SearchApiClient}. Pages are requested lazily, one at a
 * time, as the caller iterates.
 */
@Component
@RequiredArgsConstructor
public class HttpSearchSource implements SearchSource {

    private final SearchApiClient apiClient;
    private final SearchHitMapper mapper;

    @Override
    public SearchResults search(String query, SearchMode mode, String startCursor) {
        return new PagedResults(query, mode, startCursor);
    }

    private class PagedResults implements SearchResults {

        private final String query;
        private final SearchMode mode;
        private String pageCursor;      // cursor that fetched the current page
        private String nextCursor;      // cursor for the page after it
        private Iterator<SearchHit> page = Collections.emptyIterator();
        private boolean exhausted;

        PagedResults(String query, SearchMode mode, String startCursor) {
            this.query = query;
            this.mode = mode;
            this.nextCursor = startCursor;
        }

        @Override
        public boolean hasNext() {
            while (!page.hasNext()) {
                if (exhausted) {
                    return false;
                }
                fetchNextPage();
            }
            return true;
        }

        @Override
        public SearchHit next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.next();
        }

        @Override
        public String cursor() {
            return page.hasNext() ? pageCursor : nextCursor;
        }

        private void fetchNextPage() {
            SearchApiPage response = apiClient.fetchPage(query, mode, nextCursor);
            List<SearchApiPage.Item> items = response.getItems() != null ? response.getItems() : List.of();

            pageCursor = nextCursor;
            nextCursor = response.getNextCursor();
            page = items.stream().map(mapper::toHit).iterator();

            // An empty page or a missing/unchanged cursor means the source has nothing further.
            if (items.isEmpty() || nextCursor == null || nextCursor.isBlank() || nextCursor.equals(pageCursor)) {
                exhausted = true;
            }
        }
    }
}
