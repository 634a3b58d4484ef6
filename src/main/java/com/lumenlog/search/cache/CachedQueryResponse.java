package com.lumenlog.search.cache;

import com.lumenlog.search.dto.SearchResponse;

/**
 * A response loaded from the result cache together with the window it covers
 */
public class CachedQueryResponse {

    private final ResultCacheIndexEntry entry;
    private final SearchResponse response;

    public CachedQueryResponse(ResultCacheIndexEntry entry, SearchResponse response) {
        this.entry = entry;
        this.response = response;
    }

    public ResultCacheIndexEntry getEntry() {
        return entry;
    }

    public SearchResponse getResponse() {
        return response;
    }

    public long getStart() {
        return entry.getStart();
    }

    public long getEnd() {
        return entry.getEnd();
    }
}
