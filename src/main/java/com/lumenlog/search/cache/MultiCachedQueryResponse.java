package com.lumenlog.search.cache;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a cache check: what the cache already holds for a query and which ranges
 * still have to be searched
 */
public class MultiCachedQueryResponse {
    private String tsColumn;
    private boolean isDescending;
    private boolean hasCachedData;
    private List<CachedQueryResponse> cachedResponses = new ArrayList<>();
    private List<QueryDelta> deltas = new ArrayList<>();
    private int limit;
    private long histogramInterval;
    private boolean cacheQueryResponse;
    private boolean isAggregate;
    private String cachePath;
    private String queryText;

    /**
     * Deltas that must be searched, excluding removed-hits ranges
     */
    public List<QueryDelta> searchDeltas() {
        List<QueryDelta> result = new ArrayList<>();
        for (QueryDelta delta : deltas) {
            if (!delta.isRemovedHits()) {
                result.add(delta);
            }
        }
        return result;
    }

    // Getters and setters
    public String getTsColumn() {
        return tsColumn;
    }

    public void setTsColumn(String tsColumn) {
        this.tsColumn = tsColumn;
    }

    public boolean isDescending() {
        return isDescending;
    }

    public void setDescending(boolean descending) {
        isDescending = descending;
    }

    public boolean hasCachedData() {
        return hasCachedData;
    }

    public void setHasCachedData(boolean hasCachedData) {
        this.hasCachedData = hasCachedData;
    }

    public List<CachedQueryResponse> getCachedResponses() {
        return cachedResponses;
    }

    public void setCachedResponses(List<CachedQueryResponse> cachedResponses) {
        this.cachedResponses = cachedResponses;
    }

    public List<QueryDelta> getDeltas() {
        return deltas;
    }

    public void setDeltas(List<QueryDelta> deltas) {
        this.deltas = deltas;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public long getHistogramInterval() {
        return histogramInterval;
    }

    public void setHistogramInterval(long histogramInterval) {
        this.histogramInterval = histogramInterval;
    }

    public boolean isCacheQueryResponse() {
        return cacheQueryResponse;
    }

    public void setCacheQueryResponse(boolean cacheQueryResponse) {
        this.cacheQueryResponse = cacheQueryResponse;
    }

    public boolean isAggregate() {
        return isAggregate;
    }

    public void setAggregate(boolean aggregate) {
        isAggregate = aggregate;
    }

    public String getCachePath() {
        return cachePath;
    }

    public void setCachePath(String cachePath) {
        this.cachePath = cachePath;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }
}
