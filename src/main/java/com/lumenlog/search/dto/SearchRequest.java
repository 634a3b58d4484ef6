package com.lumenlog.search.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * A search request: SQL text plus the time window it runs over (microseconds, half-open)
 */
public class SearchRequest {
    private String sql;
    private long startTime;
    private long endTime;
    private int size = -1;
    private int from = 0;
    private boolean trackTotalHits = false;
    private boolean useCache = true;
    private List<String> regions = new ArrayList<>();
    private List<String> clusters = new ArrayList<>();
    private String queryFn;

    public SearchRequest() {
    }

    public SearchRequest(String sql, long startTime, long endTime) {
        this.sql = sql;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    // Getters and setters
    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public int getSize() {
        return size;
    }

    public void setSize(int size) {
        this.size = size;
    }

    public int getFrom() {
        return from;
    }

    public void setFrom(int from) {
        this.from = from;
    }

    public boolean isTrackTotalHits() {
        return trackTotalHits;
    }

    public void setTrackTotalHits(boolean trackTotalHits) {
        this.trackTotalHits = trackTotalHits;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public void setUseCache(boolean useCache) {
        this.useCache = useCache;
    }

    public List<String> getRegions() {
        return regions;
    }

    public void setRegions(List<String> regions) {
        this.regions = regions;
    }

    public List<String> getClusters() {
        return clusters;
    }

    public void setClusters(List<String> clusters) {
        this.clusters = clusters;
    }

    public String getQueryFn() {
        return queryFn;
    }

    public void setQueryFn(String queryFn) {
        this.queryFn = queryFn;
    }
}
