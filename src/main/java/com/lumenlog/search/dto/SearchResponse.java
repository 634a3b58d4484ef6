package com.lumenlog.search.dto;

import com.lumenlog.search.sql.OrderBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class SearchResponse {
    private List<Map<String, Object>> hits = new ArrayList<>();
    private long total;
    private long scanSize;
    private long scanRecords;
    private long took;
    private TookDetail tookDetail = new TookDetail();
    private double cachedRatio;
    private double resultCacheRatio;
    private boolean isPartial;
    private String functionError = "";
    private List<OrderBy> orderBy = new ArrayList<>();
    private long histogramInterval;

    public SearchResponse() {
    }

    public SearchResponse(List<Map<String, Object>> hits) {
        this.hits = hits != null ? new ArrayList<>(hits) : new ArrayList<>();
        this.total = this.hits.size();
    }

    public boolean hasHits() {
        return hits != null && !hits.isEmpty();
    }

    /**
     * Append a message to the function error annotation
     */
    public void addFunctionError(String message) {
        if (functionError == null || functionError.isEmpty()) {
            functionError = message;
        } else if (!functionError.contains(message)) {
            functionError = functionError + " \n " + message;
        }
    }

    // Getters and setters
    public List<Map<String, Object>> getHits() {
        return hits;
    }

    public void setHits(List<Map<String, Object>> hits) {
        this.hits = hits;
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    public long getScanSize() {
        return scanSize;
    }

    public void setScanSize(long scanSize) {
        this.scanSize = scanSize;
    }

    public long getScanRecords() {
        return scanRecords;
    }

    public void setScanRecords(long scanRecords) {
        this.scanRecords = scanRecords;
    }

    public long getTook() {
        return took;
    }

    public void setTook(long took) {
        this.took = took;
    }

    public TookDetail getTookDetail() {
        return tookDetail;
    }

    public void setTookDetail(TookDetail tookDetail) {
        this.tookDetail = tookDetail;
    }

    public double getCachedRatio() {
        return cachedRatio;
    }

    public void setCachedRatio(double cachedRatio) {
        this.cachedRatio = cachedRatio;
    }

    public double getResultCacheRatio() {
        return resultCacheRatio;
    }

    public void setResultCacheRatio(double resultCacheRatio) {
        this.resultCacheRatio = resultCacheRatio;
    }

    public boolean isPartial() {
        return isPartial;
    }

    public void setPartial(boolean partial) {
        isPartial = partial;
    }

    public String getFunctionError() {
        return functionError;
    }

    public void setFunctionError(String functionError) {
        this.functionError = functionError;
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    public void setOrderBy(List<OrderBy> orderBy) {
        this.orderBy = orderBy;
    }

    public long getHistogramInterval() {
        return histogramInterval;
    }

    public void setHistogramInterval(long histogramInterval) {
        this.histogramInterval = histogramInterval;
    }
}
