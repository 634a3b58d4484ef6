package com.lumenlog.search.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration for the search engine core
 */
@ConfigurationProperties(prefix = "search-engine")
public class SearchEngineConfig {

    private CommonConfig common = new CommonConfig();
    private IndexConfig index = new IndexConfig();
    private ResultCacheConfig resultCache = new ResultCacheConfig();
    private MetricsCacheConfig metricsCache = new MetricsCacheConfig();
    private LimitConfig limit = new LimitConfig();
    private NodeConfig node = new NodeConfig();

    public enum SearchFormat {
        /** segments carry a native inverted index */
        NATIVE,
        NONE
    }

    public enum NodeRole {
        QUERIER,
        INGESTER,
        ALL;

        public boolean isIngester() {
            return this == INGESTER || this == ALL;
        }
    }

    public CommonConfig getCommon() {
        return common;
    }

    public void setCommon(CommonConfig common) {
        this.common = common;
    }

    public IndexConfig getIndex() {
        return index;
    }

    public void setIndex(IndexConfig index) {
        this.index = index;
    }

    public ResultCacheConfig getResultCache() {
        return resultCache;
    }

    public void setResultCache(ResultCacheConfig resultCache) {
        this.resultCache = resultCache;
    }

    public MetricsCacheConfig getMetricsCache() {
        return metricsCache;
    }

    public void setMetricsCache(MetricsCacheConfig metricsCache) {
        this.metricsCache = metricsCache;
    }

    public LimitConfig getLimit() {
        return limit;
    }

    public void setLimit(LimitConfig limit) {
        this.limit = limit;
    }

    public NodeConfig getNode() {
        return node;
    }

    public void setNode(NodeConfig node) {
        this.node = node;
    }

    /**
     * Reserved column names
     */
    public static class CommonConfig {
        private String columnTimestamp = "_timestamp";
        private String columnAll = "_all";
        private String columnRowId = "_row_id";
        private String columnOriginal = "_original";
        private boolean excludeAll = true;
        private List<String> defaultFtsFields = new ArrayList<>(
            Arrays.asList("log", "message", "msg", "content", "data", "json"));

        public String getColumnTimestamp() {
            return columnTimestamp;
        }

        public void setColumnTimestamp(String columnTimestamp) {
            this.columnTimestamp = columnTimestamp;
        }

        public String getColumnAll() {
            return columnAll;
        }

        public void setColumnAll(String columnAll) {
            this.columnAll = columnAll;
        }

        public String getColumnRowId() {
            return columnRowId;
        }

        public void setColumnRowId(String columnRowId) {
            this.columnRowId = columnRowId;
        }

        public String getColumnOriginal() {
            return columnOriginal;
        }

        public void setColumnOriginal(String columnOriginal) {
            this.columnOriginal = columnOriginal;
        }

        public boolean isExcludeAll() {
            return excludeAll;
        }

        public void setExcludeAll(boolean excludeAll) {
            this.excludeAll = excludeAll;
        }

        public List<String> getDefaultFtsFields() {
            return defaultFtsFields;
        }

        public void setDefaultFtsFields(List<String> defaultFtsFields) {
            this.defaultFtsFields = defaultFtsFields;
        }
    }

    /**
     * Inverted index pushdown
     */
    public static class IndexConfig {
        private SearchFormat searchFormat = SearchFormat.NATIVE;
        private boolean enabled = true;
        private boolean removeFilterWithIndex = true;

        public SearchFormat getSearchFormat() {
            return searchFormat;
        }

        public void setSearchFormat(SearchFormat searchFormat) {
            this.searchFormat = searchFormat;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRemoveFilterWithIndex() {
            return removeFilterWithIndex;
        }

        public void setRemoveFilterWithIndex(boolean removeFilterWithIndex) {
            this.removeFilterWithIndex = removeFilterWithIndex;
        }

        public boolean isNativeIndex() {
            return enabled && searchFormat == SearchFormat.NATIVE;
        }
    }

    /**
     * Search result cache and its bucketed index
     */
    public static class ResultCacheConfig {
        private boolean enabled = true;
        private Duration discardDuration = Duration.ofSeconds(60);
        private int buckets = 100;
        private int maxEntries = 100000;
        private int gcTrigger = 10;
        private int maxEntriesPerKey = 10;
        private int writerThreads = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getDiscardDuration() {
            return discardDuration;
        }

        public void setDiscardDuration(Duration discardDuration) {
            this.discardDuration = discardDuration;
        }

        public int getBuckets() {
            return buckets;
        }

        public void setBuckets(int buckets) {
            this.buckets = buckets;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public int getGcTrigger() {
            return gcTrigger;
        }

        public void setGcTrigger(int gcTrigger) {
            this.gcTrigger = gcTrigger;
        }

        public int getMaxEntriesPerKey() {
            return maxEntriesPerKey;
        }

        public void setMaxEntriesPerKey(int maxEntriesPerKey) {
            this.maxEntriesPerKey = maxEntriesPerKey;
        }

        public int getWriterThreads() {
            return writerThreads;
        }

        public void setWriterThreads(int writerThreads) {
            this.writerThreads = writerThreads;
        }
    }

    public static class MetricsCacheConfig {
        private boolean enabled = true;
        private Duration maxFileRetention = Duration.ofSeconds(600);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getMaxFileRetention() {
            return maxFileRetention;
        }

        public void setMaxFileRetention(Duration maxFileRetention) {
            this.maxFileRetention = maxFileRetention;
        }
    }

    public static class LimitConfig {
        private int queryDefaultLimit = 1000;
        private int deltaThreads = 8;

        public int getQueryDefaultLimit() {
            return queryDefaultLimit;
        }

        public void setQueryDefaultLimit(int queryDefaultLimit) {
            this.queryDefaultLimit = queryDefaultLimit;
        }

        public int getDeltaThreads() {
            return deltaThreads;
        }

        public void setDeltaThreads(int deltaThreads) {
            this.deltaThreads = deltaThreads;
        }
    }

    public static class NodeConfig {
        private NodeRole role = NodeRole.ALL;

        public NodeRole getRole() {
            return role;
        }

        public void setRole(NodeRole role) {
            this.role = role;
        }
    }
}
