package com.lumenlog.search.sql;

import com.lumenlog.search.schema.StreamSchema;
import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.index.IndexCondition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of analyzing one search SQL statement.
 *
 * Immutable once built. Consumed by the result cache (key inputs, ordering) and by the plan
 * stitcher (partition and index hints).
 */
public class ParsedQuery {

    private final String sql;
    private final String originalSql;
    private final String org;
    private final StreamType streamType;
    private final List<String> streamNames;
    private final List<String> matchTerms;
    private final Map<String, List<FieldValue>> equalItems;
    private final Map<String, List<FieldValue>> prefixItems;
    private final Map<String, Set<String>> columns;
    private final Map<String, String> aliases;
    private final Map<String, StreamSchema> schemas;
    private final int limit;
    private final int offset;
    private final TimeRange timeRange;
    private final List<String> groupBy;
    private final List<OrderBy> orderBy;
    private final long histogramInterval;
    private final boolean sortedByTime;
    private final boolean useInvertedIndex;
    private final IndexCondition indexCondition;
    private final boolean trackTotalHits;
    private final boolean aggregate;
    private final boolean distinct;
    private final boolean wildcard;
    private final boolean complex;
    private final String resultTimestampColumn;

    private ParsedQuery(Builder b) {
        this.sql = b.sql;
        this.originalSql = b.originalSql;
        this.org = b.org;
        this.streamType = b.streamType;
        this.streamNames = Collections.unmodifiableList(new ArrayList<>(b.streamNames));
        this.matchTerms = Collections.unmodifiableList(new ArrayList<>(b.matchTerms));
        this.equalItems = freezeItems(b.equalItems);
        this.prefixItems = freezeItems(b.prefixItems);
        Map<String, Set<String>> cols = new LinkedHashMap<>();
        b.columns.forEach((k, v) -> cols.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        this.columns = Collections.unmodifiableMap(cols);
        this.aliases = Collections.unmodifiableMap(new LinkedHashMap<>(b.aliases));
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(b.schemas));
        this.limit = b.limit;
        this.offset = b.offset;
        this.timeRange = b.timeRange;
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(b.groupBy));
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(b.orderBy));
        this.histogramInterval = b.histogramInterval;
        this.sortedByTime = b.sortedByTime;
        this.useInvertedIndex = b.useInvertedIndex;
        this.indexCondition = b.indexCondition;
        this.trackTotalHits = b.trackTotalHits;
        this.aggregate = b.aggregate;
        this.distinct = b.distinct;
        this.wildcard = b.wildcard;
        this.complex = b.complex;
        this.resultTimestampColumn = b.resultTimestampColumn;
    }

    private static Map<String, List<FieldValue>> freezeItems(Map<String, List<FieldValue>> items) {
        Map<String, List<FieldValue>> frozen = new LinkedHashMap<>();
        items.forEach((k, v) -> frozen.put(k, Collections.unmodifiableList(new ArrayList<>(v))));
        return Collections.unmodifiableMap(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Rewritten SQL handed to the execution engine */
    public String getSql() {
        return sql;
    }

    public String getOriginalSql() {
        return originalSql;
    }

    public String getOrg() {
        return org;
    }

    public StreamType getStreamType() {
        return streamType;
    }

    public List<String> getStreamNames() {
        return streamNames;
    }

    public String getPrimaryStream() {
        return streamNames.get(0);
    }

    public List<String> getMatchTerms() {
        return matchTerms;
    }

    public Map<String, List<FieldValue>> getEqualItems() {
        return equalItems;
    }

    public Map<String, List<FieldValue>> getPrefixItems() {
        return prefixItems;
    }

    public Map<String, Set<String>> getColumns() {
        return columns;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    public Map<String, StreamSchema> getSchemas() {
        return schemas;
    }

    public StreamSchema getSchema(String stream) {
        return schemas.get(stream);
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    /** Histogram bucket width in seconds, 0 when the query has no histogram */
    public long getHistogramInterval() {
        return histogramInterval;
    }

    public boolean hasHistogram() {
        return histogramInterval > 0;
    }

    public boolean isSortedByTime() {
        return sortedByTime;
    }

    public boolean isUseInvertedIndex() {
        return useInvertedIndex;
    }

    public Optional<IndexCondition> getIndexCondition() {
        return Optional.ofNullable(indexCondition);
    }

    public boolean isTrackTotalHits() {
        return trackTotalHits;
    }

    public boolean isAggregate() {
        return aggregate;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    public boolean isComplex() {
        return complex;
    }

    /** Output column holding event time in result rows, if any */
    public Optional<String> getResultTimestampColumn() {
        return Optional.ofNullable(resultTimestampColumn);
    }

    @Override
    public String toString() {
        return "ParsedQuery{streams=" + streamNames + ", sql='" + sql + "', orderBy=" + orderBy
            + ", histogram=" + histogramInterval + ", sortedByTime=" + sortedByTime
            + ", useInvertedIndex=" + useInvertedIndex + "}";
    }

    public static class Builder {
        private String sql;
        private String originalSql;
        private String org;
        private StreamType streamType = StreamType.LOGS;
        private List<String> streamNames = new ArrayList<>();
        private List<String> matchTerms = new ArrayList<>();
        private Map<String, List<FieldValue>> equalItems = new LinkedHashMap<>();
        private Map<String, List<FieldValue>> prefixItems = new LinkedHashMap<>();
        private Map<String, Set<String>> columns = new LinkedHashMap<>();
        private Map<String, String> aliases = new LinkedHashMap<>();
        private Map<String, StreamSchema> schemas = new LinkedHashMap<>();
        private int limit;
        private int offset;
        private TimeRange timeRange = new TimeRange(0, 0);
        private List<String> groupBy = new ArrayList<>();
        private List<OrderBy> orderBy = new ArrayList<>();
        private long histogramInterval;
        private boolean sortedByTime;
        private boolean useInvertedIndex;
        private IndexCondition indexCondition;
        private boolean trackTotalHits;
        private boolean aggregate;
        private boolean distinct;
        private boolean wildcard;
        private boolean complex;
        private String resultTimestampColumn;

        public Builder sql(String sql) { this.sql = sql; return this; }
        public Builder originalSql(String originalSql) { this.originalSql = originalSql; return this; }
        public Builder org(String org) { this.org = org; return this; }
        public Builder streamType(StreamType streamType) { this.streamType = streamType; return this; }
        public Builder streamNames(List<String> streamNames) { this.streamNames = streamNames; return this; }
        public Builder matchTerms(List<String> matchTerms) { this.matchTerms = matchTerms; return this; }
        public Builder equalItems(Map<String, List<FieldValue>> equalItems) { this.equalItems = equalItems; return this; }
        public Builder prefixItems(Map<String, List<FieldValue>> prefixItems) { this.prefixItems = prefixItems; return this; }
        public Builder columns(Map<String, Set<String>> columns) { this.columns = columns; return this; }
        public Builder aliases(Map<String, String> aliases) { this.aliases = aliases; return this; }
        public Builder schemas(Map<String, StreamSchema> schemas) { this.schemas = schemas; return this; }
        public Builder limit(int limit) { this.limit = limit; return this; }
        public Builder offset(int offset) { this.offset = offset; return this; }
        public Builder timeRange(TimeRange timeRange) { this.timeRange = timeRange; return this; }
        public Builder groupBy(List<String> groupBy) { this.groupBy = groupBy; return this; }
        public Builder orderBy(List<OrderBy> orderBy) { this.orderBy = orderBy; return this; }
        public Builder histogramInterval(long histogramInterval) { this.histogramInterval = histogramInterval; return this; }
        public Builder sortedByTime(boolean sortedByTime) { this.sortedByTime = sortedByTime; return this; }
        public Builder useInvertedIndex(boolean useInvertedIndex) { this.useInvertedIndex = useInvertedIndex; return this; }
        public Builder indexCondition(IndexCondition indexCondition) { this.indexCondition = indexCondition; return this; }
        public Builder trackTotalHits(boolean trackTotalHits) { this.trackTotalHits = trackTotalHits; return this; }
        public Builder aggregate(boolean aggregate) { this.aggregate = aggregate; return this; }
        public Builder distinct(boolean distinct) { this.distinct = distinct; return this; }
        public Builder wildcard(boolean wildcard) { this.wildcard = wildcard; return this; }
        public Builder complex(boolean complex) { this.complex = complex; return this; }
        public Builder resultTimestampColumn(String column) { this.resultTimestampColumn = column; return this; }

        public ParsedQuery build() {
            return new ParsedQuery(this);
        }
    }
}
