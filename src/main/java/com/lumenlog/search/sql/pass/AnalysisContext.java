package com.lumenlog.search.sql.pass;

import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.dto.SearchRequest;
import com.lumenlog.search.schema.SchemaResolver;
import com.lumenlog.search.schema.StreamSchema;
import com.lumenlog.search.schema.StreamSettings;
import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.FieldValue;
import com.lumenlog.search.sql.OrderBy;
import com.lumenlog.search.sql.TimeRange;
import com.lumenlog.search.sql.index.IndexCondition;
import org.apache.calcite.sql.SqlIdentifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state threaded through the rewrite passes of one analysis.
 *
 * Each pass reads what earlier passes recorded and adds its own findings.
 */
public class AnalysisContext {

    private final SearchEngineConfig config;
    private final SchemaResolver schemaResolver;
    private final String org;
    private final StreamType streamType;
    private final SearchRequest request;
    private final TimeRange timeRange;

    // FROM clause
    private final List<String> streamNames = new ArrayList<>();
    private final Map<String, String> tableAliases = new LinkedHashMap<>();
    private final Map<String, StreamSchema> schemas = new LinkedHashMap<>();
    private final Map<String, StreamSettings> settings = new LinkedHashMap<>();
    private boolean join;
    private boolean subquery;

    // projection and clauses
    private final Map<String, Set<String>> columns = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final List<String> groupBy = new ArrayList<>();
    private List<OrderBy> orderBy = new ArrayList<>();
    private boolean wildcard;
    private boolean distinct;
    private boolean aggregate;
    private boolean window;
    private boolean totalHitsRewritten;

    // derived hints
    private final List<String> matchTerms = new ArrayList<>();
    private final Map<String, StreamSchema> effectiveSchemas = new LinkedHashMap<>();
    private final Map<String, List<FieldValue>> equalItems = new LinkedHashMap<>();
    private final Map<String, List<FieldValue>> prefixItems = new LinkedHashMap<>();
    private long histogramInterval;
    private boolean sortedByTime;
    private boolean complex;
    private IndexCondition indexCondition;
    private boolean useInvertedIndex;
    private String resultTimestampColumn;

    public AnalysisContext(SearchEngineConfig config, SchemaResolver schemaResolver,
                           String org, StreamType streamType, SearchRequest request) {
        this.config = config;
        this.schemaResolver = schemaResolver;
        this.org = org;
        this.streamType = streamType;
        this.request = request;
        this.timeRange = new TimeRange(request.getStartTime(), request.getEndTime());
    }

    public SearchEngineConfig getConfig() {
        return config;
    }

    public SchemaResolver getSchemaResolver() {
        return schemaResolver;
    }

    public String getOrg() {
        return org;
    }

    public StreamType getStreamType() {
        return streamType;
    }

    public SearchRequest getRequest() {
        return request;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public String timestampColumn() {
        return config.getCommon().getColumnTimestamp();
    }

    public String rowIdColumn() {
        return config.getCommon().getColumnRowId();
    }

    public boolean isSingleStream() {
        return streamNames.size() == 1;
    }

    /**
     * Stream owning the column an identifier names.
     *
     * {@code t.f} resolves through the FROM-clause name or alias {@code t}; a bare {@code f}
     * resolves only when exactly one stream's schema has it.
     */
    public Optional<String> resolveOwner(SqlIdentifier id) {
        if (id.isStar()) {
            return Optional.empty();
        }
        String field = fieldName(id);
        if (id.names.size() > 1) {
            String qualifier = id.names.get(id.names.size() - 2);
            String stream = tableAliases.get(qualifier);
            if (stream == null && streamNames.contains(qualifier)) {
                stream = qualifier;
            }
            if (stream == null || !schemas.get(stream).hasField(field)) {
                return Optional.empty();
            }
            return Optional.of(stream);
        }
        String owner = null;
        for (String stream : streamNames) {
            if (schemas.get(stream).hasField(field)) {
                if (owner != null) {
                    return Optional.empty();
                }
                owner = stream;
            }
        }
        return Optional.ofNullable(owner);
    }

    public static String fieldName(SqlIdentifier id) {
        return id.names.get(id.names.size() - 1);
    }

    public void addStream(String stream, StreamSchema schema, StreamSettings streamSettings) {
        if (!streamNames.contains(stream)) {
            streamNames.add(stream);
            schemas.put(stream, schema);
            settings.put(stream, streamSettings);
        }
    }

    public void addColumn(String stream, String column) {
        columns.computeIfAbsent(stream, k -> new LinkedHashSet<>()).add(column);
    }

    public boolean isColumnReferenced(String column) {
        for (Set<String> cols : columns.values()) {
            if (cols.contains(column)) {
                return true;
            }
        }
        return false;
    }

    public void addEqualItem(String stream, FieldValue item) {
        List<FieldValue> items = equalItems.computeIfAbsent(stream, k -> new ArrayList<>());
        if (!items.contains(item)) {
            items.add(item);
        }
    }

    public void addPrefixItem(String stream, FieldValue item) {
        List<FieldValue> items = prefixItems.computeIfAbsent(stream, k -> new ArrayList<>());
        if (!items.contains(item)) {
            items.add(item);
        }
    }

    /**
     * Full-text fields of a stream: its own setting, or the configured defaults
     */
    public Set<String> ftsFields(String stream) {
        StreamSettings s = settings.get(stream);
        if (s != null && !s.getFtsFields().isEmpty()) {
            return s.getFtsFields();
        }
        return new LinkedHashSet<>(config.getCommon().getDefaultFtsFields());
    }

    public List<String> getStreamNames() {
        return streamNames;
    }

    public Map<String, String> getTableAliases() {
        return tableAliases;
    }

    public Map<String, StreamSchema> getSchemas() {
        return schemas;
    }

    public Map<String, StreamSettings> getSettings() {
        return settings;
    }

    public boolean isJoin() {
        return join;
    }

    public void setJoin(boolean join) {
        this.join = join;
    }

    public boolean isSubquery() {
        return subquery;
    }

    public void setSubquery(boolean subquery) {
        this.subquery = subquery;
    }

    public Map<String, Set<String>> getColumns() {
        return columns;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    public void setOrderBy(List<OrderBy> orderBy) {
        this.orderBy = orderBy;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    public void setWildcard(boolean wildcard) {
        this.wildcard = wildcard;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public void setDistinct(boolean distinct) {
        this.distinct = distinct;
    }

    public boolean isAggregate() {
        return aggregate;
    }

    public void setAggregate(boolean aggregate) {
        this.aggregate = aggregate;
    }

    public boolean isWindow() {
        return window;
    }

    public void setWindow(boolean window) {
        this.window = window;
    }

    public boolean isTotalHitsRewritten() {
        return totalHitsRewritten;
    }

    public void setTotalHitsRewritten(boolean totalHitsRewritten) {
        this.totalHitsRewritten = totalHitsRewritten;
    }

    public List<String> getMatchTerms() {
        return matchTerms;
    }

    public Map<String, StreamSchema> getEffectiveSchemas() {
        return effectiveSchemas;
    }

    public Map<String, List<FieldValue>> getEqualItems() {
        return equalItems;
    }

    public Map<String, List<FieldValue>> getPrefixItems() {
        return prefixItems;
    }

    public long getHistogramInterval() {
        return histogramInterval;
    }

    public void setHistogramInterval(long histogramInterval) {
        this.histogramInterval = histogramInterval;
    }

    public boolean isSortedByTime() {
        return sortedByTime;
    }

    public void setSortedByTime(boolean sortedByTime) {
        this.sortedByTime = sortedByTime;
    }

    public boolean isComplex() {
        return complex;
    }

    public void setComplex(boolean complex) {
        this.complex = complex;
    }

    public IndexCondition getIndexCondition() {
        return indexCondition;
    }

    public void setIndexCondition(IndexCondition indexCondition) {
        this.indexCondition = indexCondition;
    }

    public boolean isUseInvertedIndex() {
        return useInvertedIndex;
    }

    public void setUseInvertedIndex(boolean useInvertedIndex) {
        this.useInvertedIndex = useInvertedIndex;
    }

    public String getResultTimestampColumn() {
        return resultTimestampColumn;
    }

    public void setResultTimestampColumn(String resultTimestampColumn) {
        this.resultTimestampColumn = resultTimestampColumn;
    }
}
