package com.lumenlog.search.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lumenlog.search.schema.StreamSchema;
import com.lumenlog.search.schema.StreamType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Marker standing in for "scan stream X" until the stitcher binds concrete tier sources
 */
public class PlaceholderScanNode extends PlanNode {

    private final String org;
    private final StreamType streamType;
    private final String streamName;
    private final StreamSchema schema;
    private final List<String> projection;
    private final List<String> filters;
    private final Integer limit;
    private final boolean sortedByTime;

    @JsonCreator
    public PlaceholderScanNode(@JsonProperty("org") String org,
                               @JsonProperty("streamType") StreamType streamType,
                               @JsonProperty("streamName") String streamName,
                               @JsonProperty("schema") StreamSchema schema,
                               @JsonProperty("projection") List<String> projection,
                               @JsonProperty("filters") List<String> filters,
                               @JsonProperty("limit") Integer limit,
                               @JsonProperty("sortedByTime") boolean sortedByTime) {
        this.org = org;
        this.streamType = streamType;
        this.streamName = streamName;
        this.schema = schema;
        this.projection = projection == null ? new ArrayList<>() : new ArrayList<>(projection);
        this.filters = filters == null ? new ArrayList<>() : new ArrayList<>(filters);
        this.limit = limit;
        this.sortedByTime = sortedByTime;
    }

    public String getOrg() {
        return org;
    }

    public StreamType getStreamType() {
        return streamType;
    }

    public String getStreamName() {
        return streamName;
    }

    public StreamSchema getSchema() {
        return schema;
    }

    public List<String> getProjection() {
        return Collections.unmodifiableList(projection);
    }

    public List<String> getFilters() {
        return Collections.unmodifiableList(filters);
    }

    public Integer getLimit() {
        return limit;
    }

    public boolean isSortedByTime() {
        return sortedByTime;
    }

    @Override
    public List<PlanNode> children() {
        return Collections.emptyList();
    }

    @Override
    public PlanNode withChildren(List<PlanNode> children) {
        return this;
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitPlaceholder(this);
    }

    @Override
    public String toString() {
        return "placeholder_scan(" + org + "/" + streamType + "/" + streamName + ")";
    }
}
