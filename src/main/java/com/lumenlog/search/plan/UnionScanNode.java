package com.lumenlog.search.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lumenlog.search.plan.tier.TierTable;
import com.lumenlog.search.schema.StreamSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scan over the union of all storage tiers of one stream partition
 */
public class UnionScanNode extends PlanNode {

    private final StreamSchema schema;
    private final List<String> projection;
    private final List<String> filters;
    private final Integer limit;
    private final List<TierTable> sources;

    @JsonCreator
    public UnionScanNode(@JsonProperty("schema") StreamSchema schema,
                         @JsonProperty("projection") List<String> projection,
                         @JsonProperty("filters") List<String> filters,
                         @JsonProperty("limit") Integer limit,
                         @JsonProperty("sources") List<TierTable> sources) {
        this.schema = schema;
        this.projection = projection == null ? new ArrayList<>() : new ArrayList<>(projection);
        this.filters = filters == null ? new ArrayList<>() : new ArrayList<>(filters);
        this.limit = limit;
        this.sources = sources == null ? new ArrayList<>() : new ArrayList<>(sources);
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

    public List<TierTable> getSources() {
        return Collections.unmodifiableList(sources);
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
        return visitor.visitUnion(this);
    }

    @Override
    public String toString() {
        return "union_scan" + sources;
    }
}
