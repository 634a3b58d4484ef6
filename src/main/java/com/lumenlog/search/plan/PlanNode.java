package com.lumenlog.search.plan;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Node of a physical plan tree.
 *
 * The core only interprets placeholder and union scans; every other operator is carried
 * through untouched as an {@link OperatorNode}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "node")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OperatorNode.class, name = "operator"),
    @JsonSubTypes.Type(value = PlaceholderScanNode.class, name = "placeholder_scan"),
    @JsonSubTypes.Type(value = UnionScanNode.class, name = "union_scan")
})
public abstract class PlanNode {

    public abstract List<PlanNode> children();

    public abstract PlanNode withChildren(List<PlanNode> children);

    public abstract <R> R accept(PlanVisitor<R> visitor);
}
