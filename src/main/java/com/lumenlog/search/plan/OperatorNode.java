package com.lumenlog.search.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Any execution operator (filter, sort, aggregate, projection...), opaque to the core
 */
public class OperatorNode extends PlanNode {

    private final String name;
    private final Map<String, Object> properties;
    private final List<PlanNode> children;

    @JsonCreator
    public OperatorNode(@JsonProperty("name") String name,
                        @JsonProperty("properties") Map<String, Object> properties,
                        @JsonProperty("children") List<PlanNode> children) {
        this.name = name;
        this.properties = properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties);
        this.children = children == null ? new ArrayList<>() : new ArrayList<>(children);
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public List<PlanNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public List<PlanNode> children() {
        return getChildren();
    }

    @Override
    public PlanNode withChildren(List<PlanNode> newChildren) {
        return new OperatorNode(name, properties, newChildren);
    }

    @Override
    public <R> R accept(PlanVisitor<R> visitor) {
        return visitor.visitOperator(this);
    }

    @Override
    public String toString() {
        return name + children;
    }
}
