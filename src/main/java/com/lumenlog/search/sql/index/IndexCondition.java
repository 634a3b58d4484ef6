package com.lumenlog.search.sql.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Conjunction of index-evaluable predicates pushed down to the inverted index.
 *
 * Conjuncts flagged as pre-filters only narrow the candidate rows: the original SQL
 * predicate is still applied afterwards.
 */
public class IndexCondition {

    private final List<IndexNode> conjuncts = new ArrayList<>();
    private final List<IndexNode> preFilters = new ArrayList<>();

    /**
     * Add a predicate the index evaluates exactly
     */
    public void addExact(IndexNode node) {
        conjuncts.add(node);
    }

    /**
     * Add a relaxed predicate that over-approximates a conjunct kept in SQL
     */
    public void addPreFilter(IndexNode node) {
        conjuncts.add(node);
        preFilters.add(node);
    }

    public List<IndexNode> getConjuncts() {
        return Collections.unmodifiableList(conjuncts);
    }

    public boolean isPreFilter(IndexNode node) {
        return preFilters.contains(node);
    }

    public boolean hasPreFilters() {
        return !preFilters.isEmpty();
    }

    public boolean isEmpty() {
        return conjuncts.isEmpty();
    }

    public Set<String> fields() {
        Set<String> fields = new LinkedHashSet<>();
        for (IndexNode node : conjuncts) {
            fields.addAll(node.fields());
        }
        return fields;
    }

    public String toQueryString() {
        return conjuncts.stream().map(IndexNode::toQueryString).collect(Collectors.joining(" AND "));
    }

    @Override
    public String toString() {
        return toQueryString();
    }
}
