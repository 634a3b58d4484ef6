package com.lumenlog.search.sql.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Node of an index condition tree.
 *
 * Leaves are evaluated by the inverted index; AND/OR nodes combine them. Each node renders
 * itself in term-query syntax.
 */
public abstract class IndexNode {

    public abstract String toQueryString();

    /**
     * Fields the node reads; match-all terms read none
     */
    public abstract Set<String> fields();

    @Override
    public String toString() {
        return toQueryString();
    }

    public static IndexNode term(String field, String value) {
        return new Term(field, value);
    }

    public static IndexNode in(String field, List<String> values) {
        if (values.size() == 1) {
            return new Term(field, values.get(0));
        }
        List<IndexNode> terms = new ArrayList<>();
        for (String value : values) {
            terms.add(new Term(field, value));
        }
        return new Or(terms);
    }

    public static IndexNode prefix(String field, String prefix) {
        return new Prefix(field, prefix);
    }

    public static IndexNode matchAll(String term) {
        return new MatchAll(term);
    }

    public static IndexNode and(List<IndexNode> children) {
        return children.size() == 1 ? children.get(0) : new And(children);
    }

    public static IndexNode or(List<IndexNode> children) {
        return children.size() == 1 ? children.get(0) : new Or(children);
    }

    public static final class Term extends IndexNode {
        private final String field;
        private final String value;

        Term(String field, String value) {
            this.field = field;
            this.value = value;
        }

        public String getField() {
            return field;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toQueryString() {
            return field + ":" + value;
        }

        @Override
        public Set<String> fields() {
            return Collections.singleton(field);
        }
    }

    public static final class Prefix extends IndexNode {
        private final String field;
        private final String prefix;

        Prefix(String field, String prefix) {
            this.field = field;
            this.prefix = prefix;
        }

        public String getField() {
            return field;
        }

        public String getPrefix() {
            return prefix;
        }

        @Override
        public String toQueryString() {
            return field + ":" + prefix + "*";
        }

        @Override
        public Set<String> fields() {
            return Collections.singleton(field);
        }
    }

    /**
     * Full-text term searched across all full-text fields
     */
    public static final class MatchAll extends IndexNode {
        private final String term;

        MatchAll(String term) {
            this.term = term;
        }

        public String getTerm() {
            return term;
        }

        @Override
        public String toQueryString() {
            return term + "*";
        }

        @Override
        public Set<String> fields() {
            return Collections.emptySet();
        }
    }

    abstract static class Compound extends IndexNode {
        private final List<IndexNode> children;
        private final String operator;

        Compound(List<IndexNode> children, String operator) {
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
            this.operator = operator;
        }

        public List<IndexNode> getChildren() {
            return children;
        }

        @Override
        public String toQueryString() {
            return children.stream()
                .map(IndexNode::toQueryString)
                .collect(Collectors.joining(" " + operator + " ", "(", ")"));
        }

        @Override
        public Set<String> fields() {
            Set<String> fields = new LinkedHashSet<>();
            for (IndexNode child : children) {
                fields.addAll(child.fields());
            }
            return fields;
        }
    }

    public static final class And extends Compound {
        And(List<IndexNode> children) {
            super(children, "AND");
        }
    }

    public static final class Or extends Compound {
        Or(List<IndexNode> children) {
            super(children, "OR");
        }
    }
}
