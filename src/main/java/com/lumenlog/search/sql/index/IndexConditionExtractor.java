package com.lumenlog.search.sql.index;

import com.lumenlog.search.sql.SqlSupport;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts SQL predicates into index condition trees.
 *
 * Secondary index fields store whole values, so equality, IN and prefix predicates on them
 * convert exactly. Full-text fields are tokenized: equality and prefix predicates on them
 * only over-approximate and are usable as pre-filters, while match calls convert exactly.
 */
public class IndexConditionExtractor {

    private final Set<String> indexFields;
    private final Set<String> ftsFields;

    public IndexConditionExtractor(Set<String> indexFields, Set<String> ftsFields) {
        this.indexFields = indexFields;
        this.ftsFields = ftsFields;
    }

    /**
     * Index tree equivalent to the predicate, or null when any part is not index-evaluable
     */
    public IndexNode exact(SqlNode node) {
        SqlKind kind = node.getKind();
        if (kind == SqlKind.AND || kind == SqlKind.OR) {
            List<IndexNode> children = new ArrayList<>();
            for (SqlNode operand : ((SqlCall) node).getOperandList()) {
                IndexNode child = exact(operand);
                if (child == null) {
                    return null;
                }
                children.add(child);
            }
            return kind == SqlKind.AND ? IndexNode.and(children) : IndexNode.or(children);
        }
        return leaf(node, indexFields, true);
    }

    /**
     * Index tree implied by the predicate: every matching row also matches the tree.
     * AND keeps whichever children relax; OR relaxes only when every arm does.
     */
    public IndexNode relax(SqlNode node) {
        SqlKind kind = node.getKind();
        if (kind == SqlKind.AND) {
            List<IndexNode> children = new ArrayList<>();
            for (SqlNode operand : ((SqlCall) node).getOperandList()) {
                IndexNode child = relax(operand);
                if (child != null) {
                    children.add(child);
                }
            }
            return children.isEmpty() ? null : IndexNode.and(children);
        }
        if (kind == SqlKind.OR) {
            List<IndexNode> children = new ArrayList<>();
            for (SqlNode operand : ((SqlCall) node).getOperandList()) {
                IndexNode child = relax(operand);
                if (child == null) {
                    return null;
                }
                children.add(child);
            }
            return IndexNode.or(children);
        }
        IndexNode exact = leaf(node, indexFields, true);
        return exact != null ? exact : leaf(node, ftsFields, false);
    }

    private static IndexNode leaf(SqlNode node, Set<String> fields, boolean allowMatch) {
        if (!(node instanceof SqlCall)) {
            return null;
        }
        SqlCall call = (SqlCall) node;
        if (allowMatch) {
            String term = SqlSupport.matchTerm(call);
            if (term != null) {
                return IndexNode.matchAll(term);
            }
        }
        switch (call.getKind()) {
            case EQUALS: {
                SqlNode left = call.operand(0);
                SqlNode right = call.operand(1);
                if (SqlSupport.literalValue(left) != null) {
                    SqlNode tmp = left;
                    left = right;
                    right = tmp;
                }
                String field = field(left, fields);
                String value = SqlSupport.literalValue(right);
                return field != null && value != null ? IndexNode.term(field, value) : null;
            }
            case IN: {
                String field = field(call.operand(0), fields);
                SqlNode list = call.operand(1);
                if (field == null || !(list instanceof SqlNodeList) || ((SqlNodeList) list).size() == 0) {
                    return null;
                }
                List<String> values = new ArrayList<>();
                for (SqlNode item : (SqlNodeList) list) {
                    String value = SqlSupport.literalValue(item);
                    if (value == null) {
                        return null;
                    }
                    values.add(value);
                }
                return IndexNode.in(field, values);
            }
            case LIKE: {
                String prefix = SqlSupport.likePrefix(call);
                String field = field(call.operand(0), fields);
                return prefix != null && field != null ? IndexNode.prefix(field, prefix) : null;
            }
            default:
                return null;
        }
    }

    private static String field(SqlNode node, Set<String> fields) {
        if (!(node instanceof SqlIdentifier) || ((SqlIdentifier) node).isStar()) {
            return null;
        }
        SqlIdentifier id = (SqlIdentifier) node;
        String name = id.names.get(id.names.size() - 1);
        return fields.contains(name) ? name : null;
    }
}
