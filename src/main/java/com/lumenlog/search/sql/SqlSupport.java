package com.lumenlog.search.sql;

import com.google.common.collect.ImmutableSet;
import com.lumenlog.search.exception.InvalidQueryException;
import org.apache.calcite.avatica.util.Casing;
import org.apache.calcite.avatica.util.Quoting;
import org.apache.calcite.sql.SqlBasicCall;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlCharStringLiteral;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.dialect.PostgresqlSqlDialect;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.parser.SqlParserPos;
import org.apache.calcite.sql.validate.SqlConformanceEnum;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Calcite parsing and AST helpers shared by the rewrite passes
 */
public final class SqlSupport {

    private static final SqlParser.Config PARSER_CONFIG = SqlParser.config()
        .withQuoting(Quoting.DOUBLE_QUOTE)
        .withQuotedCasing(Casing.UNCHANGED)
        .withUnquotedCasing(Casing.UNCHANGED)
        .withCaseSensitive(false)
        .withConformance(SqlConformanceEnum.LENIENT);

    public static final Set<String> MATCH_FUNCTIONS =
        ImmutableSet.of("match_all", "match_all_raw", "match_all_raw_ignore_case");

    private SqlSupport() {
    }

    /**
     * Parse a single SELECT statement. A top-level ORDER BY / LIMIT / OFFSET wrapper is folded
     * into the select so every pass sees one node.
     */
    public static SqlSelect parseSelect(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            throw new InvalidQueryException("SQL is empty");
        }
        String text = sql.trim();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        SqlNode node;
        try {
            node = SqlParser.create(text, PARSER_CONFIG).parseQuery();
        } catch (SqlParseException e) {
            throw new InvalidQueryException("Invalid SQL: " + e.getMessage(), e);
        }
        if (node instanceof SqlOrderBy) {
            SqlOrderBy orderBy = (SqlOrderBy) node;
            if (!(orderBy.query instanceof SqlSelect)) {
                throw new InvalidQueryException("Only single SELECT statements are supported");
            }
            SqlSelect select = (SqlSelect) orderBy.query;
            if (orderBy.orderList != null && orderBy.orderList.size() > 0) {
                select.setOrderBy(orderBy.orderList);
            }
            if (orderBy.offset != null) {
                select.setOffset(orderBy.offset);
            }
            if (orderBy.fetch != null) {
                select.setFetch(orderBy.fetch);
            }
            return select;
        }
        if (!(node instanceof SqlSelect)) {
            throw new InvalidQueryException("Only single SELECT statements are supported, got " + node.getKind());
        }
        return (SqlSelect) node;
    }

    public static String unparse(SqlNode node) {
        return node.toSqlString(PostgresqlSqlDialect.DEFAULT).getSql();
    }

    /**
     * Split a predicate into its top-level AND conjuncts
     */
    public static List<SqlNode> splitAnd(SqlNode predicate) {
        List<SqlNode> conjuncts = new ArrayList<>();
        collectAnd(predicate, conjuncts);
        return conjuncts;
    }

    private static void collectAnd(SqlNode node, List<SqlNode> out) {
        if (node == null) {
            return;
        }
        if (node.getKind() == SqlKind.AND) {
            for (SqlNode operand : ((SqlCall) node).getOperandList()) {
                collectAnd(operand, out);
            }
        } else {
            out.add(node);
        }
    }

    /**
     * Rebuild a predicate from conjuncts; null when nothing is left
     */
    public static SqlNode joinAnd(List<SqlNode> conjuncts) {
        SqlNode result = null;
        for (SqlNode conjunct : conjuncts) {
            result = result == null
                ? conjunct
                : SqlStdOperatorTable.AND.createCall(SqlParserPos.ZERO, result, conjunct);
        }
        return result;
    }

    /**
     * Literal value as text, or null when the node is not a plain literal
     */
    public static String literalValue(SqlNode node) {
        if (node instanceof SqlCharStringLiteral) {
            return ((SqlLiteral) node).getValueAs(String.class);
        }
        if (node instanceof SqlNumericLiteral) {
            return ((SqlLiteral) node).toValue();
        }
        if (node != null && node.getKind() == SqlKind.MINUS_PREFIX) {
            SqlNode operand = ((SqlCall) node).operand(0);
            if (operand instanceof SqlNumericLiteral) {
                return "-" + ((SqlLiteral) operand).toValue();
            }
        }
        return null;
    }

    public static boolean isStringLiteral(SqlNode node) {
        return node instanceof SqlCharStringLiteral;
    }

    public static boolean isIntegerLiteral(SqlNode node) {
        return node instanceof SqlNumericLiteral && ((SqlNumericLiteral) node).isInteger();
    }

    /**
     * Lower-cased function name of a call, or null for operators without one
     */
    public static String functionName(SqlCall call) {
        if (call.getOperator() == null || call.getOperator().getName() == null) {
            return null;
        }
        return call.getOperator().getName().toLowerCase(Locale.ROOT);
    }

    public static boolean isFunction(SqlNode node, String name) {
        return node instanceof SqlBasicCall && name.equals(functionName((SqlCall) node));
    }

    public static SqlNode stripAlias(SqlNode item) {
        if (item != null && item.getKind() == SqlKind.AS) {
            return ((SqlCall) item).operand(0);
        }
        return item;
    }

    /**
     * Name a projection item is exposed under: its alias, or the column name for a bare
     * identifier; null for unnamed expressions
     */
    public static String outputName(SqlNode item) {
        if (item.getKind() == SqlKind.AS) {
            SqlNode alias = ((SqlCall) item).operand(1);
            return alias instanceof SqlIdentifier ? ((SqlIdentifier) alias).getSimple() : alias.toString();
        }
        if (item instanceof SqlIdentifier && !((SqlIdentifier) item).isStar()) {
            SqlIdentifier id = (SqlIdentifier) item;
            return id.names.get(id.names.size() - 1);
        }
        return null;
    }

    /**
     * Term of a one-argument match call, or null for any other call
     */
    public static String matchTerm(SqlCall call) {
        if (!MATCH_FUNCTIONS.contains(String.valueOf(functionName(call)))
                || call.operandCount() != 1
                || !isStringLiteral(call.operand(0))) {
            return null;
        }
        return literalValue(call.operand(0));
    }

    /**
     * Literal prefix of a non-negated {@code LIKE 'abc%'} without ESCAPE, or null.
     * Patterns with a leading or inner wildcard do not qualify.
     */
    public static String likePrefix(SqlCall call) {
        if (call.getKind() != SqlKind.LIKE
                || !"LIKE".equalsIgnoreCase(call.getOperator().getName())
                || call.operandCount() != 2
                || !isStringLiteral(call.operand(1))) {
            return null;
        }
        String pattern = literalValue(call.operand(1));
        if (pattern == null || pattern.length() < 2 || !pattern.endsWith("%")) {
            return null;
        }
        String prefix = pattern.substring(0, pattern.length() - 1);
        while (prefix.endsWith("%")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        if (prefix.isEmpty() || prefix.indexOf('%') >= 0 || prefix.indexOf('_') >= 0) {
            return null;
        }
        return prefix;
    }
}
