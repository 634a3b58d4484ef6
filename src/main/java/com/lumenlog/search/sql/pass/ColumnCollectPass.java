package com.lumenlog.search.sql.pass;

import com.lumenlog.search.sql.AggregateFunctions;
import com.lumenlog.search.sql.OrderBy;
import com.lumenlog.search.sql.OrderDirection;
import com.lumenlog.search.sql.SqlSupport;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlJoin;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.util.SqlBasicVisitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Records referenced columns per stream, projection aliases, GROUP BY and ORDER BY items,
 * and the wildcard / DISTINCT / aggregate / window flags.
 */
public class ColumnCollectPass implements RewritePass {

    @Override
    public String name() {
        return "column-collect";
    }

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        ColumnCollector collector = new ColumnCollector(context, false);
        ColumnCollector aliasAware = new ColumnCollector(context, true);

        for (SqlNode item : select.getSelectList()) {
            if (item instanceof SqlIdentifier && ((SqlIdentifier) item).isStar()) {
                context.setWildcard(true);
            } else if (item.getKind() == SqlKind.AS) {
                ((SqlCall) item).operand(0).accept(collector);
            } else {
                item.accept(collector);
            }
        }
        // aliases are visible from GROUP BY, HAVING and ORDER BY only
        for (SqlNode item : select.getSelectList()) {
            if (item.getKind() == SqlKind.AS) {
                SqlNode expr = ((SqlCall) item).operand(0);
                context.getAliases().put(SqlSupport.outputName(item), SqlSupport.unparse(expr));
            }
        }
        context.setDistinct(select.isDistinct());

        if (select.getWhere() != null) {
            select.getWhere().accept(collector);
        }
        if (select.getGroup() != null) {
            for (SqlNode group : select.getGroup()) {
                context.getGroupBy().add(group instanceof SqlIdentifier
                    ? AnalysisContext.fieldName((SqlIdentifier) group)
                    : SqlSupport.unparse(group));
                group.accept(aliasAware);
            }
        }
        if (select.getHaving() != null) {
            select.getHaving().accept(aliasAware);
        }
        if (select.getOrderList() != null) {
            List<OrderBy> orderBy = new ArrayList<>();
            for (SqlNode item : select.getOrderList()) {
                orderBy.add(toOrderBy(item));
                item.accept(aliasAware);
            }
            context.setOrderBy(orderBy);
        }
        collectJoinConditions(select.getFrom(), collector);
        return select;
    }

    private static OrderBy toOrderBy(SqlNode item) {
        SqlNode expr = item;
        if (expr.getKind() == SqlKind.NULLS_FIRST || expr.getKind() == SqlKind.NULLS_LAST) {
            expr = ((SqlCall) expr).operand(0);
        }
        OrderDirection direction = OrderDirection.ASC;
        if (expr.getKind() == SqlKind.DESCENDING) {
            direction = OrderDirection.DESC;
            expr = ((SqlCall) expr).operand(0);
        }
        String field = expr instanceof SqlIdentifier
            ? AnalysisContext.fieldName((SqlIdentifier) expr)
            : SqlSupport.unparse(expr);
        return new OrderBy(field, direction);
    }

    private static void collectJoinConditions(SqlNode from, ColumnCollector collector) {
        if (from instanceof SqlJoin) {
            SqlJoin join = (SqlJoin) from;
            collectJoinConditions(join.getLeft(), collector);
            collectJoinConditions(join.getRight(), collector);
            if (join.getCondition() != null) {
                join.getCondition().accept(collector);
            }
        }
    }

    static class ColumnCollector extends SqlBasicVisitor<Void> {
        private final AnalysisContext context;
        private final boolean resolveAliases;

        ColumnCollector(AnalysisContext context, boolean resolveAliases) {
            this.context = context;
            this.resolveAliases = resolveAliases;
        }

        @Override
        public Void visit(SqlIdentifier id) {
            if (id.isStar()) {
                return null;
            }
            if (resolveAliases && id.isSimple() && context.getAliases().containsKey(id.getSimple())
                    && !isStreamField(id.getSimple())) {
                return null;
            }
            String field = AnalysisContext.fieldName(id);
            if (id.names.size() > 1) {
                Optional<String> owner = context.resolveOwner(id);
                owner.ifPresent(stream -> context.addColumn(stream, field));
                return null;
            }
            if (context.isSingleStream()) {
                context.addColumn(context.getStreamNames().get(0), field);
                return null;
            }
            for (String stream : context.getStreamNames()) {
                if (context.getSchemas().get(stream).hasField(field)) {
                    context.addColumn(stream, field);
                }
            }
            return null;
        }

        private boolean isStreamField(String name) {
            for (String stream : context.getStreamNames()) {
                if (context.getSchemas().get(stream).hasField(name)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Void visit(SqlCall call) {
            if (call instanceof SqlSelect) {
                SqlSelect inner = (SqlSelect) call;
                for (SqlNode node : new SqlNode[] {inner.getSelectList(), inner.getWhere(),
                        inner.getGroup(), inner.getHaving()}) {
                    if (node != null) {
                        node.accept(this);
                    }
                }
                return null;
            }
            if (call.getKind() == SqlKind.AS) {
                return call.operand(0).accept(this);
            }
            switch (call.getKind()) {
                case OVER:
                case FILTER:
                case WITHIN_GROUP:
                    context.setWindow(true);
                    break;
                default:
                    if (AggregateFunctions.isAggregate(SqlSupport.functionName(call))) {
                        context.setAggregate(true);
                    }
            }
            return super.visit(call);
        }
    }
}
