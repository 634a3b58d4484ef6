package com.lumenlog.search.sql.pass;

import com.lumenlog.search.sql.OrderBy;
import com.lumenlog.search.sql.OrderDirection;
import org.apache.calcite.sql.SqlSelect;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain single-stream listings default to newest-first on the timestamp column
 */
public class DefaultOrderPass implements RewritePass {

    @Override
    public String name() {
        return "default-order";
    }

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        if (context.getOrderBy().isEmpty()
                && !context.isTotalHitsRewritten()
                && context.isSingleStream()
                && context.getGroupBy().isEmpty()
                && !context.isAggregate()
                && !context.isDistinct()) {
            List<OrderBy> order = new ArrayList<>();
            order.add(new OrderBy(context.timestampColumn(), OrderDirection.DESC));
            context.setOrderBy(order);
        }
        List<OrderBy> order = context.getOrderBy();
        context.setSortedByTime(order.size() == 1
            && order.get(0).getField().equals(context.timestampColumn())
            && order.get(0).isDescending());
        return select;
    }
}
