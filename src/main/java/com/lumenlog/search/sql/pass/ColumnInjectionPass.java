package com.lumenlog.search.sql.pass;

import com.lumenlog.search.schema.StreamSettings;
import com.lumenlog.search.sql.SqlSupport;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.parser.SqlParserPos;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds the timestamp (and, for streams keeping raw payloads, the row id) to simple projections,
 * then records which output column carries event time.
 */
public class ColumnInjectionPass implements RewritePass {

    private static final Logger log = LoggerFactory.getLogger(ColumnInjectionPass.class);

    @Override
    public String name() {
        return "column-injection";
    }

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        boolean complex = !context.getGroupBy().isEmpty()
            || context.isJoin()
            || context.isSubquery()
            || context.isAggregate()
            || context.isWindow()
            || context.isWildcard()
            || context.isDistinct();
        context.setComplex(complex);

        if (!complex) {
            List<SqlNode> items = new ArrayList<>(select.getSelectList().getList());
            String ts = context.timestampColumn();
            if (!projects(items, ts)) {
                items.add(0, new SqlIdentifier(ts, SqlParserPos.ZERO));
                context.addColumn(context.getStreamNames().get(0), ts);
                log.debug("Injected {} into projection", ts);
            }
            String rowId = context.rowIdColumn();
            if (storesOriginal(context) && !projects(items, rowId)) {
                items.add(0, new SqlIdentifier(rowId, SqlParserPos.ZERO));
                context.addColumn(context.getStreamNames().get(0), rowId);
                log.debug("Injected {} into projection", rowId);
            }
            select.setSelectList(new SqlNodeList(items, SqlParserPos.ZERO));
        }

        context.setResultTimestampColumn(resultTimestampColumn(select, context));
        return select;
    }

    private static boolean storesOriginal(AnalysisContext context) {
        for (StreamSettings settings : context.getSettings().values()) {
            if (settings.isStoreOriginalData()) {
                return true;
            }
        }
        return false;
    }

    private static boolean projects(List<SqlNode> items, String column) {
        for (SqlNode item : items) {
            if (column.equals(SqlSupport.outputName(item))) {
                return true;
            }
        }
        return false;
    }

    private static String resultTimestampColumn(SqlSelect select, AnalysisContext context) {
        if (context.isTotalHitsRewritten()) {
            return null;
        }
        String ts = context.timestampColumn();
        List<SqlNode> items = select.getSelectList().getList();
        if (!context.isAggregate() && context.getGroupBy().isEmpty()) {
            return context.isWildcard() || projects(items, ts) ? ts : null;
        }
        for (SqlNode item : items) {
            SqlNode expr = SqlSupport.stripAlias(item);
            boolean isTime = SqlSupport.isFunction(expr, HistogramPass.HISTOGRAM)
                || (expr instanceof SqlIdentifier && ts.equals(AnalysisContext.fieldName((SqlIdentifier) expr)));
            if (isTime && SqlSupport.outputName(item) != null) {
                return SqlSupport.outputName(item);
            }
        }
        return null;
    }
}
