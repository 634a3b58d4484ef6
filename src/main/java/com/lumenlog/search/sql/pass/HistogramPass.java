package com.lumenlog.search.sql.pass;

import com.lumenlog.search.exception.InvalidQueryException;
import com.lumenlog.search.sql.HistogramIntervals;
import com.lumenlog.search.sql.SqlSupport;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.util.SqlBasicVisitor;

/**
 * Resolves the bucket width of the first {@code histogram(col[, arg])} call
 */
public class HistogramPass implements RewritePass {

    public static final String HISTOGRAM = "histogram";

    @Override
    public String name() {
        return "histogram";
    }

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        SqlCall histogram = findHistogram(select);
        if (histogram == null) {
            return select;
        }
        context.setHistogramInterval(resolve(histogram, context));
        return select;
    }

    private static long resolve(SqlCall call, AnalysisContext context) {
        if (call.operandCount() < 2) {
            return HistogramIntervals.forSpan(context.getTimeRange());
        }
        SqlNode arg = call.operand(1);
        if (SqlSupport.isIntegerLiteral(arg)) {
            long buckets = ((SqlNumericLiteral) arg).longValue(true);
            return HistogramIntervals.forBucketCount(buckets, context.getTimeRange());
        }
        if (SqlSupport.isStringLiteral(arg)) {
            return HistogramIntervals.forDuration(SqlSupport.literalValue(arg));
        }
        throw new InvalidQueryException("histogram interval must be a bucket count or a duration literal: "
            + SqlSupport.unparse(arg));
    }

    static SqlCall findHistogram(SqlSelect select) {
        HistogramFinder finder = new HistogramFinder();
        for (SqlNode node : new SqlNode[] {select.getSelectList(), select.getGroup()}) {
            if (node != null && finder.found == null) {
                node.accept(finder);
            }
        }
        return finder.found;
    }

    private static class HistogramFinder extends SqlBasicVisitor<Void> {
        private SqlCall found;

        @Override
        public Void visit(SqlCall call) {
            if (found != null) {
                return null;
            }
            if (HISTOGRAM.equals(SqlSupport.functionName(call))) {
                found = call;
                return null;
            }
            return super.visit(call);
        }
    }
}
