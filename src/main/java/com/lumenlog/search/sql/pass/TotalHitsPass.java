package com.lumenlog.search.sql.pass;

import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.SqlSelectKeyword;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.parser.SqlParserPos;

import static com.lumenlog.search.sql.SqlSupport.stripAlias;

/**
 * Turns the statement into a single total count when total hits are requested.
 *
 * {@code SELECT DISTINCT a, b ...} becomes {@code COUNT(DISTINCT a)}, anything else
 * {@code COUNT(*)}. GROUP BY, HAVING, ORDER BY and DISTINCT are dropped.
 */
public class TotalHitsPass implements RewritePass {

    public static final String TOTAL_HITS_ALIAS = "total_hits";

    @Override
    public String name() {
        return "total-hits";
    }

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        if (!context.getRequest().isTrackTotalHits()) {
            return select;
        }
        SqlParserPos pos = SqlParserPos.ZERO;
        SqlNode first = stripAlias(select.getSelectList().get(0));
        boolean countDistinct = select.isDistinct()
            && !(first instanceof SqlIdentifier && ((SqlIdentifier) first).isStar());

        SqlNode count = countDistinct
            ? SqlStdOperatorTable.COUNT.createCall(SqlLiteral.createSymbol(SqlSelectKeyword.DISTINCT, pos), pos, first)
            : SqlStdOperatorTable.COUNT.createCall(pos, SqlIdentifier.star(pos));
        SqlNode aliased = SqlStdOperatorTable.AS.createCall(pos, count, new SqlIdentifier(TOTAL_HITS_ALIAS, pos));

        select.setSelectList(SqlNodeList.of(aliased));
        select.setGroupBy(null);
        select.setHaving(null);
        select.setOrderBy(null);
        select.setOperand(0, new SqlNodeList(pos));
        context.setTotalHitsRewritten(true);
        return select;
    }
}
