package com.lumenlog.search.sql.pass;

import com.lumenlog.search.sql.SqlSupport;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.util.SqlBasicVisitor;

/**
 * Collects the terms of full-text match calls in WHERE (single-stream queries only)
 */
public class MatchTermPass implements RewritePass {

    @Override
    public String name() {
        return "match-terms";
    }

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        if (!context.isSingleStream() || select.getWhere() == null) {
            return select;
        }
        select.getWhere().accept(new SqlBasicVisitor<Void>() {
            @Override
            public Void visit(SqlCall call) {
                String term = SqlSupport.matchTerm(call);
                if (term != null && !context.getMatchTerms().contains(term)) {
                    context.getMatchTerms().add(term);
                }
                return super.visit(call);
            }
        });
        return select;
    }
}
