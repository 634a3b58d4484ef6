package com.lumenlog.search.sql.pass;

import com.lumenlog.search.sql.FieldValue;
import com.lumenlog.search.sql.SqlSupport;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlSelect;

import java.util.Optional;

/**
 * Base for passes that lift hints out of the top-level AND conjuncts of WHERE.
 *
 * A hint is recorded only when its field belongs to exactly one stream.
 */
public abstract class ConjunctHintPass implements RewritePass {

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        for (SqlNode conjunct : SqlSupport.splitAnd(select.getWhere())) {
            if (conjunct instanceof SqlCall) {
                collect((SqlCall) conjunct, context);
            }
        }
        return select;
    }

    protected abstract void collect(SqlCall conjunct, AnalysisContext context);

    protected static Optional<String> owner(SqlNode node, AnalysisContext context) {
        if (!(node instanceof SqlIdentifier)) {
            return Optional.empty();
        }
        return context.resolveOwner((SqlIdentifier) node);
    }

    protected static FieldValue item(SqlNode field, String value) {
        return new FieldValue(AnalysisContext.fieldName((SqlIdentifier) field), value);
    }
}
