package com.lumenlog.search.sql.pass;

import com.lumenlog.search.exception.InvalidQueryException;
import com.lumenlog.search.exception.StreamNotFoundException;
import com.lumenlog.search.schema.StreamSchema;
import com.lumenlog.search.schema.StreamSettings;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlJoin;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.util.SqlBasicVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the streams named in FROM (joins and subqueries included) and loads their schemas
 */
public class StreamResolutionPass implements RewritePass {

    private static final Logger log = LoggerFactory.getLogger(StreamResolutionPass.class);

    @Override
    public String name() {
        return "stream-resolution";
    }

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        if (select.getFrom() == null) {
            throw new InvalidQueryException("Query has no FROM clause");
        }
        visitFrom(select.getFrom(), context);

        // subqueries in the projection or predicates may read further streams
        SubqueryFinder finder = new SubqueryFinder(context);
        for (SqlNode node : new SqlNode[] {select.getSelectList(), select.getWhere(), select.getHaving()}) {
            if (node != null) {
                node.accept(finder);
            }
        }

        log.debug("Resolved streams {} (join: {}, subquery: {})",
            context.getStreamNames(), context.isJoin(), context.isSubquery());
        return select;
    }

    private void visitFrom(SqlNode from, AnalysisContext context) {
        switch (from.getKind()) {
            case IDENTIFIER:
                addStream(AnalysisContext.fieldName((SqlIdentifier) from), context);
                break;
            case AS: {
                SqlCall as = (SqlCall) from;
                SqlNode target = as.operand(0);
                SqlNode alias = as.operand(1);
                if (target instanceof SqlIdentifier) {
                    String stream = AnalysisContext.fieldName((SqlIdentifier) target);
                    addStream(stream, context);
                    context.getTableAliases().put(((SqlIdentifier) alias).getSimple(), stream);
                } else {
                    visitFrom(target, context);
                }
                break;
            }
            case JOIN: {
                SqlJoin join = (SqlJoin) from;
                context.setJoin(true);
                visitFrom(join.getLeft(), context);
                visitFrom(join.getRight(), context);
                break;
            }
            case SELECT: {
                context.setSubquery(true);
                SqlSelect inner = (SqlSelect) from;
                if (inner.getFrom() != null) {
                    visitFrom(inner.getFrom(), context);
                }
                break;
            }
            default:
                throw new InvalidQueryException("Unsupported FROM clause: " + from.getKind());
        }
    }

    private void addStream(String stream, AnalysisContext context) {
        if (context.getStreamNames().contains(stream)) {
            return;
        }
        StreamSchema schema = context.getSchemaResolver()
            .getSchema(context.getOrg(), stream, context.getStreamType())
            .orElseThrow(() -> new StreamNotFoundException("Stream not found: " + stream));
        StreamSettings settings = context.getSchemaResolver()
            .getSettings(context.getOrg(), stream, context.getStreamType());
        context.addStream(stream, schema, settings == null ? StreamSettings.defaults() : settings);
    }

    private class SubqueryFinder extends SqlBasicVisitor<Void> {
        private final AnalysisContext context;

        SubqueryFinder(AnalysisContext context) {
            this.context = context;
        }

        @Override
        public Void visit(SqlCall call) {
            if (call.getKind() == SqlKind.EXISTS) {
                context.setSubquery(true);
            }
            if (call instanceof SqlSelect) {
                context.setSubquery(true);
                SqlSelect inner = (SqlSelect) call;
                if (inner.getFrom() != null) {
                    visitFrom(inner.getFrom(), context);
                }
                if (inner.getWhere() != null) {
                    inner.getWhere().accept(this);
                }
                return null;
            }
            return super.visit(call);
        }
    }
}
