package com.lumenlog.search.sql.pass;

import com.lumenlog.search.sql.SqlSupport;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlNode;

import java.util.Optional;

/**
 * Prefix hints from {@code f LIKE 'abc%'}
 */
public class PrefixHintPass extends ConjunctHintPass {

    @Override
    public String name() {
        return "prefix-hints";
    }

    @Override
    protected void collect(SqlCall conjunct, AnalysisContext context) {
        String prefix = SqlSupport.likePrefix(conjunct);
        if (prefix == null) {
            return;
        }
        SqlNode field = conjunct.operand(0);
        Optional<String> stream = owner(field, context);
        stream.ifPresent(s -> context.addPrefixItem(s, item(field, prefix)));
    }
}
