package com.lumenlog.search.sql.pass;

import com.lumenlog.search.sql.SqlSupport;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Equality hints for partition pruning: {@code f = literal} and {@code f IN (literals)}
 */
public class PartitionHintPass extends ConjunctHintPass {

    @Override
    public String name() {
        return "partition-hints";
    }

    @Override
    protected void collect(SqlCall conjunct, AnalysisContext context) {
        if (conjunct.getKind() == SqlKind.EQUALS) {
            SqlNode left = conjunct.operand(0);
            SqlNode right = conjunct.operand(1);
            if (SqlSupport.literalValue(left) != null) {
                SqlNode tmp = left;
                left = right;
                right = tmp;
            }
            String value = SqlSupport.literalValue(right);
            Optional<String> stream = owner(left, context);
            if (value != null && stream.isPresent()) {
                context.addEqualItem(stream.get(), item(left, value));
            }
        } else if (conjunct.getKind() == SqlKind.IN) {
            SqlNode field = conjunct.operand(0);
            SqlNode list = conjunct.operand(1);
            Optional<String> stream = owner(field, context);
            if (!stream.isPresent() || !(list instanceof SqlNodeList)) {
                return;
            }
            List<String> values = new ArrayList<>();
            for (SqlNode node : (SqlNodeList) list) {
                String value = SqlSupport.literalValue(node);
                if (value == null) {
                    return;
                }
                values.add(value);
            }
            for (String value : values) {
                context.addEqualItem(stream.get(), item(field, value));
            }
        }
    }
}
