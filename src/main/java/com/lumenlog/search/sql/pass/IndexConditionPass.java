package com.lumenlog.search.sql.pass;

import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.schema.StreamSettings;
import com.lumenlog.search.sql.SqlSupport;
import com.lumenlog.search.sql.index.IndexCondition;
import com.lumenlog.search.sql.index.IndexConditionExtractor;
import com.lumenlog.search.sql.index.IndexNode;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pushes index-evaluable WHERE conjuncts down to the inverted index.
 *
 * A conjunct the index evaluates exactly is removed from the SQL filter when
 * remove-filter-with-index is on. Any other conjunct stays in SQL; its relaxation, if one
 * exists, is added to the index condition as a pre-filter.
 */
public class IndexConditionPass implements RewritePass {

    private static final Logger log = LoggerFactory.getLogger(IndexConditionPass.class);

    @Override
    public String name() {
        return "index-condition";
    }

    @Override
    public SqlSelect apply(SqlSelect select, AnalysisContext context) {
        SearchEngineConfig.IndexConfig indexConfig = context.getConfig().getIndex();
        if (!context.isSingleStream() || !indexConfig.isNativeIndex() || select.getWhere() == null) {
            return select;
        }
        String stream = context.getStreamNames().get(0);
        StreamSettings settings = context.getSettings().get(stream);
        IndexConditionExtractor extractor =
            new IndexConditionExtractor(settings.getIndexFields(), context.ftsFields(stream));

        IndexCondition condition = new IndexCondition();
        List<SqlNode> residual = new ArrayList<>();
        for (SqlNode conjunct : SqlSupport.splitAnd(select.getWhere())) {
            IndexNode exact = extractor.exact(conjunct);
            if (exact != null) {
                condition.addExact(exact);
                if (!indexConfig.isRemoveFilterWithIndex()) {
                    residual.add(conjunct);
                }
                continue;
            }
            residual.add(conjunct);
            IndexNode relaxed = extractor.relax(conjunct);
            if (relaxed != null) {
                condition.addPreFilter(relaxed);
            }
        }

        if (condition.isEmpty()) {
            return select;
        }
        select.setWhere(SqlSupport.joinAnd(residual));
        context.setIndexCondition(condition);
        context.setUseInvertedIndex(true);
        log.debug("Index condition for {}: {}", stream, condition.toQueryString());
        return select;
    }
}
