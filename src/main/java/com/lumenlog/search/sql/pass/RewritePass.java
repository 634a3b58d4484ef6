package com.lumenlog.search.sql.pass;

import org.apache.calcite.sql.SqlSelect;

/**
 * One step of the analysis pipeline.
 *
 * A pass may record hints into the context and may return a rewritten statement; passes run
 * in a fixed order on a single thread.
 */
public interface RewritePass {

    String name();

    SqlSelect apply(SqlSelect select, AnalysisContext context);
}
