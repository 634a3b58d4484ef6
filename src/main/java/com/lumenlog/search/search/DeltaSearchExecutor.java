package com.lumenlog.search.search;

import com.lumenlog.search.cache.QueryDelta;
import com.lumenlog.search.dto.SearchResponse;
import com.lumenlog.search.sql.ParsedQuery;

/**
 * Runs the rewritten query over one uncached time window.
 *
 * Implemented by the distributed coordinator, which plans the partitions, stitches them on the
 * workers and gathers the results.
 */
public interface DeltaSearchExecutor {

    SearchResponse execute(String traceId, ParsedQuery query, QueryDelta delta);
}
