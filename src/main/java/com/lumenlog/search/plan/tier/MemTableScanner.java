package com.lumenlog.search.plan.tier;

import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.TimeRange;

import java.util.List;

/**
 * In-memory record batches of this ingester
 */
public interface MemTableScanner {

    List<FileMeta> listBatches(String org, StreamType type, String stream, TimeRange range);
}
