package com.lumenlog.search.plan.tier;

import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.TimeRange;

import java.util.List;

/**
 * Segments written to local disk on this ingester and not yet uploaded
 */
public interface LocalSegmentCatalog {

    List<FileMeta> listSegments(String org, StreamType type, String stream, TimeRange range);
}
