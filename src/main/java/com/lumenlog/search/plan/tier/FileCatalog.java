package com.lumenlog.search.plan.tier;

import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.TimeRange;

import java.util.List;

/**
 * Metadata catalog of persisted files. Failures surface as
 * {@link com.lumenlog.search.exception.UpstreamIoException}.
 */
public interface FileCatalog {

    /**
     * Files whose time span overlaps the range
     */
    List<FileMeta> list(String org, StreamType type, String stream, TimeRange range);

    /**
     * Files by catalog id. Unknown ids are ignored.
     */
    List<FileMeta> listByIds(List<Long> ids);
}
