package com.lumenlog.search.plan.tier;

import com.lumenlog.search.schema.StreamPartition;
import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.FieldValue;
import com.lumenlog.search.sql.TimeRange;

import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everything a tier source needs to bind one partition of a stream
 */
public class StitchContext {

    private final String traceId;
    private final String org;
    private final StreamType streamType;
    private final String streamName;
    private final TimeRange timeRange;
    private final List<StreamPartition> partitionKeys;
    private final Map<String, List<FieldValue>> equalItems;
    private final Map<String, List<FieldValue>> prefixItems;
    private final List<String> ftsFields;
    private final String indexCondition;
    private final List<Long> fileIds;
    private final Map<String, BitSet> indexFiles;

    public StitchContext(String traceId, String org, StreamType streamType, String streamName,
                         TimeRange timeRange, List<StreamPartition> partitionKeys,
                         Map<String, List<FieldValue>> equalItems,
                         Map<String, List<FieldValue>> prefixItems,
                         List<String> ftsFields, String indexCondition,
                         List<Long> fileIds, Map<String, BitSet> indexFiles) {
        this.traceId = traceId;
        this.org = org;
        this.streamType = streamType;
        this.streamName = streamName;
        this.timeRange = timeRange;
        this.partitionKeys = partitionKeys == null ? Collections.emptyList() : partitionKeys;
        this.equalItems = equalItems == null ? Collections.emptyMap() : equalItems;
        this.prefixItems = prefixItems == null ? Collections.emptyMap() : prefixItems;
        this.ftsFields = ftsFields == null ? Collections.emptyList() : ftsFields;
        this.indexCondition = indexCondition;
        this.fileIds = fileIds;
        this.indexFiles = indexFiles;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getOrg() {
        return org;
    }

    public StreamType getStreamType() {
        return streamType;
    }

    public String getStreamName() {
        return streamName;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public List<StreamPartition> getPartitionKeys() {
        return partitionKeys;
    }

    public Map<String, List<FieldValue>> getEqualItems() {
        return equalItems;
    }

    public Map<String, List<FieldValue>> getPrefixItems() {
        return prefixItems;
    }

    public List<String> getFtsFields() {
        return ftsFields;
    }

    public String getIndexCondition() {
        return indexCondition;
    }

    /**
     * Explicit file ids chosen by the coordinator, or null to list by time range
     */
    public List<Long> getFileIds() {
        return fileIds;
    }

    /**
     * Row bitmaps from the inverted index keyed by file key, or null when the index was not consulted
     */
    public Map<String, BitSet> getIndexFiles() {
        return indexFiles;
    }
}
