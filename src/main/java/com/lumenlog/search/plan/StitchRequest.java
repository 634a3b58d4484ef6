package com.lumenlog.search.plan;

import com.lumenlog.search.cache.QueryDelta;
import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.FieldValue;
import com.lumenlog.search.sql.ParsedQuery;
import com.lumenlog.search.sql.TimeRange;
import com.lumenlog.search.sql.index.IndexCondition;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Input of one partition stitch as received by a worker
 */
public class StitchRequest {

    private String traceId;
    private String org;
    private StreamType streamType;
    private String streamName;
    private TimeRange timeRange;
    private byte[] plan;
    private List<FieldValue> equalItems = new ArrayList<>();
    private List<FieldValue> prefixItems = new ArrayList<>();
    private String indexCondition;
    private List<Long> fileIds;
    private Map<String, BitSet> indexFiles;

    /**
     * Request for one uncached window of the query's primary stream, carrying the analyzer's hints
     */
    public static StitchRequest forDelta(String traceId, ParsedQuery query, QueryDelta delta, byte[] plan) {
        String stream = query.getPrimaryStream();
        StitchRequest request = new StitchRequest()
            .setTraceId(traceId)
            .setOrg(query.getOrg())
            .setStreamType(query.getStreamType())
            .setStreamName(stream)
            .setTimeRange(new TimeRange(delta.getStart(), delta.getEnd()))
            .setPlan(plan)
            .setEqualItems(query.getEqualItems().getOrDefault(stream, Collections.emptyList()))
            .setPrefixItems(query.getPrefixItems().getOrDefault(stream, Collections.emptyList()));
        if (query.isUseInvertedIndex()) {
            query.getIndexCondition()
                .filter(c -> !c.isEmpty())
                .map(IndexCondition::toQueryString)
                .ifPresent(request::setIndexCondition);
        }
        return request;
    }

    public String getTraceId() {
        return traceId;
    }

    public StitchRequest setTraceId(String traceId) {
        this.traceId = traceId;
        return this;
    }

    public String getOrg() {
        return org;
    }

    public StitchRequest setOrg(String org) {
        this.org = org;
        return this;
    }

    public StreamType getStreamType() {
        return streamType;
    }

    public StitchRequest setStreamType(StreamType streamType) {
        this.streamType = streamType;
        return this;
    }

    public String getStreamName() {
        return streamName;
    }

    public StitchRequest setStreamName(String streamName) {
        this.streamName = streamName;
        return this;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public StitchRequest setTimeRange(TimeRange timeRange) {
        this.timeRange = timeRange;
        return this;
    }

    public byte[] getPlan() {
        return plan;
    }

    public StitchRequest setPlan(byte[] plan) {
        this.plan = plan;
        return this;
    }

    public List<FieldValue> getEqualItems() {
        return equalItems;
    }

    public StitchRequest setEqualItems(List<FieldValue> equalItems) {
        this.equalItems = new ArrayList<>(equalItems);
        return this;
    }

    public List<FieldValue> getPrefixItems() {
        return prefixItems;
    }

    public StitchRequest setPrefixItems(List<FieldValue> prefixItems) {
        this.prefixItems = new ArrayList<>(prefixItems);
        return this;
    }

    public String getIndexCondition() {
        return indexCondition;
    }

    public StitchRequest setIndexCondition(String indexCondition) {
        this.indexCondition = indexCondition;
        return this;
    }

    public List<Long> getFileIds() {
        return fileIds;
    }

    public StitchRequest setFileIds(List<Long> fileIds) {
        this.fileIds = fileIds;
        return this;
    }

    public Map<String, BitSet> getIndexFiles() {
        return indexFiles;
    }

    public StitchRequest setIndexFiles(Map<String, BitSet> indexFiles) {
        this.indexFiles = indexFiles;
        return this;
    }
}
