package com.lumenlog.search.plan.tier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bound data source of one tier: the files to read and the pushed-down hints.
 *
 * When an index condition is present every tier must apply it, since its exact conjuncts
 * may have been removed from the SQL filter.
 */
public class TierTable {

    private final Tier tier;
    private final String streamName;
    private final List<String> files;
    private final Map<String, String> segmentIds;
    private final List<String> ftsFields;
    private final String indexCondition;
    private final long records;

    @JsonCreator
    public TierTable(@JsonProperty("tier") Tier tier,
                     @JsonProperty("streamName") String streamName,
                     @JsonProperty("files") List<String> files,
                     @JsonProperty("segmentIds") Map<String, String> segmentIds,
                     @JsonProperty("ftsFields") List<String> ftsFields,
                     @JsonProperty("indexCondition") String indexCondition,
                     @JsonProperty("records") long records) {
        this.tier = tier;
        this.streamName = streamName;
        this.files = files == null ? new ArrayList<>() : new ArrayList<>(files);
        this.segmentIds = segmentIds == null ? new LinkedHashMap<>() : new LinkedHashMap<>(segmentIds);
        this.ftsFields = ftsFields == null ? new ArrayList<>() : new ArrayList<>(ftsFields);
        this.indexCondition = indexCondition;
        this.records = records;
    }

    public Tier getTier() {
        return tier;
    }

    public String getStreamName() {
        return streamName;
    }

    public List<String> getFiles() {
        return Collections.unmodifiableList(files);
    }

    /** Base64 row bitmaps for files narrowed by the index, keyed by file key */
    public Map<String, String> getSegmentIds() {
        return Collections.unmodifiableMap(segmentIds);
    }

    public List<String> getFtsFields() {
        return Collections.unmodifiableList(ftsFields);
    }

    public String getIndexCondition() {
        return indexCondition;
    }

    public long getRecords() {
        return records;
    }

    @Override
    public String toString() {
        return tier + "(" + files.size() + " files)";
    }
}
