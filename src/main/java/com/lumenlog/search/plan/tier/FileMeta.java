package com.lumenlog.search.plan.tier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Catalog record of one data file (or in-memory batch) of a stream
 */
public class FileMeta {

    private final long id;
    private final String key;
    private final long minTs;
    private final long maxTs;
    private final long records;
    private final long originalSize;
    private final long compressedSize;
    private final long indexSize;

    @JsonCreator
    public FileMeta(@JsonProperty("id") long id,
                    @JsonProperty("key") String key,
                    @JsonProperty("minTs") long minTs,
                    @JsonProperty("maxTs") long maxTs,
                    @JsonProperty("records") long records,
                    @JsonProperty("originalSize") long originalSize,
                    @JsonProperty("compressedSize") long compressedSize,
                    @JsonProperty("indexSize") long indexSize) {
        this.id = id;
        this.key = key;
        this.minTs = minTs;
        this.maxTs = maxTs;
        this.records = records;
        this.originalSize = originalSize;
        this.compressedSize = compressedSize;
        this.indexSize = indexSize;
    }

    public long getId() {
        return id;
    }

    public String getKey() {
        return key;
    }

    public long getMinTs() {
        return minTs;
    }

    public long getMaxTs() {
        return maxTs;
    }

    public long getRecords() {
        return records;
    }

    public long getOriginalSize() {
        return originalSize;
    }

    public long getCompressedSize() {
        return compressedSize;
    }

    public long getIndexSize() {
        return indexSize;
    }

    /**
     * Partition values encoded as {@code field=value} segments of the file key
     */
    public Map<String, String> partitionValues() {
        if (key == null) {
            return Collections.emptyMap();
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (String segment : key.split("/")) {
            int eq = segment.indexOf('=');
            if (eq > 0) {
                values.put(segment.substring(0, eq), segment.substring(eq + 1));
            }
        }
        return values;
    }

    @Override
    public String toString() {
        return key;
    }
}
