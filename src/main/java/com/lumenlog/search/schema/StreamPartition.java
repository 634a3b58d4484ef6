package com.lumenlog.search.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * A declared partition key of a stream.
 *
 * Files are written under path segments of the form {@code field=partitionValue}.
 */
public class StreamPartition {

    public static final int MIN_HASH_BUCKETS = 16;

    private final String field;
    private final PartitionType type;
    private final int buckets;

    @JsonCreator
    public StreamPartition(@JsonProperty("field") String field,
                           @JsonProperty("type") PartitionType type,
                           @JsonProperty("buckets") int buckets) {
        this.field = field;
        this.type = type == null ? PartitionType.VALUE : type;
        if (this.type == PartitionType.HASH && buckets < MIN_HASH_BUCKETS) {
            throw new IllegalArgumentException(
                "hash partition on " + field + " needs at least " + MIN_HASH_BUCKETS + " buckets, got " + buckets);
        }
        this.buckets = buckets;
    }

    public static StreamPartition value(String field) {
        return new StreamPartition(field, PartitionType.VALUE, 0);
    }

    public static StreamPartition hash(String field, int buckets) {
        return new StreamPartition(field, PartitionType.HASH, buckets);
    }

    public static StreamPartition prefix(String field) {
        return new StreamPartition(field, PartitionType.PREFIX, 0);
    }

    public String getField() {
        return field;
    }

    public PartitionType getType() {
        return type;
    }

    public int getBuckets() {
        return buckets;
    }

    /**
     * Value written into the partition path segment for a raw field value
     */
    public String partitionValue(String value) {
        switch (type) {
            case HASH:
                long h = Hashing.farmHashFingerprint64().hashString(value, StandardCharsets.UTF_8).asLong();
                return Long.toString(Long.remainderUnsigned(h, buckets));
            case PREFIX:
                return value.isEmpty() ? "" : value.substring(0, 1).toLowerCase(Locale.ROOT);
            default:
                return value;
        }
    }

    public String partitionKey(String value) {
        return field + "=" + partitionValue(value);
    }

    @Override
    public String toString() {
        return type == PartitionType.HASH ? field + ":hash(" + buckets + ")" : field + ":" + type.name().toLowerCase(Locale.ROOT);
    }
}
