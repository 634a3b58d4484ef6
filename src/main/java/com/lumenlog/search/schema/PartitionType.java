package com.lumenlog.search.schema;

/**
 * How a partition key maps a field value to a storage path segment
 */
public enum PartitionType {
    /** the raw value */
    VALUE,
    /** hash of the value modulo a bucket count */
    HASH,
    /** first character, lower-cased */
    PREFIX
}
