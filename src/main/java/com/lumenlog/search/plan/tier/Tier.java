package com.lumenlog.search.plan.tier;

/**
 * Storage tiers a stream's data may live in
 */
public enum Tier {
    /** persisted files in object storage */
    OBJECT_STORAGE,
    /** local segments on an ingester not yet uploaded */
    LOCAL_SEGMENT,
    /** in-memory write buffer on an ingester */
    MEM_TABLE
}
