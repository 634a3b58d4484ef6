package com.lumenlog.search.plan.tier;

/**
 * Binds the data of one storage tier for a partition scan
 */
public interface TierSource {

    Tier tier();

    /**
     * Tiers that only exist on ingesting nodes
     */
    boolean ingesterOnly();

    /**
     * Build the tier's table, or null when the tier holds nothing for this partition.
     * Scanned volume is added to {@code stats}.
     */
    TierTable build(StitchContext ctx, ScanStats stats);
}
