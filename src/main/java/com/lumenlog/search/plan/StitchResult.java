package com.lumenlog.search.plan;

import com.lumenlog.search.plan.tier.ScanStats;

/**
 * Executable partition plan plus the volume it will scan
 */
public class StitchResult {

    private final PlanNode plan;
    private final ScanStats stats;

    public StitchResult(PlanNode plan, ScanStats stats) {
        this.plan = plan;
        this.stats = stats;
    }

    public PlanNode getPlan() {
        return plan;
    }

    public ScanStats getStats() {
        return stats;
    }
}
