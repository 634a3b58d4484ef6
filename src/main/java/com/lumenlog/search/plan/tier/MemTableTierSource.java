package com.lumenlog.search.plan.tier;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory batches of an ingester, pruned by time span and by the partition values in their keys
 */
@Component
public class MemTableTierSource implements TierSource {

    private final MemTableScanner scanner;

    @Autowired
    public MemTableTierSource(MemTableScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public Tier tier() {
        return Tier.MEM_TABLE;
    }

    @Override
    public boolean ingesterOnly() {
        return true;
    }

    @Override
    public TierTable build(StitchContext ctx, ScanStats stats) {
        List<String> batches = new ArrayList<>();
        ScanStats tierStats = new ScanStats();
        for (FileMeta batch : scanner.listBatches(ctx.getOrg(), ctx.getStreamType(), ctx.getStreamName(),
                ctx.getTimeRange())) {
            if (FileMatcher.matches(batch, ctx)) {
                batches.add(batch.getKey());
                tierStats.add(batch);
            }
        }
        if (batches.isEmpty()) {
            return null;
        }
        stats.add(tierStats);
        return new TierTable(Tier.MEM_TABLE, ctx.getStreamName(), batches, Collections.emptyMap(),
            ctx.getFtsFields(), ctx.getIndexCondition(), tierStats.getRecords());
    }
}
