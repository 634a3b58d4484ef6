package com.lumenlog.search.plan.tier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.TreeMap;

/**
 * Local not-yet-uploaded segments of an ingester
 */
@Component
public class LocalSegmentTierSource implements TierSource {

    private static final Logger log = LoggerFactory.getLogger(LocalSegmentTierSource.class);

    private final LocalSegmentCatalog catalog;

    @Autowired
    public LocalSegmentTierSource(LocalSegmentCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Tier tier() {
        return Tier.LOCAL_SEGMENT;
    }

    @Override
    public boolean ingesterOnly() {
        return true;
    }

    @Override
    public TierTable build(StitchContext ctx, ScanStats stats) {
        TreeMap<String, FileMeta> selected = new TreeMap<>();
        for (FileMeta segment : catalog.listSegments(ctx.getOrg(), ctx.getStreamType(), ctx.getStreamName(),
                ctx.getTimeRange())) {
            if (FileMatcher.matches(segment, ctx)) {
                selected.putIfAbsent(segment.getKey(), segment);
            }
        }
        log.debug("[trace_id {}] local segments: {} selected", ctx.getTraceId(), selected.size());
        if (selected.isEmpty()) {
            return null;
        }
        ScanStats tierStats = new ScanStats();
        selected.values().forEach(tierStats::add);
        stats.add(tierStats);
        return new TierTable(Tier.LOCAL_SEGMENT, ctx.getStreamName(), new ArrayList<>(selected.keySet()),
            Collections.emptyMap(), ctx.getFtsFields(), ctx.getIndexCondition(), tierStats.getRecords());
    }
}
