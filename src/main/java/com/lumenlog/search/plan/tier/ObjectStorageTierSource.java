package com.lumenlog.search.plan.tier;

import com.google.common.io.BaseEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persisted files in object storage.
 *
 * Files come from the coordinator's id list when present, otherwise from a time-range listing.
 * When the inverted index was consulted only files it returned rows for survive, and each
 * keeps its row bitmap.
 */
@Component
public class ObjectStorageTierSource implements TierSource {

    private static final Logger log = LoggerFactory.getLogger(ObjectStorageTierSource.class);

    private final FileCatalog catalog;

    @Autowired
    public ObjectStorageTierSource(FileCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Tier tier() {
        return Tier.OBJECT_STORAGE;
    }

    @Override
    public boolean ingesterOnly() {
        return false;
    }

    @Override
    public TierTable build(StitchContext ctx, ScanStats stats) {
        List<FileMeta> candidates = ctx.getFileIds() != null
            ? catalog.listByIds(ctx.getFileIds())
            : catalog.list(ctx.getOrg(), ctx.getStreamType(), ctx.getStreamName(), ctx.getTimeRange());

        Map<String, BitSet> indexFiles = ctx.getIndexFiles();
        TreeMap<String, FileMeta> selected = new TreeMap<>();
        for (FileMeta file : candidates) {
            if (indexFiles != null) {
                BitSet rows = indexFiles.get(file.getKey());
                if (rows == null || rows.isEmpty()) {
                    continue;
                }
            }
            if (!FileMatcher.matches(file, ctx)) {
                continue;
            }
            selected.putIfAbsent(file.getKey(), file);
        }

        log.debug("[trace_id {}] object storage: {} candidates, {} selected", ctx.getTraceId(),
            candidates.size(), selected.size());
        if (selected.isEmpty()) {
            return null;
        }

        Map<String, String> segmentIds = new LinkedHashMap<>();
        ScanStats tierStats = new ScanStats();
        for (FileMeta file : selected.values()) {
            tierStats.add(file);
            if (indexFiles != null) {
                segmentIds.put(file.getKey(), BaseEncoding.base64().encode(indexFiles.get(file.getKey()).toByteArray()));
            }
        }
        stats.add(tierStats);
        return new TierTable(Tier.OBJECT_STORAGE, ctx.getStreamName(), new ArrayList<>(selected.keySet()),
            segmentIds, ctx.getFtsFields(), ctx.getIndexCondition(), tierStats.getRecords());
    }
}
