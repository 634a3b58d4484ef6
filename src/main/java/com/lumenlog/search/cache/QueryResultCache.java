package com.lumenlog.search.cache;

import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.dto.SearchRequest;
import com.lumenlog.search.dto.SearchResponse;
import com.lumenlog.search.exception.UpstreamIoException;
import com.lumenlog.search.sql.OrderBy;
import com.lumenlog.search.sql.ParsedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Looks up cached search results for a query and works out the ranges still to be searched
 */
@Component
public class QueryResultCache {

    private static final Logger log = LoggerFactory.getLogger(QueryResultCache.class);

    private final SearchEngineConfig config;
    private final ResultCacheIndex index;
    private final TieredByteCache byteCache;

    @Autowired
    public QueryResultCache(SearchEngineConfig config, ResultCacheIndex index, TieredByteCache byteCache) {
        this.config = config;
        this.index = index;
        this.byteCache = byteCache;
    }

    public MultiCachedQueryResponse check(String traceId, ParsedQuery parsed, SearchRequest request) {
        long start = request.getStartTime();
        long end = request.getEndTime();

        MultiCachedQueryResponse result = new MultiCachedQueryResponse();
        result.setLimit(parsed.getLimit());
        result.setHistogramInterval(parsed.getHistogramInterval());
        result.setAggregate(parsed.isAggregate());
        result.setDescending(!parsed.getOrderBy().isEmpty() && parsed.getOrderBy().get(0).isDescending());
        result.setDeltas(fullRange(start, end));

        Optional<String> skip = skipReason(parsed, request);
        if (skip.isPresent()) {
            log.debug("[trace_id {}] result cache skipped: {}", traceId, skip.get());
            return result;
        }

        String tsColumn = parsed.getResultTimestampColumn().get();
        String queryText = CacheKeys.queryText(request.getSql(), request.getQueryFn(),
            request.getRegions(), request.getClusters());
        String path = CacheKeys.searchCachePath(parsed.getOrg(), parsed.getStreamType(), parsed.getPrimaryStream(),
            CacheKeys.hash(queryText), parsed.getHistogramInterval(), tsColumn);
        result.setTsColumn(tsColumn);
        result.setCachePath(path);
        result.setQueryText(queryText);

        if (index.isConflict(path, queryText)) {
            log.warn("[trace_id {}] result cache key {} is held by another query, treating as miss", traceId, path);
            return result;
        }
        result.setCacheQueryResponse(true);

        List<CachedQueryResponse> cached = new ArrayList<>();
        for (ResultCacheIndexEntry entry : selectEntries(index.entries(path), start, end)) {
            load(traceId, path, entry).ifPresent(response -> {
                response.getHits().removeIf(hit -> !Hits.inWindow(hit, tsColumn, start, end));
                cached.add(new CachedQueryResponse(entry, response));
            });
        }
        if (cached.isEmpty()) {
            return result;
        }

        List<ResultCacheIndexEntry> windows = new ArrayList<>();
        for (CachedQueryResponse response : cached) {
            windows.add(response.getEntry());
        }
        result.setCachedResponses(cached);
        result.setHasCachedData(true);
        result.setDeltas(calculateDeltas(windows, start, end));
        log.info("[trace_id {}] result cache hit for {}: {} cached windows, deltas {}",
            traceId, path, cached.size(), result.getDeltas());
        return result;
    }

    private Optional<String> skipReason(ParsedQuery parsed, SearchRequest request) {
        if (!config.getResultCache().isEnabled() || !request.isUseCache()) {
            return Optional.of("disabled");
        }
        if (parsed.isTrackTotalHits()) {
            return Optional.of("total hits query");
        }
        if (parsed.getStreamNames().size() != 1) {
            return Optional.of("multi-stream query");
        }
        if (!parsed.getResultTimestampColumn().isPresent()) {
            return Optional.of("no timestamp column in results");
        }
        List<OrderBy> orderBy = parsed.getOrderBy();
        if (!orderBy.isEmpty() && !orderBy.get(0).getField().equals(parsed.getResultTimestampColumn().get())) {
            return Optional.of("results not ordered by time");
        }
        if (request.getEndTime() <= request.getStartTime()) {
            return Optional.of("empty time range");
        }
        return Optional.empty();
    }

    /**
     * Load a cached payload. A missing or corrupt payload removes the stale entry;
     * a storage failure only counts as a miss.
     */
    private Optional<SearchResponse> load(String traceId, String path, ResultCacheIndexEntry entry) {
        Optional<byte[]> bytes;
        try {
            bytes = byteCache.get(traceId, entry.getKey());
        } catch (UpstreamIoException e) {
            log.warn("[trace_id {}] failed to read cached result {}: {}", traceId, entry.getKey(), e.getMessage());
            return Optional.empty();
        }
        Optional<SearchResponse> response = bytes.flatMap(b -> CachePayloads.read(b, SearchResponse.class));
        if (!response.isPresent()) {
            log.warn("[trace_id {}] cached result {} is gone, removing index entry", traceId, entry.getKey());
            index.remove(path, entry);
        }
        return response;
    }

    /**
     * The entry overlapping the request the most, then every other overlapping entry that
     * does not overlap one already chosen. Ordered by start.
     */
    public static List<ResultCacheIndexEntry> selectEntries(List<ResultCacheIndexEntry> entries, long start, long end) {
        List<ResultCacheIndexEntry> candidates = new ArrayList<>();
        for (ResultCacheIndexEntry entry : entries) {
            if (entry.overlaps(start, end)) {
                candidates.add(entry);
            }
        }
        candidates.sort(Comparator.comparingLong((ResultCacheIndexEntry e) -> e.overlap(start, end)).reversed());

        List<ResultCacheIndexEntry> chosen = new ArrayList<>();
        for (ResultCacheIndexEntry candidate : candidates) {
            boolean disjoint = true;
            for (ResultCacheIndexEntry picked : chosen) {
                if (picked.overlaps(candidate.getStart(), candidate.getEnd())) {
                    disjoint = false;
                    break;
                }
            }
            if (disjoint) {
                chosen.add(candidate);
            }
        }
        chosen.sort(Comparator.comparingLong(ResultCacheIndexEntry::getStart));
        return chosen;
    }

    /**
     * Uncovered parts of [start, end) given disjoint cached windows, followed by removed-hits
     * deltas for the parts of those windows outside the request
     */
    public static List<QueryDelta> calculateDeltas(List<ResultCacheIndexEntry> windows, long start, long end) {
        List<ResultCacheIndexEntry> sorted = new ArrayList<>(windows);
        sorted.sort(Comparator.comparingLong(ResultCacheIndexEntry::getStart));

        List<QueryDelta> deltas = new ArrayList<>();
        long cursor = start;
        for (ResultCacheIndexEntry window : sorted) {
            if (window.getStart() > cursor && cursor < end) {
                deltas.add(new QueryDelta(cursor, Math.min(window.getStart(), end), false));
            }
            cursor = Math.max(cursor, window.getEnd());
        }
        if (cursor < end) {
            deltas.add(new QueryDelta(cursor, end, false));
        }
        for (ResultCacheIndexEntry window : sorted) {
            if (window.getStart() < start) {
                deltas.add(new QueryDelta(window.getStart(), start, true));
            }
            if (window.getEnd() > end) {
                deltas.add(new QueryDelta(end, window.getEnd(), true));
            }
        }
        return deltas;
    }

    private static List<QueryDelta> fullRange(long start, long end) {
        List<QueryDelta> deltas = new ArrayList<>();
        deltas.add(new QueryDelta(start, end, false));
        return deltas;
    }
}
