package com.lumenlog.search.cache;

import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.config.SearchExecutors;
import com.lumenlog.search.dto.SearchResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Persists merged search responses into the result cache in the background
 */
@Component
public class ResultCacheWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultCacheWriter.class);

    private final SearchEngineConfig config;
    private final ResultCacheIndex index;
    private final TieredByteCache byteCache;
    private final SearchExecutors executors;
    private final Clock clock;

    @Autowired
    public ResultCacheWriter(SearchEngineConfig config, ResultCacheIndex index, TieredByteCache byteCache,
                             SearchExecutors executors, Clock clock) {
        this.config = config;
        this.index = index;
        this.byteCache = byteCache;
        this.executors = executors;
        this.clock = clock;
    }

    /**
     * Store the merged response for the window its hits actually cover.
     * Completes with true once the payload is stored and its window registered; failures
     * are logged and complete with false.
     */
    public CompletableFuture<Boolean> writeBack(String traceId, MultiCachedQueryResponse plan,
                                                SearchResponse merged, long reqStart, long reqEnd) {
        Optional<PendingWrite> pending = prepare(traceId, plan, merged, reqStart, reqEnd);
        if (!pending.isPresent()) {
            return CompletableFuture.completedFuture(false);
        }
        PendingWrite write = pending.get();
        return CompletableFuture.supplyAsync(() -> {
            byteCache.set(traceId, write.entry.getKey(), CachePayloads.write(write.response));
            ResultCacheIndex.RegisterOutcome outcome = index.register(plan.getCachePath(), plan.getQueryText(), write.entry);
            log.info("[trace_id {}] cached search result {} ({})", traceId, write.entry, outcome);
            return outcome == ResultCacheIndex.RegisterOutcome.REGISTERED;
        }, executors.cacheWriterExecutor()).exceptionally(e -> {
            log.error("[trace_id {}] failed to write search result cache {}: {}", traceId, write.entry.getKey(), e.getMessage(), e);
            return false;
        });
    }

    Optional<PendingWrite> prepare(String traceId, MultiCachedQueryResponse plan,
                                   SearchResponse merged, long reqStart, long reqEnd) {
        if (!config.getResultCache().isEnabled() || !plan.isCacheQueryResponse() || plan.getTsColumn() == null) {
            return Optional.empty();
        }
        if (merged.isPartial()) {
            log.debug("[trace_id {}] partial response is not cached", traceId);
            return Optional.empty();
        }
        if (merged.getFunctionError() != null && merged.getFunctionError().toLowerCase(Locale.ROOT).contains("vrl")) {
            log.debug("[trace_id {}] response with function error is not cached", traceId);
            return Optional.empty();
        }
        String tsColumn = plan.getTsColumn();
        List<Map<String, Object>> hits = new ArrayList<>(merged.getHits());
        if (hits.isEmpty()) {
            return Optional.empty();
        }

        // the second holding the last row may have been cut by the limit
        Long boundary = Hits.timestamp(hits.get(hits.size() - 1), tsColumn);
        if (boundary != null) {
            long boundarySecond = boundary / 1_000_000L;
            hits.removeIf(hit -> {
                Long ts = Hits.timestamp(hit, tsColumn);
                return ts != null && ts / 1_000_000L == boundarySecond;
            });
        }
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (Map<String, Object> hit : hits) {
            Long ts = Hits.timestamp(hit, tsColumn);
            if (ts != null) {
                min = Math.min(min, ts);
                max = Math.max(max, ts);
            }
        }
        if (min > max) {
            return Optional.empty();
        }

        long discard = config.getResultCache().getDiscardDuration().toNanos() / 1000L;
        long now = ChronoUnit.MICROS.between(Instant.EPOCH, clock.instant());
        if (max - min < discard && min > now - discard) {
            log.debug("[trace_id {}] result window too short and too recent to cache", traceId);
            return Optional.empty();
        }

        long cacheStart = Math.max(min, reqStart);
        long cacheEnd = Math.min(max + 1, reqEnd);
        if (cacheEnd <= cacheStart) {
            return Optional.empty();
        }

        SearchResponse toStore = new SearchResponse(hits);
        toStore.setScanSize(merged.getScanSize());
        toStore.setScanRecords(merged.getScanRecords());
        toStore.setTook(merged.getTook());
        toStore.setTookDetail(merged.getTookDetail());
        toStore.setOrderBy(merged.getOrderBy());
        toStore.setHistogramInterval(merged.getHistogramInterval());
        toStore.setFunctionError(merged.getFunctionError());

        String key = CacheKeys.searchCacheKey(plan.getCachePath(), cacheStart, cacheEnd,
            plan.isAggregate(), plan.isDescending());
        return Optional.of(new PendingWrite(new ResultCacheIndexEntry(key, cacheStart, cacheEnd), toStore));
    }

    static class PendingWrite {
        final ResultCacheIndexEntry entry;
        final SearchResponse response;

        PendingWrite(ResultCacheIndexEntry entry, SearchResponse response) {
            this.entry = entry;
            this.response = response;
        }
    }
}
