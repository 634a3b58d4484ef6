package com.lumenlog.search.cache.metrics;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lumenlog.search.cache.CacheKeys;
import com.lumenlog.search.cache.CachePayloads;
import com.lumenlog.search.cache.ResultCacheIndex;
import com.lumenlog.search.cache.ResultCacheIndexEntry;
import com.lumenlog.search.cache.TieredByteCache;
import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.config.SearchExecutors;
import com.lumenlog.search.exception.SearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Range-query result cache for metrics.
 *
 * Only data older than the maximum file retention age is cached; fresher samples may still
 * change as ingestion catches up.
 */
@Component
public class MetricsResultCache {

    private static final Logger log = LoggerFactory.getLogger(MetricsResultCache.class);

    private static final TypeReference<List<RangeValue>> SERIES_TYPE = new TypeReference<List<RangeValue>>() {
    };

    private final SearchEngineConfig config;
    private final ResultCacheIndex index;
    private final TieredByteCache byteCache;
    private final SearchExecutors executors;
    private final Clock clock;

    @Autowired
    public MetricsResultCache(SearchEngineConfig config, ResultCacheIndex index, TieredByteCache byteCache,
                              SearchExecutors executors, Clock clock) {
        this.config = config;
        this.index = index;
        this.byteCache = byteCache;
        this.executors = executors;
        this.clock = clock;
    }

    /**
     * Cached head of [start, end] for a query, or empty on a miss
     */
    public Optional<MetricsCacheHit> get(String traceId, String query, long start, long end, long step) {
        if (!config.getMetricsCache().isEnabled()) {
            return Optional.empty();
        }
        String indexKey = indexKey(CacheKeys.hash(query), step);
        if (index.isConflict(indexKey, query)) {
            log.warn("[trace_id {}] metrics cache key {} is held by another query", traceId, indexKey);
            return Optional.empty();
        }
        Optional<ResultCacheIndexEntry> best = index.best(indexKey, start, end);
        if (!best.isPresent()) {
            return Optional.empty();
        }
        ResultCacheIndexEntry entry = best.get();

        Optional<byte[]> bytes;
        try {
            bytes = byteCache.get(traceId, entry.getKey());
        } catch (SearchException e) {
            log.warn("[trace_id {}] failed to read metrics cache {}: {}", traceId, entry.getKey(), e.getMessage());
            return Optional.empty();
        }
        Optional<List<RangeValue>> cached = bytes.flatMap(b -> CachePayloads.read(b, SERIES_TYPE));
        if (!cached.isPresent()) {
            log.warn("[trace_id {}] metrics cache {} is gone, removing index entry", traceId, entry.getKey());
            index.remove(indexKey, entry);
            return Optional.empty();
        }

        List<RangeValue> series = new ArrayList<>();
        long resumeFrom = start;
        for (RangeValue value : cached.get()) {
            RangeValue truncated = value.truncatedAfter(end);
            if (truncated.getSamples().isEmpty()) {
                continue;
            }
            series.add(truncated);
            resumeFrom = Math.max(resumeFrom, truncated.lastTimestamp());
        }
        if (resumeFrom > start) {
            resumeFrom += step;
        }
        log.debug("[trace_id {}] metrics cache hit {}, resuming from {}", traceId, entry, resumeFrom);
        return Optional.of(new MetricsCacheHit(series, resumeFrom));
    }

    /**
     * Store the settled part of a range result. Returns true when a new window was registered.
     */
    public boolean set(String traceId, String query, long start, long end, long step, List<RangeValue> series) {
        if (!config.getMetricsCache().isEnabled() || series == null || series.isEmpty()) {
            return false;
        }
        long now = ChronoUnit.MICROS.between(Instant.EPOCH, clock.instant());
        long maxTs = now - config.getMetricsCache().getMaxFileRetention().toNanos() / 1000L;
        if (start >= maxTs) {
            return false;
        }
        long newEnd = Math.min(end, maxTs);
        if (newEnd <= start + step) {
            return false;
        }

        String hash = CacheKeys.hash(query);
        String indexKey = indexKey(hash, step);
        if (index.isConflict(indexKey, query)) {
            log.warn("[trace_id {}] metrics cache hash conflict on {}, skipping store", traceId, indexKey);
            return false;
        }
        if (index.covers(indexKey, start, newEnd)) {
            return false;
        }

        List<RangeValue> trimmed = new ArrayList<>();
        for (RangeValue value : series) {
            RangeValue truncated = value.truncatedAfter(newEnd);
            if (!truncated.getSamples().isEmpty()) {
                trimmed.add(truncated);
            }
        }
        if (trimmed.isEmpty()) {
            return false;
        }

        String key = CacheKeys.metricsCacheKey(hash, start, newEnd, step);
        try {
            byteCache.set(traceId, key, CachePayloads.write(trimmed));
        } catch (SearchException e) {
            log.error("[trace_id {}] failed to write metrics cache {}: {}", traceId, key, e.getMessage(), e);
            return false;
        }
        ResultCacheIndex.RegisterOutcome outcome =
            index.register(indexKey, query, new ResultCacheIndexEntry(key, start, newEnd));
        log.debug("[trace_id {}] metrics cache store {} -> {}", traceId, key, outcome);
        return outcome == ResultCacheIndex.RegisterOutcome.REGISTERED;
    }

    public CompletableFuture<Boolean> setAsync(String traceId, String query, long start, long end, long step,
                                               List<RangeValue> series) {
        return CompletableFuture.supplyAsync(() -> set(traceId, query, start, end, step, series),
            executors.cacheWriterExecutor()).exceptionally(e -> {
                log.error("[trace_id {}] metrics cache store failed: {}", traceId, e.getMessage(), e);
                return false;
            });
    }

    /**
     * Re-register a window from its storage key alone
     */
    public boolean load(String key) {
        Optional<CacheKeys.MetricsKey> parsed = CacheKeys.parseMetricsKey(key);
        if (!parsed.isPresent()) {
            log.warn("Ignoring foreign metrics cache key {}", key);
            return false;
        }
        CacheKeys.MetricsKey metricsKey = parsed.get();
        ResultCacheIndex.RegisterOutcome outcome = index.register(
            indexKey(metricsKey.getQueryHash(), metricsKey.getStep()), null,
            new ResultCacheIndexEntry(key, metricsKey.getStart(), metricsKey.getEnd()));
        return outcome == ResultCacheIndex.RegisterOutcome.REGISTERED;
    }

    /**
     * Windows of one query at one step; a series cached at another step never answers this one
     */
    private static String indexKey(String queryHash, long step) {
        return CacheKeys.METRICS_PREFIX + "/" + queryHash + "_" + step;
    }
}
