package com.lumenlog.search.search;

import com.google.common.base.Stopwatch;
import com.lumenlog.search.cache.MultiCachedQueryResponse;
import com.lumenlog.search.cache.QueryDelta;
import com.lumenlog.search.cache.QueryResultCache;
import com.lumenlog.search.cache.ResponseMerger;
import com.lumenlog.search.cache.ResultCacheWriter;
import com.lumenlog.search.config.SearchExecutors;
import com.lumenlog.search.dto.SearchRequest;
import com.lumenlog.search.dto.SearchResponse;
import com.lumenlog.search.exception.SearchException;
import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.ParsedQuery;
import com.lumenlog.search.sql.SqlAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of a search: analyze, consult the result cache, search the uncached windows
 * concurrently, merge, and store the merged result in the background.
 *
 * A failing window fails the whole search.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    static final String PARTIAL_DATA_WARNING = "Please be aware that the response is based on partial data";

    private final SqlAnalyzer analyzer;
    private final QueryResultCache resultCache;
    private final ResponseMerger merger;
    private final ResultCacheWriter writer;
    private final DeltaSearchExecutor deltaExecutor;
    private final SearchExecutors executors;

    @Autowired
    public SearchService(SqlAnalyzer analyzer, QueryResultCache resultCache, ResponseMerger merger,
                         ResultCacheWriter writer, DeltaSearchExecutor deltaExecutor, SearchExecutors executors) {
        this.analyzer = analyzer;
        this.resultCache = resultCache;
        this.merger = merger;
        this.writer = writer;
        this.deltaExecutor = deltaExecutor;
        this.executors = executors;
    }

    public SearchResponse search(String traceId, String org, StreamType streamType, SearchRequest request) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        ParsedQuery query = analyzer.analyze(org, streamType, request);

        Stopwatch cacheWatch = Stopwatch.createStarted();
        MultiCachedQueryResponse plan = resultCache.check(traceId, query, request);
        long cacheTook = cacheWatch.elapsed(TimeUnit.MILLISECONDS);

        List<QueryDelta> deltas = plan.searchDeltas();
        log.info("[trace_id {}] searching {} uncached windows of {}", traceId, deltas.size(), request.getSql());
        List<SearchResponse> fresh = searchDeltas(traceId, query, deltas);

        SearchResponse merged = merger.merge(plan, fresh);
        if (merged.isPartial()) {
            merged.addFunctionError(PARTIAL_DATA_WARNING);
        }
        if (merged.getOrderBy().isEmpty()) {
            merged.setOrderBy(query.getOrderBy());
        }
        merged.setHistogramInterval(query.getHistogramInterval());
        merged.setTook(stopwatch.elapsed(TimeUnit.MILLISECONDS));
        if (merged.getTookDetail() != null) {
            merged.getTookDetail().setTotal(merged.getTook());
            merged.getTookDetail().setCacheTook(cacheTook);
        }

        boolean freshData = false;
        for (SearchResponse response : fresh) {
            freshData |= response.hasHits();
        }
        if (freshData) {
            writer.writeBack(traceId, plan, merged, request.getStartTime(), request.getEndTime());
        }
        return merged;
    }

    private List<SearchResponse> searchDeltas(String traceId, ParsedQuery query, List<QueryDelta> deltas) {
        List<CompletableFuture<SearchResponse>> futures = new ArrayList<>();
        for (QueryDelta delta : deltas) {
            futures.add(CompletableFuture.supplyAsync(
                () -> deltaExecutor.execute(traceId, query, delta), executors.deltaExecutor()));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[trace_id {}] delta search failed: {}", traceId, cause.getMessage());
            if (cause instanceof SearchException) {
                throw (SearchException) cause;
            }
            throw new SearchException("Delta search failed: " + cause.getMessage(), cause);
        }
        List<SearchResponse> responses = new ArrayList<>();
        for (CompletableFuture<SearchResponse> future : futures) {
            SearchResponse response = future.join();
            if (response != null) {
                responses.add(response);
            }
        }
        return responses;
    }
}
