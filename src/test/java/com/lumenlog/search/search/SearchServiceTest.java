package com.lumenlog.search.search;

import com.lumenlog.search.cache.QueryDelta;
import com.lumenlog.search.cache.QueryResultCache;
import com.lumenlog.search.cache.ResponseMerger;
import com.lumenlog.search.cache.ResultCacheIndex;
import com.lumenlog.search.cache.ResultCacheWriter;
import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.config.SearchExecutors;
import com.lumenlog.search.dto.SearchRequest;
import com.lumenlog.search.dto.SearchResponse;
import com.lumenlog.search.dto.TookDetail;
import com.lumenlog.search.exception.SearchException;
import com.lumenlog.search.exception.UpstreamIoException;
import com.lumenlog.search.schema.StreamType;
import com.lumenlog.search.sql.ParsedQuery;
import com.lumenlog.search.sql.SqlAnalyzer;
import com.lumenlog.search.support.FakeSchemaResolver;
import com.lumenlog.search.support.InMemoryByteCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.lumenlog.search.support.FakeSchemaResolver.schema;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SearchService - cache check, concurrent delta search, merge and write-back
 */
public class SearchServiceTest {

    private static final long SECOND = 1_000_000L;
    private static final long NOW = 1_800_000_000L * SECOND;
    private static final long BASE = NOW - 7200 * SECOND;
    private static final String SQL = "SELECT * FROM app";

    private SearchEngineConfig config;
    private InMemoryByteCache byteCache;
    private SearchExecutors executors;
    private RecordingExecutor deltaExecutor;
    private SearchService service;

    /**
     * Serves hits from a fixed set of timestamps and records every window it was asked for
     */
    private static class RecordingExecutor implements DeltaSearchExecutor {
        final List<QueryDelta> deltas = Collections.synchronizedList(new ArrayList<>());
        final List<Long> timestamps = new ArrayList<>();
        RuntimeException failure;
        boolean partial;

        @Override
        public SearchResponse execute(String traceId, ParsedQuery query, QueryDelta delta) {
            deltas.add(delta);
            if (failure != null) {
                throw failure;
            }
            List<Map<String, Object>> hits = new ArrayList<>();
            for (long ts : timestamps) {
                if (ts >= delta.getStart() && ts < delta.getEnd()) {
                    Map<String, Object> hit = new HashMap<>();
                    hit.put("_timestamp", ts);
                    hit.put("message", "event at " + ts);
                    hits.add(hit);
                }
            }
            hits.sort((a, b) -> Long.compare((Long) b.get("_timestamp"), (Long) a.get("_timestamp")));
            SearchResponse response = new SearchResponse(hits);
            response.setTotal(hits.size());
            response.setScanRecords(10);
            response.setTookDetail(new TookDetail());
            response.setPartial(partial);
            return response;
        }
    }

    @BeforeEach
    public void setUp() {
        config = new SearchEngineConfig();
        FakeSchemaResolver resolver = new FakeSchemaResolver();
        resolver.addStream("app", schema("_timestamp", "service", "message"));
        ResultCacheIndex index = new ResultCacheIndex(16, 1000, 10, 10);
        byteCache = new InMemoryByteCache();
        executors = new SearchExecutors(config);
        executors.start();
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW / SECOND), ZoneOffset.UTC);
        deltaExecutor = new RecordingExecutor();
        deltaExecutor.timestamps.add(BASE + 100 * SECOND);
        deltaExecutor.timestamps.add(BASE + 200 * SECOND);
        deltaExecutor.timestamps.add(BASE + 300 * SECOND);
        deltaExecutor.timestamps.add(BASE + 600 * SECOND);
        service = new SearchService(new SqlAnalyzer(config, resolver),
            new QueryResultCache(config, index, byteCache), new ResponseMerger(),
            new ResultCacheWriter(config, index, byteCache, executors, clock), deltaExecutor, executors);
    }

    @AfterEach
    public void tearDown() {
        executors.stop();
    }

    private SearchResponse search(SearchRequest request) {
        return service.search("trace-1", "default", StreamType.LOGS, request);
    }

    private static List<Long> timestamps(SearchResponse response) {
        List<Long> result = new ArrayList<>();
        for (Map<String, Object> hit : response.getHits()) {
            result.add(((Number) hit.get("_timestamp")).longValue());
        }
        return result;
    }

    private void awaitCachedPayload() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (byteCache.size() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(byteCache.size() > 0, "merged result should have been written back");
    }

    @Test
    public void testMissSearchesWholeRangeAndWritesBack() throws InterruptedException {
        SearchResponse response = search(new SearchRequest(SQL, BASE, BASE + 3600 * SECOND));

        assertEquals(1, deltaExecutor.deltas.size());
        assertEquals(BASE, deltaExecutor.deltas.get(0).getStart());
        assertEquals(BASE + 3600 * SECOND, deltaExecutor.deltas.get(0).getEnd());
        assertEquals(4, response.getHits().size());
        assertEquals(BASE + 600 * SECOND, timestamps(response).get(0).longValue());
        assertEquals("_timestamp", response.getOrderBy().get(0).getField());
        assertTrue(response.getOrderBy().get(0).isDescending());
        assertNotNull(response.getTookDetail());
        assertEquals(response.getTook(), response.getTookDetail().getTotal());
        assertNull(response.getFunctionError());

        awaitCachedPayload();
    }

    @Test
    public void testSecondSearchOnlyAsksForUncachedWindows() throws InterruptedException {
        SearchRequest request = new SearchRequest(SQL, BASE, BASE + 3600 * SECOND);
        SearchResponse first = search(request);
        awaitCachedPayload();
        deltaExecutor.deltas.clear();

        SearchResponse second = search(request);

        assertFalse(deltaExecutor.deltas.isEmpty());
        for (QueryDelta delta : deltaExecutor.deltas) {
            assertFalse(delta.getStart() <= BASE + 300 * SECOND && delta.getEnd() > BASE + 300 * SECOND,
                "cached window should not be searched again: " + delta);
        }
        assertEquals(timestamps(first), timestamps(second));
        assertTrue(second.getResultCacheRatio() > 0);
    }

    @Test
    public void testCacheBypassSearchesWholeRange() {
        SearchRequest request = new SearchRequest(SQL, BASE, BASE + 3600 * SECOND);
        request.setUseCache(false);

        SearchResponse response = search(request);

        assertEquals(1, deltaExecutor.deltas.size());
        assertEquals(4, response.getHits().size());
        assertEquals(0, response.getResultCacheRatio(), 0.0);
    }

    @Test
    public void testSearchFailureFailsRequest() {
        deltaExecutor.failure = new UpstreamIoException("querier unreachable");

        UpstreamIoException e = assertThrows(UpstreamIoException.class,
            () -> search(new SearchRequest(SQL, BASE, BASE + 3600 * SECOND)));
        assertEquals("querier unreachable", e.getMessage());
    }

    @Test
    public void testUnexpectedFailureIsWrapped() {
        deltaExecutor.failure = new IllegalStateException("boom");

        SearchException e = assertThrows(SearchException.class,
            () -> search(new SearchRequest(SQL, BASE, BASE + 3600 * SECOND)));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    public void testPartialResponseIsAnnotated() throws InterruptedException {
        deltaExecutor.partial = true;

        SearchResponse response = search(new SearchRequest(SQL, BASE, BASE + 3600 * SECOND));

        assertTrue(response.isPartial());
        assertEquals(SearchService.PARTIAL_DATA_WARNING, response.getFunctionError());
        Thread.sleep(100);
        assertEquals(0, byteCache.size(), "partial results are never cached");
    }

    @Test
    public void testEmptyResultIsNotWrittenBack() throws InterruptedException {
        deltaExecutor.timestamps.clear();

        SearchResponse response = search(new SearchRequest(SQL, BASE, BASE + 3600 * SECOND));

        assertTrue(response.getHits().isEmpty());
        assertTrue(response.getOrderBy().get(0).isDescending());
        Thread.sleep(100);
        assertEquals(0, byteCache.size());
    }
}
