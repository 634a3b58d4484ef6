package com.lumenlog.search.cache;

import com.lumenlog.search.config.SearchEngineConfig;
import com.lumenlog.search.config.SearchExecutors;
import com.lumenlog.search.dto.SearchResponse;
import com.lumenlog.search.support.InMemoryByteCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for result cache write-back: what gets stored, and for which window
 */
public class ResultCacheWriterTest {

    private static final long SECOND = 1_000_000L;
    private static final long NOW = 1_800_000_000L * SECOND;

    private SearchEngineConfig config;
    private ResultCacheIndex index;
    private InMemoryByteCache byteCache;
    private SearchExecutors executors;
    private ResultCacheWriter writer;

    @BeforeEach
    public void setUp() {
        config = new SearchEngineConfig();
        index = new ResultCacheIndex(16, 1000, 10, 10);
        byteCache = new InMemoryByteCache();
        executors = new SearchExecutors(config);
        executors.start();
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW / SECOND), ZoneOffset.UTC);
        writer = new ResultCacheWriter(config, index, byteCache, executors, clock);
    }

    @AfterEach
    public void tearDown() {
        executors.stop();
    }

    private static MultiCachedQueryResponse plan(boolean descending) {
        MultiCachedQueryResponse plan = new MultiCachedQueryResponse();
        plan.setTsColumn("_timestamp");
        plan.setDescending(descending);
        plan.setCacheQueryResponse(true);
        plan.setCachePath("default/logs/app/123");
        plan.setQueryText("select * from app");
        return plan;
    }

    private static SearchResponse response(long... timestamps) {
        List<Map<String, Object>> hits = new ArrayList<>();
        for (long ts : timestamps) {
            Map<String, Object> hit = new HashMap<>();
            hit.put("_timestamp", ts);
            hits.add(hit);
        }
        return new SearchResponse(hits);
    }

    @Test
    public void testBoundarySecondIsDropped() {
        long base = NOW - 7200 * SECOND;
        // descending: last row is the oldest; two rows share its second
        SearchResponse merged = response(base + 600 * SECOND, base + 300 * SECOND,
            base + 100 * SECOND + 5, base + 100 * SECOND);

        Optional<ResultCacheWriter.PendingWrite> pending =
            writer.prepare("t", plan(true), merged, base, base + 3600 * SECOND);

        assertTrue(pending.isPresent());
        assertEquals(2, pending.get().response.getHits().size());
        assertEquals(base + 300 * SECOND, pending.get().entry.getStart());
        assertEquals(base + 600 * SECOND + 1, pending.get().entry.getEnd());
    }

    @Test
    public void testAscendingDropsNewestSecond() {
        long base = NOW - 7200 * SECOND;
        SearchResponse merged = response(base + 100 * SECOND, base + 300 * SECOND, base + 600 * SECOND);

        ResultCacheWriter.PendingWrite pending =
            writer.prepare("t", plan(false), merged, base, base + 3600 * SECOND).get();

        assertEquals(base + 100 * SECOND, pending.entry.getStart());
        assertEquals(base + 300 * SECOND + 1, pending.entry.getEnd());
        assertTrue(pending.entry.getKey().startsWith("default/logs/app/123/"));
        assertTrue(pending.entry.getKey().endsWith("_false_false.json"));
    }

    @Test
    public void testWindowIsClampedToRequest() {
        long base = NOW - 7200 * SECOND;
        SearchResponse merged = response(base + 900 * SECOND, base + 100 * SECOND, base + 50 * SECOND);

        ResultCacheWriter.PendingWrite pending =
            writer.prepare("t", plan(true), merged, base + 200 * SECOND, base + 400 * SECOND).get();

        assertEquals(base + 200 * SECOND, pending.entry.getStart());
        assertEquals(base + 400 * SECOND, pending.entry.getEnd());
    }

    @Test
    public void testPartialResponseIsNotStored() {
        long base = NOW - 7200 * SECOND;
        SearchResponse merged = response(base + 600 * SECOND, base + 300 * SECOND, base + 100 * SECOND);
        merged.setPartial(true);

        assertFalse(writer.prepare("t", plan(true), merged, base, base + 3600 * SECOND).isPresent());
        assertFalse(writer.writeBack("t", plan(true), merged, base, base + 3600 * SECOND).join());
        assertEquals(0, byteCache.size());
    }

    @Test
    public void testFunctionErrorResponseIsNotStored() {
        long base = NOW - 7200 * SECOND;
        SearchResponse merged = response(base + 600 * SECOND, base + 300 * SECOND, base + 100 * SECOND);
        merged.setFunctionError("VRL runtime error: division by zero");

        assertFalse(writer.prepare("t", plan(true), merged, base, base + 3600 * SECOND).isPresent());
    }

    @Test
    public void testShortRecentWindowIsNotStored() {
        SearchResponse merged = response(NOW - 10 * SECOND, NOW - 20 * SECOND, NOW - 30 * SECOND);

        assertFalse(writer.prepare("t", plan(true), merged, NOW - 3600 * SECOND, NOW).isPresent());
    }

    @Test
    public void testNotStoredWhenCheckDeclined() {
        long base = NOW - 7200 * SECOND;
        MultiCachedQueryResponse plan = plan(true);
        plan.setCacheQueryResponse(false);

        assertFalse(writer.prepare("t", plan, response(base + 600 * SECOND, base + 100 * SECOND),
            base, base + 3600 * SECOND).isPresent());
    }

    @Test
    public void testWriteBackStoresPayloadAndRegistersWindow() {
        long base = NOW - 7200 * SECOND;
        SearchResponse merged = response(base + 600 * SECOND, base + 300 * SECOND, base + 100 * SECOND);

        assertTrue(writer.writeBack("t", plan(true), merged, base, base + 3600 * SECOND).join());

        List<ResultCacheIndexEntry> entries = index.entries("default/logs/app/123");
        assertEquals(1, entries.size());
        assertTrue(byteCache.contains(entries.get(0).getKey()));
    }
}
