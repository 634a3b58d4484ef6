package com.lumenlog.search.cache;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the bucketed result cache index
 */
public class ResultCacheIndexTest {

    private static ResultCacheIndexEntry entry(long start, long end) {
        return new ResultCacheIndexEntry("k/" + start + "_" + end + ".json", start, end);
    }

    @Test
    public void testRegisterAndLookup() {
        ResultCacheIndex index = new ResultCacheIndex(4, 1000, 10, 10);

        assertEquals(ResultCacheIndex.RegisterOutcome.REGISTERED, index.register("path", "q", entry(0, 100)));
        assertEquals(ResultCacheIndex.RegisterOutcome.REGISTERED, index.register("path", "q", entry(200, 300)));

        List<ResultCacheIndexEntry> entries = index.entries("path");
        assertEquals(2, entries.size());
        assertEquals(0, entries.get(0).getStart());
        assertTrue(index.covers("path", 10, 90));
        assertFalse(index.covers("path", 50, 250));
        assertTrue(index.entries("other").isEmpty());
    }

    @Test
    public void testCoveredWindowIsNotDuplicated() {
        ResultCacheIndex index = new ResultCacheIndex(4, 1000, 10, 10);
        index.register("path", "q", entry(0, 100));

        assertEquals(ResultCacheIndex.RegisterOutcome.ALREADY_COVERED, index.register("path", "q", entry(0, 100)));
        assertEquals(ResultCacheIndex.RegisterOutcome.ALREADY_COVERED, index.register("path", "q", entry(10, 50)));
        assertEquals(1, index.entries("path").size());
    }

    @Test
    public void testDifferentQueryTextIsConflict() {
        ResultCacheIndex index = new ResultCacheIndex(4, 1000, 10, 10);
        index.register("path", "select a", entry(0, 100));

        assertTrue(index.isConflict("path", "select b"));
        assertFalse(index.isConflict("path", "select a"));
        assertFalse(index.isConflict("path", null));
        assertEquals(ResultCacheIndex.RegisterOutcome.CONFLICT, index.register("path", "select b", entry(200, 300)));
        assertEquals(1, index.entries("path").size());
    }

    @Test
    public void testEntriesPerKeyAreHalvedWhenFull() {
        ResultCacheIndex index = new ResultCacheIndex(1, 1000, 10, 4);
        for (int i = 0; i < 4; i++) {
            index.register("path", "q", entry(i * 100, i * 100 + 50));
        }
        index.register("path", "q", entry(1000, 1050));

        List<ResultCacheIndexEntry> entries = index.entries("path");
        assertEquals(3, entries.size());
        assertEquals(200, entries.get(0).getStart(), "oldest half is dropped");
        assertEquals(1000, entries.get(2).getStart());
    }

    @Test
    public void testGcEvictsOldestKeys() {
        // one bucket, 20 keys max, gc once 15 keys are held
        ResultCacheIndex index = new ResultCacheIndex(1, 20, 5, 10);
        for (int i = 0; i < 15; i++) {
            index.register("key-" + i, "q" + i, entry(0, 10));
        }
        assertEquals(15, index.keyCount());

        index.register("key-new", "new", entry(0, 10));

        assertEquals(15, index.keyCount());
        assertTrue(index.entries("key-0").isEmpty(), "oldest key is evicted");
        assertFalse(index.entries("key-1").isEmpty());
        assertFalse(index.entries("key-new").isEmpty());
    }

    @Test
    public void testRemoveDropsEmptyKey() {
        ResultCacheIndex index = new ResultCacheIndex(4, 1000, 10, 10);
        ResultCacheIndexEntry e = entry(0, 100);
        index.register("path", "q", e);

        assertTrue(index.remove("path", e));
        assertFalse(index.remove("path", e));
        assertEquals(0, index.keyCount());
    }

    @Test
    public void testBestEntry() {
        ResultCacheIndex index = new ResultCacheIndex(4, 1000, 10, 10);
        index.register("m", null, entry(0, 100));
        index.register("m", null, entry(0, 500));
        index.register("m", null, entry(50, 1000));

        assertEquals(500, index.best("m", 10, 1000).get().getEnd());
        assertFalse(index.best("m", 2000, 3000).isPresent());
    }

    @Test
    public void testConcurrentRegistration() throws Exception {
        ResultCacheIndex index = new ResultCacheIndex(8, 100000, 10, 1000);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(800);
        for (int i = 0; i < 800; i++) {
            final int n = i;
            pool.submit(() -> {
                try {
                    index.register("key-" + (n % 40), "q" + (n % 40), entry(n * 10L, n * 10L + 5));
                } finally {
                    done.countDown();
                }
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertEquals(40, index.keyCount());
        int total = 0;
        for (int k = 0; k < 40; k++) {
            total += index.entries("key-" + k).size();
        }
        assertEquals(800, total);
    }
}
