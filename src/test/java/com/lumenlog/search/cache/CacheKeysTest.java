package com.lumenlog.search.cache;

import com.google.common.io.BaseEncoding;
import com.lumenlog.search.schema.StreamType;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for cache key derivation and storage key naming
 */
public class CacheKeysTest {

    @Test
    public void testQueryTextIgnoresLineBreaksAndOrdering() {
        String a = CacheKeys.queryText("SELECT *\nFROM logs", null, Arrays.asList("us", "eu"), Arrays.asList("c2", "c1"));
        String b = CacheKeys.queryText("SELECT * FROM logs", null, Arrays.asList("eu", "us"), Arrays.asList("c1", "c2"));

        assertEquals(a, b);
        assertEquals("SELECT * FROM logs,eu,us,c1,c2", a);
        assertEquals(CacheKeys.hash(a), CacheKeys.hash(b));
    }

    @Test
    public void testQueryFunctionIsDecoded() {
        String fn = ".level = \"error\"";
        String encoded = BaseEncoding.base64().encode(fn.getBytes(StandardCharsets.UTF_8));

        assertEquals("SELECT 1," + fn, CacheKeys.queryText("SELECT 1", encoded, null, null));
        assertNotEquals(CacheKeys.hash(CacheKeys.queryText("SELECT 1", null, null, null)),
            CacheKeys.hash(CacheKeys.queryText("SELECT 1", encoded, null, null)));
    }

    @Test
    public void testSearchCachePath() {
        assertEquals("default/logs/app/42", CacheKeys.searchCachePath("default", StreamType.LOGS, "app", "42", 0, "_timestamp"));
        assertEquals("default/logs/app/42_60_ts",
            CacheKeys.searchCachePath("default", StreamType.LOGS, "app", "42", 60, "ts"));
    }

    @Test
    public void testSearchCacheKeyRoundTrip() {
        String key = CacheKeys.searchCacheKey("default/logs/app/42", 100, 200, false, true);

        assertEquals("default/logs/app/42/100_200_false_true.json", key);
        long[] window = CacheKeys.parseSearchCacheWindow(key).get();
        assertEquals(100, window[0]);
        assertEquals(200, window[1]);
        assertFalse(CacheKeys.parseSearchCacheWindow("default/logs/app/42/readme.txt").isPresent());
    }

    @Test
    public void testMetricsKey() {
        long start = 1_700_000_000_000_000L;
        String key = CacheKeys.metricsCacheKey("987", start, start + 60_000_000L, 15_000_000L);

        assertEquals("metrics_results/2023/11/14/22/987_" + start + "_" + (start + 60_000_000L) + "_15000000.json", key);
        CacheKeys.MetricsKey parsed = CacheKeys.parseMetricsKey(key).get();
        assertEquals("987", parsed.getQueryHash());
        assertEquals(start, parsed.getStart());
        assertEquals(start + 60_000_000L, parsed.getEnd());
        assertEquals(15_000_000L, parsed.getStep());
        assertFalse(CacheKeys.parseMetricsKey("other/987_1_2_3.json").isPresent());
    }
}
