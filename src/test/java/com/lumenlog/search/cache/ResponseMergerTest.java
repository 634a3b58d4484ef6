package com.lumenlog.search.cache;

import com.lumenlog.search.dto.SearchResponse;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for merging cached and fresh partial responses
 */
public class ResponseMergerTest {

    private final ResponseMerger merger = new ResponseMerger();

    private static SearchResponse response(long... timestamps) {
        List<Map<String, Object>> hits = new ArrayList<>();
        for (long ts : timestamps) {
            Map<String, Object> hit = new HashMap<>();
            hit.put("_timestamp", ts);
            hits.add(hit);
        }
        return new SearchResponse(hits);
    }

    private static MultiCachedQueryResponse plan(int limit, boolean descending) {
        MultiCachedQueryResponse plan = new MultiCachedQueryResponse();
        plan.setTsColumn("_timestamp");
        plan.setDescending(descending);
        plan.setLimit(limit);
        return plan;
    }

    private static List<Long> timestamps(SearchResponse response) {
        List<Long> result = new ArrayList<>();
        for (Map<String, Object> hit : response.getHits()) {
            result.add(((Number) hit.get("_timestamp")).longValue());
        }
        return result;
    }

    @Test
    public void testLimitAppliesAcrossCachedAndFresh() {
        MultiCachedQueryResponse plan = plan(3, true);
        plan.setCachedResponses(Collections.singletonList(
            new CachedQueryResponse(new ResultCacheIndexEntry("k", 100, 300), response(250, 150))));

        SearchResponse merged = merger.merge(plan, Collections.singletonList(response(400, 350)));

        assertEquals(3, merged.getHits().size());
        assertEquals(3, merged.getTotal());
        assertEquals(Arrays.asList(400L, 350L, 250L), timestamps(merged));
        assertEquals(50.0, merged.getResultCacheRatio(), 0.001);
    }

    @Test
    public void testTotalBelowLimit() {
        MultiCachedQueryResponse plan = plan(10, false);
        plan.setCachedResponses(Collections.singletonList(
            new CachedQueryResponse(new ResultCacheIndexEntry("k", 100, 300), response(150))));

        SearchResponse merged = merger.merge(plan, Collections.singletonList(response(50, 400)));

        assertEquals(3, merged.getTotal());
        assertEquals(Arrays.asList(50L, 150L, 400L), timestamps(merged));
    }

    @Test
    public void testFreshOnlySumsTotals() {
        SearchResponse a = response(300, 100);
        SearchResponse b = response(200);
        a.setScanSize(10);
        b.setScanSize(5);

        SearchResponse merged = merger.merge(plan(1, true), Arrays.asList(a, b));

        assertEquals(3, merged.getTotal());
        assertEquals(15, merged.getScanSize());
        assertEquals(Arrays.asList(300L, 200L, 100L), timestamps(merged));
        assertEquals(0.0, merged.getResultCacheRatio(), 0.001);
    }

    @Test
    public void testCachedRatioIsHitWeighted() {
        SearchResponse a = response(1, 2, 3);
        a.setCachedRatio(100);
        SearchResponse b = response(4);
        b.setCachedRatio(0);

        SearchResponse merged = merger.merge(plan(0, true), Arrays.asList(a, b));

        assertEquals(75.0, merged.getCachedRatio(), 0.001);
    }

    @Test
    public void testEmptyPartialStillCarriesFlags() {
        SearchResponse empty = new SearchResponse();
        empty.setPartial(true);
        empty.setFunctionError("node timeout");

        SearchResponse merged = merger.merge(plan(10, true), Arrays.asList(response(5), empty));

        assertTrue(merged.isPartial());
        assertEquals("node timeout", merged.getFunctionError());
        assertEquals(1, merged.getHits().size());
    }

    @Test
    public void testNothingToMerge() {
        SearchResponse merged = merger.merge(plan(10, true), Collections.<SearchResponse>emptyList());

        assertTrue(merged.getHits().isEmpty());
        assertEquals(0, merged.getTotal());
        assertEquals(0.0, merged.getCachedRatio(), 0.001);
    }
}
