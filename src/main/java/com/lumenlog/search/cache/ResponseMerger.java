package com.lumenlog.search.cache;

import com.lumenlog.search.dto.SearchResponse;
import com.lumenlog.search.dto.TookDetail;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Merges cached partial responses with freshly searched ones
 */
@Component
public class ResponseMerger {

    public SearchResponse merge(MultiCachedQueryResponse plan, List<SearchResponse> freshPartials) {
        List<SearchResponse> fresh = nonEmpty(freshPartials);
        List<SearchResponse> cached = new ArrayList<>();
        for (CachedQueryResponse response : plan.getCachedResponses()) {
            if (response.getResponse().hasHits()) {
                cached.add(response.getResponse());
            }
        }

        SearchResponse merged = new SearchResponse();
        merged.setHistogramInterval(plan.getHistogramInterval());
        List<Map<String, Object>> hits = new ArrayList<>();
        long freshHits = 0;
        long cacheHits = 0;
        double weightedCachedRatio = 0;

        List<SearchResponse> all = new ArrayList<>(cached);
        all.addAll(fresh);
        for (SearchResponse partial : all) {
            merged.setTotal(merged.getTotal() + partial.getTotal());
            merged.setScanSize(merged.getScanSize() + partial.getScanSize());
            merged.setScanRecords(merged.getScanRecords() + partial.getScanRecords());
            merged.setTook(merged.getTook() + partial.getTook());
            mergeTookDetail(merged, partial.getTookDetail());
            if (!partial.getOrderBy().isEmpty()) {
                merged.setOrderBy(partial.getOrderBy());
            }
            hits.addAll(partial.getHits());
        }
        // empty partials still carry their error annotations
        List<SearchResponse> annotated = new ArrayList<>(cached);
        annotated.addAll(freshPartials);
        for (SearchResponse partial : annotated) {
            if (partial == null) {
                continue;
            }
            if (partial.isPartial()) {
                merged.setPartial(true);
            }
            if (partial.getFunctionError() != null && !partial.getFunctionError().isEmpty()) {
                merged.setFunctionError(partial.getFunctionError());
            }
        }
        for (SearchResponse partial : fresh) {
            freshHits += partial.getHits().size();
            weightedCachedRatio += partial.getCachedRatio() * partial.getHits().size();
        }
        for (SearchResponse partial : cached) {
            cacheHits += partial.getHits().size();
        }

        if (plan.getTsColumn() != null) {
            hits.sort(Hits.order(plan.getTsColumn(), plan.isDescending()));
        }

        if (cached.isEmpty()) {
            merged.setHits(hits);
            merged.setCachedRatio(freshHits > 0 ? weightedCachedRatio / freshHits : 0);
            return merged;
        }

        if (plan.getLimit() > 0 && hits.size() > plan.getLimit()) {
            hits = new ArrayList<>(hits.subList(0, plan.getLimit()));
        }
        if (plan.getLimit() > 0) {
            merged.setTotal(hits.size());
        }
        merged.setHits(hits);
        merged.setCachedRatio(freshHits > 0 ? weightedCachedRatio / freshHits : 0);
        merged.setResultCacheRatio(freshHits + cacheHits > 0 ? cacheHits * 100.0 / (freshHits + cacheHits) : 0);
        return merged;
    }

    private static void mergeTookDetail(SearchResponse merged, TookDetail detail) {
        if (merged.getTookDetail() == null) {
            merged.setTookDetail(new TookDetail());
        }
        merged.getTookDetail().add(detail);
    }

    private static List<SearchResponse> nonEmpty(List<SearchResponse> responses) {
        List<SearchResponse> result = new ArrayList<>();
        for (SearchResponse response : responses) {
            if (response != null && response.hasHits()) {
                result.add(response);
            }
        }
        return result;
    }
}
