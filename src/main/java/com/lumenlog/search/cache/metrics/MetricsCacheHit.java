package com.lumenlog.search.cache.metrics;

import java.util.List;

/**
 * Cached series for the head of a requested range, and the timestamp the remaining query
 * should resume from
 */
public class MetricsCacheHit {

    private final List<RangeValue> series;
    private final long resumeFrom;

    public MetricsCacheHit(List<RangeValue> series, long resumeFrom) {
        this.series = series;
        this.resumeFrom = resumeFrom;
    }

    public List<RangeValue> getSeries() {
        return series;
    }

    public long getResumeFrom() {
        return resumeFrom;
    }
}
