package com.lumenlog.search.cache.metrics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A labelled metrics series, samples in ascending time order
 */
public class RangeValue {

    private final Map<String, String> labels;
    private final List<Sample> samples;

    @JsonCreator
    public RangeValue(@JsonProperty("labels") Map<String, String> labels,
                      @JsonProperty("samples") List<Sample> samples) {
        this.labels = labels == null ? new LinkedHashMap<>() : new LinkedHashMap<>(labels);
        this.samples = samples == null ? new ArrayList<>() : new ArrayList<>(samples);
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public List<Sample> getSamples() {
        return samples;
    }

    /**
     * Copy holding only the samples at or before {@code end}
     */
    public RangeValue truncatedAfter(long end) {
        List<Sample> kept = new ArrayList<>();
        for (Sample sample : samples) {
            if (sample.getTimestamp() <= end) {
                kept.add(sample);
            }
        }
        return new RangeValue(labels, kept);
    }

    public long lastTimestamp() {
        return samples.isEmpty() ? Long.MIN_VALUE : samples.get(samples.size() - 1).getTimestamp();
    }
}
