package com.lumenlog.search.cache.metrics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One point of a metrics series; timestamp in microseconds
 */
public class Sample {

    private final long timestamp;
    private final double value;

    @JsonCreator
    public Sample(@JsonProperty("timestamp") long timestamp, @JsonProperty("value") double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return timestamp + "=" + value;
    }
}
