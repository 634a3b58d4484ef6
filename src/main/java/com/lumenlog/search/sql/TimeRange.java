package com.lumenlog.search.sql;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Half-open time window [start, end) in microseconds
 */
public class TimeRange {

    private final long start;
    private final long end;

    @JsonCreator
    public TimeRange(@JsonProperty("start") long start, @JsonProperty("end") long end) {
        this.start = start;
        this.end = end;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long spanSeconds() {
        return Math.max(0, end - start) / 1_000_000L;
    }

    /**
     * True when a closed interval [min, max] intersects this window
     */
    public boolean overlaps(long min, long max) {
        if (start == 0 && end == 0) {
            return true;
        }
        return min < end && max >= start;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
