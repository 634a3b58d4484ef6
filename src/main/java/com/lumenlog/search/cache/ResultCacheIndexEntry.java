package com.lumenlog.search.cache;

import java.util.Objects;

/**
 * Location and window [start, end) of one cached result, without its payload
 */
public class ResultCacheIndexEntry {

    private final String key;
    private final long start;
    private final long end;

    public ResultCacheIndexEntry(String key, long start, long end) {
        this.key = key;
        this.start = start;
        this.end = end;
    }

    public String getKey() {
        return key;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public boolean covers(long from, long to) {
        return start <= from && end >= to;
    }

    public boolean overlaps(long from, long to) {
        return start < to && end > from;
    }

    public long overlap(long from, long to) {
        return Math.max(0, Math.min(end, to) - Math.max(start, from));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultCacheIndexEntry that = (ResultCacheIndexEntry) o;
        return start == that.start && end == that.end && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, start, end);
    }

    @Override
    public String toString() {
        return key + " [" + start + ", " + end + ")";
    }
}
