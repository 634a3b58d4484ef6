package com.lumenlog.search.cache;

import java.util.Objects;

/**
 * Sub-range [start, end) of a request not served from cache.
 *
 * A removed-hits delta marks part of a cached window lying outside the request; its hits
 * are dropped rather than fetched.
 */
public class QueryDelta {

    private final long start;
    private final long end;
    private final boolean removedHits;

    public QueryDelta(long start, long end, boolean removedHits) {
        this.start = start;
        this.end = end;
        this.removedHits = removedHits;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public boolean isRemovedHits() {
        return removedHits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueryDelta that = (QueryDelta) o;
        return start == that.start && end == that.end && removedHits == that.removedHits;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, removedHits);
    }

    @Override
    public String toString() {
        return "QueryDelta[" + start + ", " + end + (removedHits ? ", removed" : "") + ")";
    }
}
