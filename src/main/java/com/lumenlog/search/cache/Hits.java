package com.lumenlog.search.cache;

import java.util.Comparator;
import java.util.Map;

/**
 * Timestamp access and ordering for result rows
 */
final class Hits {

    private Hits() {
    }

    /**
     * Timestamp of a row in microseconds, or null when the column is missing or not numeric
     */
    static Long timestamp(Map<String, Object> hit, String tsColumn) {
        Object value = hit.get(tsColumn);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Rows without a timestamp sort last in either direction
     */
    static Comparator<Map<String, Object>> order(String tsColumn, boolean descending) {
        Comparator<Long> byValue = descending ? Comparator.<Long>reverseOrder() : Comparator.<Long>naturalOrder();
        return Comparator.comparing(hit -> timestamp(hit, tsColumn), Comparator.nullsLast(byValue));
    }

    static boolean inWindow(Map<String, Object> hit, String tsColumn, long start, long end) {
        Long ts = timestamp(hit, tsColumn);
        return ts == null || (ts >= start && ts < end);
    }
}
