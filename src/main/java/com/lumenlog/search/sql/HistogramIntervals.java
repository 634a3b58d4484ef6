package com.lumenlog.search.sql;

import com.lumenlog.search.exception.InvalidQueryException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the bucket width (seconds) of a {@code histogram(col[, arg])} call
 */
public final class HistogramIntervals {

    private static final long MINUTE = 60;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    // span threshold (seconds) -> interval (seconds), checked top-down
    private static final long[][] LADDER = {
        {60 * DAY, DAY},
        {30 * DAY, 12 * HOUR},
        {28 * DAY, 6 * HOUR},
        {21 * DAY, 3 * HOUR},
        {15 * DAY, 2 * HOUR},
        {6 * HOUR, HOUR},
        {2 * HOUR, MINUTE},
        {HOUR, 30},
        {30 * MINUTE, 15},
        {15 * MINUTE, 10},
    };

    private static final long FALLBACK = 10;

    private static final Pattern DURATION = Pattern.compile(
        "^\\s*(\\d+)\\s*(s|sec|secs|second|seconds|m|min|mins|minute|minutes|h|hr|hrs|hour|hours|d|day|days)\\s*$");

    private HistogramIntervals() {
    }

    /**
     * Interval for a plain bucket count: floor(span / n), never below one second
     */
    public static long forBucketCount(long buckets, TimeRange range) {
        if (buckets <= 0) {
            throw new InvalidQueryException("histogram bucket count must be positive, got " + buckets);
        }
        long span = range.spanSeconds();
        if (span == 0) {
            return HOUR;
        }
        return Math.max(1, span / buckets);
    }

    /**
     * Interval for a literal duration such as {@code '5 minute'} or {@code '30s'}
     */
    public static long forDuration(String text) {
        Matcher m = DURATION.matcher(text.toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new InvalidQueryException("invalid histogram interval: " + text);
        }
        long amount = Long.parseLong(m.group(1));
        if (amount <= 0) {
            throw new InvalidQueryException("histogram interval must be positive: " + text);
        }
        switch (m.group(2).charAt(0)) {
            case 'm':
                return amount * MINUTE;
            case 'h':
                return amount * HOUR;
            case 'd':
                return amount * DAY;
            default:
                return amount;
        }
    }

    /**
     * Interval picked from the span ladder when the call has no second argument
     */
    public static long forSpan(TimeRange range) {
        long span = range.spanSeconds();
        if (span == 0) {
            return HOUR;
        }
        for (long[] step : LADDER) {
            if (span >= step[0]) {
                return step[1];
            }
        }
        return FALLBACK;
    }
}
