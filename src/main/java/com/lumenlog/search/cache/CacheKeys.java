package com.lumenlog.search.cache;

import com.google.common.base.Joiner;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.lumenlog.search.schema.StreamType;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cache key derivation and storage key naming
 */
public final class CacheKeys {

    public static final String METRICS_PREFIX = "metrics_results";

    private static final DateTimeFormatter HOUR_PATH =
        DateTimeFormatter.ofPattern("yyyy/MM/dd/HH").withZone(ZoneOffset.UTC);
    private static final Pattern SEARCH_FILE =
        Pattern.compile("^(-?\\d+)_(-?\\d+)_(true|false)_(true|false)\\.json$");
    private static final Pattern METRICS_KEY =
        Pattern.compile("^" + METRICS_PREFIX + "/\\d{4}/\\d{2}/\\d{2}/\\d{2}/(.+)_(-?\\d+)_(-?\\d+)_(\\d+)\\.json$");

    private CacheKeys() {
    }

    /**
     * Text identifying a query for caching: SQL without line breaks, the decoded
     * post-processing function, and the sorted regions and clusters
     */
    public static String queryText(String sql, String queryFn, List<String> regions, List<String> clusters) {
        List<String> parts = new ArrayList<>();
        parts.add(sql == null ? "" : sql.replaceAll("\\r?\\n", " "));
        if (queryFn != null && !queryFn.isEmpty()) {
            parts.add(decodeFunction(queryFn));
        }
        List<String> sortedRegions = new ArrayList<>(regions == null ? Collections.emptyList() : regions);
        Collections.sort(sortedRegions);
        List<String> sortedClusters = new ArrayList<>(clusters == null ? Collections.emptyList() : clusters);
        Collections.sort(sortedClusters);
        parts.addAll(sortedRegions);
        parts.addAll(sortedClusters);
        return Joiner.on(',').join(parts);
    }

    public static String hash(String queryText) {
        long h = Hashing.farmHashFingerprint64().hashString(queryText, StandardCharsets.UTF_8).asLong();
        return Long.toUnsignedString(h);
    }

    private static String decodeFunction(String queryFn) {
        try {
            return new String(BaseEncoding.base64().decode(queryFn.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // sent as plain text
            return queryFn;
        }
    }

    /**
     * {@code org/type/stream/hash}, plus {@code _interval_tscol} for histogram queries
     */
    public static String searchCachePath(String org, StreamType type, String stream, String hash,
                                         long histogramInterval, String tsColumn) {
        String path = org + "/" + type + "/" + stream + "/" + hash;
        if (histogramInterval > 0) {
            path = path + "_" + histogramInterval + "_" + tsColumn;
        }
        return path;
    }

    public static String searchCacheKey(String path, long start, long end, boolean aggregate, boolean descending) {
        return path + "/" + start + "_" + end + "_" + aggregate + "_" + descending + ".json";
    }

    /**
     * Window [start, end) encoded in a search cache file name, if it is one
     */
    public static Optional<long[]> parseSearchCacheWindow(String key) {
        String file = key.substring(key.lastIndexOf('/') + 1);
        Matcher m = SEARCH_FILE.matcher(file);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new long[] {Long.parseLong(m.group(1)), Long.parseLong(m.group(2))});
    }

    public static String metricsCacheKey(String queryHash, long start, long end, long step) {
        String hour = HOUR_PATH.format(Instant.ofEpochSecond(0, start * 1000L));
        return METRICS_PREFIX + "/" + hour + "/" + queryHash + "_" + start + "_" + end + "_" + step + ".json";
    }

    /**
     * Rebuild the query hash and window from a metrics cache key.
     * Returns {hash, start, end, step} or empty for foreign keys.
     */
    public static Optional<MetricsKey> parseMetricsKey(String key) {
        Matcher m = METRICS_KEY.matcher(key);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new MetricsKey(m.group(1), Long.parseLong(m.group(2)),
            Long.parseLong(m.group(3)), Long.parseLong(m.group(4))));
    }

    public static class MetricsKey {
        private final String queryHash;
        private final long start;
        private final long end;
        private final long step;

        MetricsKey(String queryHash, long start, long end, long step) {
            this.queryHash = queryHash;
            this.start = start;
            this.end = end;
            this.step = step;
        }

        public String getQueryHash() {
            return queryHash;
        }

        public long getStart() {
            return start;
        }

        public long getEnd() {
            return end;
        }

        public long getStep() {
            return step;
        }
    }
}
