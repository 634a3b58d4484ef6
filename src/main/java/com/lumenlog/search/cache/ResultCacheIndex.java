package com.lumenlog.search.cache;

import com.google.common.hash.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory index of cached result windows.
 *
 * Keys are spread over a fixed number of buckets, each guarded by its own read/write lock.
 * No operation holds more than one bucket lock. Every key remembers the query text it was
 * first registered with; a different text under the same key is a hash collision and is
 * never merged into the existing entries.
 */
public class ResultCacheIndex {

    private static final Logger log = LoggerFactory.getLogger(ResultCacheIndex.class);

    public enum RegisterOutcome {
        REGISTERED,
        ALREADY_COVERED,
        CONFLICT
    }

    private final Bucket[] buckets;
    private final int maxKeysPerBucket;
    private final int gcTrigger;
    private final int maxEntriesPerKey;

    public ResultCacheIndex(int bucketCount, int maxEntries, int gcTrigger, int maxEntriesPerKey) {
        if (bucketCount <= 0) {
            throw new IllegalArgumentException("bucket count must be positive");
        }
        this.buckets = new Bucket[bucketCount];
        for (int i = 0; i < bucketCount; i++) {
            buckets[i] = new Bucket();
        }
        this.maxKeysPerBucket = Math.max(1, maxEntries / bucketCount);
        this.gcTrigger = gcTrigger;
        this.maxEntriesPerKey = Math.max(2, maxEntriesPerKey);
    }

    public int bucketOf(String key) {
        long hash = Hashing.farmHashFingerprint64().hashString(key, StandardCharsets.UTF_8).asLong();
        return (int) Long.remainderUnsigned(hash, buckets.length);
    }

    public int bucketCount() {
        return buckets.length;
    }

    /**
     * Snapshot of the entries registered under a key, oldest first
     */
    public List<ResultCacheIndexEntry> entries(String key) {
        Bucket bucket = buckets[bucketOf(key)];
        bucket.lock.readLock().lock();
        try {
            KeyEntries keyEntries = bucket.keys.get(key);
            return keyEntries == null ? Collections.emptyList() : new ArrayList<>(keyEntries.entries);
        } finally {
            bucket.lock.readLock().unlock();
        }
    }

    /**
     * True when the key is already held by a different query text
     */
    public boolean isConflict(String key, String queryText) {
        Bucket bucket = buckets[bucketOf(key)];
        bucket.lock.readLock().lock();
        try {
            KeyEntries keyEntries = bucket.keys.get(key);
            return keyEntries != null && conflicts(keyEntries, queryText);
        } finally {
            bucket.lock.readLock().unlock();
        }
    }

    /**
     * Entry starting at or before {@code start} that covers the most of [start, end),
     * ties broken by the end closest to {@code end}
     */
    public Optional<ResultCacheIndexEntry> best(String key, long start, long end) {
        ResultCacheIndexEntry best = null;
        for (ResultCacheIndexEntry entry : entries(key)) {
            if (entry.getStart() > start || entry.getEnd() <= start) {
                continue;
            }
            if (best == null) {
                best = entry;
                continue;
            }
            long coverage = Math.min(entry.getEnd(), end);
            long bestCoverage = Math.min(best.getEnd(), end);
            if (coverage > bestCoverage
                    || (coverage == bestCoverage && Math.abs(end - entry.getEnd()) < Math.abs(end - best.getEnd()))) {
                best = entry;
            }
        }
        return Optional.ofNullable(best);
    }

    public boolean covers(String key, long start, long end) {
        for (ResultCacheIndexEntry entry : entries(key)) {
            if (entry.covers(start, end)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Record a stored window. A null query text skips collision checks (entries rebuilt from
     * storage keys); the first non-null text becomes the key's owner.
     */
    public RegisterOutcome register(String key, String queryText, ResultCacheIndexEntry entry) {
        Bucket bucket = buckets[bucketOf(key)];
        bucket.lock.writeLock().lock();
        try {
            KeyEntries keyEntries = bucket.keys.get(key);
            if (keyEntries != null) {
                if (conflicts(keyEntries, queryText)) {
                    return RegisterOutcome.CONFLICT;
                }
                for (ResultCacheIndexEntry existing : keyEntries.entries) {
                    if (existing.covers(entry.getStart(), entry.getEnd())) {
                        return RegisterOutcome.ALREADY_COVERED;
                    }
                }
                if (keyEntries.queryText == null) {
                    keyEntries.queryText = queryText;
                }
            } else {
                if (bucket.keys.size() >= maxKeysPerBucket - gcTrigger) {
                    gcLocked(bucket);
                }
                keyEntries = new KeyEntries(queryText);
                bucket.keys.put(key, keyEntries);
            }
            if (keyEntries.entries.size() >= maxEntriesPerKey) {
                keyEntries.entries.subList(0, keyEntries.entries.size() / 2).clear();
            }
            keyEntries.entries.add(entry);
            return RegisterOutcome.REGISTERED;
        } finally {
            bucket.lock.writeLock().unlock();
        }
    }

    public boolean remove(String key, ResultCacheIndexEntry entry) {
        Bucket bucket = buckets[bucketOf(key)];
        bucket.lock.writeLock().lock();
        try {
            KeyEntries keyEntries = bucket.keys.get(key);
            if (keyEntries == null) {
                return false;
            }
            boolean removed = keyEntries.entries.remove(entry);
            if (keyEntries.entries.isEmpty()) {
                bucket.keys.remove(key);
            }
            return removed;
        } finally {
            bucket.lock.writeLock().unlock();
        }
    }

    /**
     * Evict the oldest tenth of the keys in one bucket; returns the number evicted
     */
    public int gc(int bucketIndex) {
        Bucket bucket = buckets[bucketIndex];
        bucket.lock.writeLock().lock();
        try {
            return gcLocked(bucket);
        } finally {
            bucket.lock.writeLock().unlock();
        }
    }

    private int gcLocked(Bucket bucket) {
        int toEvict = Math.max(1, bucket.keys.size() / 10);
        int evicted = 0;
        Iterator<Map.Entry<String, KeyEntries>> it = bucket.keys.entrySet().iterator();
        while (it.hasNext() && evicted < toEvict) {
            it.next();
            it.remove();
            evicted++;
        }
        log.debug("Result cache index gc evicted {} keys, {} remain in bucket", evicted, bucket.keys.size());
        return evicted;
    }

    public int keyCount() {
        int count = 0;
        for (Bucket bucket : buckets) {
            bucket.lock.readLock().lock();
            try {
                count += bucket.keys.size();
            } finally {
                bucket.lock.readLock().unlock();
            }
        }
        return count;
    }

    private static boolean conflicts(KeyEntries keyEntries, String queryText) {
        return queryText != null && keyEntries.queryText != null && !keyEntries.queryText.equals(queryText);
    }

    private static class Bucket {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final LinkedHashMap<String, KeyEntries> keys = new LinkedHashMap<>();
    }

    private static class KeyEntries {
        private String queryText;
        private final List<ResultCacheIndexEntry> entries = new ArrayList<>();

        KeyEntries(String queryText) {
            this.queryText = queryText;
        }
    }
}
