package com.lumenlog.search.support;

import com.lumenlog.search.cache.TieredByteCache;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Byte cache backed by a map
 */
public class InMemoryByteCache implements TieredByteCache {

    private final Map<String, byte[]> data = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String traceId, String key) {
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public void set(String traceId, String key, byte[] bytes) {
        data.put(key, bytes);
    }

    public void delete(String key) {
        data.remove(key);
    }

    public boolean contains(String key) {
        return data.containsKey(key);
    }

    public int size() {
        return data.size();
    }

    public Map<String, byte[]> getData() {
        return data;
    }
}
