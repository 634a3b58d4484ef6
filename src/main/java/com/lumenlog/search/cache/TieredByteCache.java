package com.lumenlog.search.cache;

import java.util.Arrays;
import java.util.Optional;

/**
 * Byte-level cache (memory, then disk) holding cached result payloads.
 *
 * Implementations report storage failures as
 * {@link com.lumenlog.search.exception.UpstreamIoException}.
 */
public interface TieredByteCache {

    /**
     * Payload stored under the key, or empty when it is gone
     */
    Optional<byte[]> get(String traceId, String key);

    /**
     * Slice [from, to) of the payload
     */
    default Optional<byte[]> get(String traceId, String key, int from, int to) {
        return get(traceId, key).map(bytes ->
            Arrays.copyOfRange(bytes, Math.min(from, bytes.length), Math.min(to, bytes.length)));
    }

    void set(String traceId, String key, byte[] data);
}
