package com.lumenlog.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumenlog.search.exception.SearchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * JSON encoding of cached payloads
 */
public final class CachePayloads {

    private static final Logger log = LoggerFactory.getLogger(CachePayloads.class);
    private static final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private CachePayloads() {
    }

    public static byte[] write(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SearchException("Failed to encode cache payload: " + e.getMessage(), e);
        }
    }

    /**
     * Decode a payload; empty when the bytes are not a valid payload
     */
    public static <T> Optional<T> read(byte[] data, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(data, type));
        } catch (IOException e) {
            log.debug("Corrupt cache payload for {}: {}", type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }

    public static <T> Optional<T> read(byte[] data, TypeReference<T> type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(data, type));
        } catch (IOException e) {
            log.debug("Corrupt cache payload: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
