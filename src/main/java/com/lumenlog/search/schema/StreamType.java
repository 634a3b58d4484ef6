package com.lumenlog.search.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of telemetry a stream holds
 */
public enum StreamType {
    LOGS,
    METRICS,
    TRACES;

    @JsonCreator
    public static StreamType fromString(String value) {
        if (value == null) {
            return LOGS;
        }
        return StreamType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
