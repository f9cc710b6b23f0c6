package com.tribrid.studio.control.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tag of a {@link MetricEvent}.
 */
public enum MetricEventType {

    PROGRESS("progress"),
    TELEMETRY("telemetry"),
    LOG("log"),
    ERROR("error"),
    STATE("state"),
    COMPLETE("complete"),
    METRICS("metrics"),
    UNKNOWN("unknown");

    private final String wireName;

    MetricEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Unrecognized tags map to {@link #UNKNOWN} so a single unexpected entry
     * cannot fail a whole history page.
     */
    @JsonCreator
    public static MetricEventType fromWire(String value) {
        for (MetricEventType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        return value == null ? null : UNKNOWN;
    }
}
