package com.tribrid.studio.control.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a training run.
 *
 * UNKNOWN stands in for "not observed yet" and for any value the backend
 * sends that is not one of the known statuses.
 */
public enum RunStatus {

    QUEUED("queued"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    UNKNOWN("unknown");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Maps a wire value to a status, falling back to UNKNOWN.
     */
    @JsonCreator
    public static RunStatus fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim();
        for (RunStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
