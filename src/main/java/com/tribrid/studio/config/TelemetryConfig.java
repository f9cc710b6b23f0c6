package com.tribrid.studio.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the live telemetry pipeline.
 *
 * Controls buffer sizes, the retained event window, and the display frame rate.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "studio.telemetry")
public class TelemetryConfig {

    public static final int MIN_RING_CAPACITY = 1_000;
    public static final int MAX_RING_CAPACITY = 50_000;

    /**
     * Maximum number of visualization points kept in memory.
     * Clamped to [1000, 50000].
     */
    private int ringCapacity = 10_000;

    /**
     * Number of accepted events retained for the log view and export.
     */
    private int eventWindowSize = 5_000;

    /**
     * Size of the historical page fetched when a run is selected.
     */
    private int historyLimit = 2_000;

    /**
     * Delay between a telemetry push and the coalesced buffer flush.
     */
    private long frameIntervalMs = 16;

    public int getEffectiveRingCapacity() {
        return Math.max(MIN_RING_CAPACITY, Math.min(MAX_RING_CAPACITY, ringCapacity));
    }
}
