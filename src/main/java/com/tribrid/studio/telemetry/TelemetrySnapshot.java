package com.tribrid.studio.telemetry;

import com.tribrid.studio.control.model.RunStatus;

import java.util.List;

/**
 * Copy of the pipeline state taken on the studio loop.
 */
public record TelemetrySnapshot(
        String runId,
        RunStatus status,
        boolean streamOpen,
        List<TelemetryPoint> points,
        int capacity,
        int retainedEvents
) {}
