package com.tribrid.studio.api.health;

import com.tribrid.studio.registry.RunRegistry;
import com.tribrid.studio.telemetry.TelemetrySnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the live telemetry stream.
 *
 * Reports the followed run, stream state and buffer utilization. A lost
 * stream is not a service failure, so the indicator stays up.
 */
@Component
@RequiredArgsConstructor
public class TelemetryStreamHealthIndicator implements HealthIndicator {

    private final RunRegistry runRegistry;

    @Override
    public Health health() {
        TelemetrySnapshot snapshot = runRegistry.telemetry();
        int utilization = snapshot.capacity() > 0
                ? (int) Math.round(100.0 * snapshot.points().size() / snapshot.capacity())
                : 0;

        Health.Builder builder = Health.up()
                .withDetail("selectedRunId", snapshot.runId() != null ? snapshot.runId() : "none")
                .withDetail("status", snapshot.status().getWireName())
                .withDetail("streamOpen", snapshot.streamOpen())
                .withDetail("bufferSize", snapshot.points().size())
                .withDetail("bufferCapacity", snapshot.capacity())
                .withDetail("utilizationPercent", utilization)
                .withDetail("retainedEvents", snapshot.retainedEvents());

        runRegistry.lastError().ifPresent(error -> builder
                .withDetail("lastErrorRunId", error.runId())
                .withDetail("lastError", error.message())
                .withDetail("lastErrorAt", error.at().toString()));

        return builder.build();
    }
}
