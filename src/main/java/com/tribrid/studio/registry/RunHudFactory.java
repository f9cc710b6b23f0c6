package com.tribrid.studio.registry;

import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.MetricEventType;
import com.tribrid.studio.control.model.Run;
import com.tribrid.studio.control.model.RunStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Derives the HUD of a run from its status and retained events.
 */
@Component
public class RunHudFactory {

    static final String NO_VALUE = "—";

    private final Clock clock;

    public RunHudFactory() {
        this(Clock.systemUTC());
    }

    RunHudFactory(Clock clock) {
        this.clock = clock;
    }

    public RunHud create(Run run, RunStatus status, List<MetricEvent> events, int telemetryPoints, boolean streamOpen) {
        RunHud.LastEvent last = lastEvent(events);
        Map<?, ?> training = trainingSnapshot(run);
        return RunHud.builder()
                .runId(run.getRunId())
                .status(status)
                .progressLabel(progressLabel(status, last.getPercent()))
                .backend(snapshotValue(training, "ragweld_agent_backend"))
                .baseModel(snapshotValue(training, "ragweld_agent_base_model"))
                .activePath(snapshotValue(training, "ragweld_agent_model_path"))
                .durationSeconds(durationSeconds(run))
                .last(last)
                .terminalMessage(status == RunStatus.FAILED || status == RunStatus.CANCELLED
                        ? terminalMessage(events)
                        : null)
                .latestMetrics(latestMetrics(events))
                .telemetryPoints(telemetryPoints)
                .streamOpen(streamOpen)
                .build();
    }

    static String progressLabel(RunStatus status, Double percent) {
        String pct = percent != null && Double.isFinite(percent)
                ? formatPercent(Math.max(0.0, Math.min(100.0, percent))) + "%"
                : null;
        return switch (status) {
            case FAILED, CANCELLED -> pct == null ? status.getWireName() : pct + " (" + status.getWireName() + ")";
            case COMPLETED -> pct == null ? "100%" : pct;
            default -> pct == null ? NO_VALUE : pct;
        };
    }

    static RunHud.LastEvent lastEvent(List<MetricEvent> events) {
        for (int i = events.size() - 1; i >= 0; i--) {
            MetricEvent event = events.get(i);
            if (event.getStep() != null || event.getEpoch() != null || event.getPercent() != null) {
                return RunHud.LastEvent.builder()
                        .ts(event.getTs())
                        .step(event.getStep())
                        .epoch(event.getEpoch())
                        .percent(event.getPercent())
                        .build();
            }
        }
        return new RunHud.LastEvent();
    }

    static String terminalMessage(List<MetricEvent> events) {
        for (int i = events.size() - 1; i >= 0; i--) {
            MetricEvent event = events.get(i);
            String message = event.getMessage() != null ? event.getMessage().trim() : "";
            if (message.isEmpty()) {
                continue;
            }
            if (event.getType() == MetricEventType.ERROR) {
                return message;
            }
            RunStatus status = RunStatus.fromWire(event.getStatus());
            if (status == RunStatus.FAILED || status == RunStatus.CANCELLED) {
                return message;
            }
        }
        return null;
    }

    static Map<String, Double> latestMetrics(List<MetricEvent> events) {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).getMetrics() != null) {
                return events.get(i).getMetrics();
            }
        }
        return null;
    }

    Double durationSeconds(Run run) {
        Instant started = parseInstant(run.getStartedAt());
        if (started == null) {
            return null;
        }
        Instant end;
        if (run.getCompletedAt() != null) {
            end = parseInstant(run.getCompletedAt());
            if (end == null) {
                return null;
            }
        } else {
            end = clock.instant();
        }
        return Math.max(0.0, Duration.between(started, end).toMillis() / 1000.0);
    }

    /**
     * Parses an ISO-8601 timestamp; one without offset is taken as UTC.
     *
     * @return the instant, or null if the value is not a timestamp
     */
    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static String formatPercent(double pct) {
        return BigDecimal.valueOf(pct).stripTrailingZeros().toPlainString();
    }

    private static Map<?, ?> trainingSnapshot(Run run) {
        if (run.getConfigSnapshot() == null) {
            return Map.of();
        }
        Object training = run.getConfigSnapshot().get("training");
        return training instanceof Map ? (Map<?, ?>) training : Map.of();
    }

    private static String snapshotValue(Map<?, ?> training, String key) {
        Object value = training.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            return NO_VALUE;
        }
        return String.valueOf(value);
    }
}
