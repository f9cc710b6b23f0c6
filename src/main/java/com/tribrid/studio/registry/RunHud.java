package com.tribrid.studio.registry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tribrid.studio.control.model.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Heads-up display of the selected run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunHud {

    private String runId;

    /**
     * Status according to the state machine.
     */
    private RunStatus status;

    /**
     * e.g. "42.5%", "100%", "failed", "12% (cancelled)" or "—".
     */
    private String progressLabel;

    private String backend;

    private String baseModel;

    private String activePath;

    /**
     * Seconds from start to completion, or to now while running.
     * Null when a timestamp cannot be parsed.
     */
    private Double durationSeconds;

    /**
     * Position of the most recent event carrying step, epoch or percent.
     */
    private LastEvent last;

    /**
     * Message of the latest error, set for failed and cancelled runs only.
     */
    private String terminalMessage;

    private Map<String, Double> latestMetrics;

    private int telemetryPoints;

    private boolean streamOpen;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class LastEvent {
        private String ts;
        private Long step;
        private Double epoch;
        private Double percent;
    }
}
