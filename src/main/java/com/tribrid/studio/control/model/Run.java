package com.tribrid.studio.control.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One tracked training execution as reported by the Training Control API.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Run {

    private String runId;

    /**
     * Agent runs report the corpus as repo_id.
     */
    @JsonAlias("repo_id")
    private String corpusId;

    @Builder.Default
    private RunStatus status = RunStatus.UNKNOWN;

    private String startedAt;

    /**
     * Absent until the run reaches a terminal status.
     */
    private String completedAt;

    private String primaryMetric;

    private PrimaryGoal primaryGoal;

    /**
     * Best/final metric values, null while the run is in flight.
     */
    private Map<String, Object> summary;

    private List<String> metricsAvailable;

    private Map<String, Object> configSnapshot;

    /**
     * Returns a copy carrying the given terminal status.
     *
     * A run that is already terminal is returned unchanged; completedAt is
     * only filled in when the backend has not set it yet.
     */
    public Run withTerminalStatus(RunStatus terminal, String ts) {
        if (status != null && status.isTerminal()) {
            return this;
        }
        return toBuilder()
                .status(terminal)
                .completedAt(completedAt != null ? completedAt : ts)
                .build();
    }

    public enum PrimaryGoal {
        @JsonProperty("maximize")
        MAXIMIZE,
        @JsonProperty("minimize")
        MINIMIZE
    }
}
