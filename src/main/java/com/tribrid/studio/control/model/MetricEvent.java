package com.tribrid.studio.control.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One streamed record describing run progress, loss, or lifecycle status.
 *
 * Events carry no server-assigned id; two events are the same event when
 * their semantic fields are equal (see MetricEventKeys).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricEvent {

    private MetricEventType type;

    /**
     * ISO-8601 timestamp as sent by the backend. Display only.
     */
    private String ts;

    /**
     * Raw status value; unrecognized values are kept as sent.
     */
    private String status;

    private Long step;

    /**
     * Fractional while an epoch is in progress.
     */
    private Double epoch;

    private Double percent;

    private String message;

    // Telemetry-only fields

    private Double loss;

    private Double lr;

    private Double gradNorm;

    private Double paramNorm;

    private Double updateNorm;

    private Double projX;

    private Double projY;

    /**
     * Named scalar metrics (progress and metrics events).
     */
    private Map<String, Double> metrics;

    /**
     * Transport metadata; never part of the event identity.
     */
    private String runId;
}
