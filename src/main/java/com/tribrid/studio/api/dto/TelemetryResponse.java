package com.tribrid.studio.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tribrid.studio.control.model.RunStatus;
import com.tribrid.studio.telemetry.TelemetryPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Visualization points of the selected run, oldest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TelemetryResponse {

    private String runId;

    private RunStatus status;

    private boolean streamOpen;

    private int count;

    private int capacity;

    private int retainedEvents;

    private List<TelemetryPoint> points;
}
