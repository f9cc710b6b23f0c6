package com.tribrid.studio.telemetry;

import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.MetricEventType;

import java.util.Optional;

/**
 * One point of the loss-landscape visualization.
 */
public record TelemetryPoint(
        double x,
        double y,
        long step,
        double loss,
        double lr,
        double gradNorm,
        String ts
) {

    /**
     * Projects a telemetry event onto a point.
     *
     * Only telemetry events carrying both proj_x and proj_y produce a point;
     * missing step/loss/lr/grad_norm become zero.
     */
    public static Optional<TelemetryPoint> from(MetricEvent event) {
        if (event.getType() != MetricEventType.TELEMETRY) {
            return Optional.empty();
        }
        if (event.getProjX() == null || event.getProjY() == null) {
            return Optional.empty();
        }
        return Optional.of(new TelemetryPoint(
                event.getProjX(),
                event.getProjY(),
                event.getStep() != null ? event.getStep() : 0L,
                orZero(event.getLoss()),
                orZero(event.getLr()),
                orZero(event.getGradNorm()),
                event.getTs()
        ));
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}
