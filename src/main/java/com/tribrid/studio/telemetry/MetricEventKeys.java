package com.tribrid.studio.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tribrid.studio.control.model.MetricEvent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Structural identity of metric events.
 *
 * The key is a JSON object over a fixed field list in a fixed order, with
 * null for absent fields, so the same event delivered by the history fetch
 * and by the live stream yields the same key. Transport metadata (run_id)
 * is left out.
 */
public final class MetricEventKeys {

    private static final ObjectMapper KEY_MAPPER = new ObjectMapper();

    private MetricEventKeys() {
    }

    public static String computeKey(MetricEvent event) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", event.getType());
        fields.put("ts", event.getTs());
        fields.put("status", event.getStatus());
        fields.put("step", event.getStep());
        fields.put("epoch", event.getEpoch());
        fields.put("percent", event.getPercent());
        fields.put("message", event.getMessage());
        fields.put("loss", event.getLoss());
        fields.put("lr", event.getLr());
        fields.put("grad_norm", event.getGradNorm());
        fields.put("param_norm", event.getParamNorm());
        fields.put("update_norm", event.getUpdateNorm());
        fields.put("proj_x", event.getProjX());
        fields.put("proj_y", event.getProjY());
        fields.put("metrics", event.getMetrics() != null ? new TreeMap<>(event.getMetrics()) : null);

        try {
            return KEY_MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            // Only scalars, strings and a flat map are written here
            throw new IllegalStateException("Failed to serialize metric event key", e);
        }
    }
}
