package com.tribrid.studio.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tribrid.studio.control.model.MetricEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes retained metric events as newline-delimited JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricEventExporter {

    private final ObjectMapper objectMapper;

    /**
     * Exports the events of a run, one compact JSON object per line.
     *
     * @param runId the run the events belong to
     * @param events the events, oldest first
     * @return the export
     */
    public MetricExport export(String runId, List<MetricEvent> events) {
        String body = toNdjson(events);
        log.debug("Exported {} events of run {}", events.size(), runId);
        return new MetricExport(fileName(runId), body, events.size());
    }

    public String toNdjson(List<MetricEvent> events) {
        StringBuilder out = new StringBuilder();
        for (MetricEvent event : events) {
            try {
                out.append(objectMapper.writeValueAsString(event)).append('\n');
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize metric event of type " + event.getType(), e);
            }
        }
        return out.toString();
    }

    public static String fileName(String runId) {
        return "train-" + (runId != null && !runId.isBlank() ? runId : "run") + ".metrics.jsonl";
    }

    public record MetricExport(String fileName, String body, int eventCount) {}
}
