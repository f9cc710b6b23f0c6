package com.tribrid.studio.telemetry;

import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.MetricEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.tribrid.studio.support.MetricEvents.state;
import static org.assertj.core.api.Assertions.assertThat;

class MetricEventKeysTest {

    @Test
    @DisplayName("Structurally identical events share a key")
    void identicalEvents_sameKey() {
        assertThat(MetricEventKeys.computeKey(state("completed", "T1")))
                .isEqualTo(MetricEventKeys.computeKey(state("completed", "T1")));
    }

    @Test
    void differentTimestamp_differentKey() {
        assertThat(MetricEventKeys.computeKey(state("running", "T1")))
                .isNotEqualTo(MetricEventKeys.computeKey(state("running", "T2")));
    }

    @Test
    @DisplayName("Run id is delivery metadata and not part of the key")
    void runId_ignored() {
        MetricEvent fromHistory = state("running", "T1");
        MetricEvent fromStream = state("running", "T1").toBuilder().runId("corpus-a__1").build();

        assertThat(MetricEventKeys.computeKey(fromStream)).isEqualTo(MetricEventKeys.computeKey(fromHistory));
    }

    @Test
    void absentFields_serializedAsNull_inFixedOrder() {
        String key = MetricEventKeys.computeKey(MetricEvent.builder().type(MetricEventType.LOG).build());

        assertThat(key).isEqualTo("{\"type\":\"log\",\"ts\":null,\"status\":null,\"step\":null,\"epoch\":null,"
                + "\"percent\":null,\"message\":null,\"loss\":null,\"lr\":null,\"grad_norm\":null,"
                + "\"param_norm\":null,\"update_norm\":null,\"proj_x\":null,\"proj_y\":null,\"metrics\":null}");
    }

    @Test
    void metricsMap_insertionOrderDoesNotMatter() {
        Map<String, Double> ab = new LinkedHashMap<>();
        ab.put("a", 1.0);
        ab.put("b", 2.0);
        Map<String, Double> ba = new LinkedHashMap<>();
        ba.put("b", 2.0);
        ba.put("a", 1.0);

        MetricEvent first = MetricEvent.builder().type(MetricEventType.PROGRESS).ts("T1").metrics(ab).build();
        MetricEvent second = MetricEvent.builder().type(MetricEventType.PROGRESS).ts("T1").metrics(ba).build();

        assertThat(MetricEventKeys.computeKey(first)).isEqualTo(MetricEventKeys.computeKey(second));
    }

    @Test
    void differentMetricValue_differentKey() {
        MetricEvent first = MetricEvent.builder().type(MetricEventType.PROGRESS).ts("T1")
                .metrics(Map.of("train_loss", 0.5)).build();
        MetricEvent second = first.toBuilder().metrics(Map.of("train_loss", 0.4)).build();

        assertThat(MetricEventKeys.computeKey(first)).isNotEqualTo(MetricEventKeys.computeKey(second));
    }
}
