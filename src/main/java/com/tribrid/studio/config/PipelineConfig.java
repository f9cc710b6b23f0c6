package com.tribrid.studio.config;

import com.tribrid.studio.control.TrainingControlApi;
import com.tribrid.studio.telemetry.EventDeduplicator;
import com.tribrid.studio.telemetry.EventWindow;
import com.tribrid.studio.telemetry.FrameScheduler;
import com.tribrid.studio.telemetry.RunStateMachine;
import com.tribrid.studio.telemetry.StudioLoop;
import com.tribrid.studio.telemetry.TelemetryRingBuffer;
import com.tribrid.studio.telemetry.TelemetryStreamConsumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the telemetry pipeline owned by the stream consumer.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class PipelineConfig {

    private final TelemetryConfig telemetryConfig;
    private final MetricsConfig metricsConfig;

    @Bean
    public TelemetryRingBuffer telemetryRingBuffer(FrameScheduler frameScheduler) {
        int capacity = telemetryConfig.getEffectiveRingCapacity();
        if (capacity != telemetryConfig.getRingCapacity()) {
            log.warn("Ring capacity {} clamped to {}", telemetryConfig.getRingCapacity(), capacity);
        }
        var ringBuffer = new TelemetryRingBuffer(capacity, frameScheduler, metricsConfig);
        // Read outside the loop; a slightly stale size is fine for a gauge
        metricsConfig.registerBufferGauge(
                "studio.telemetry.buffer.size",
                "Number of visualization points in the telemetry buffer",
                ringBuffer::size
        );
        return ringBuffer;
    }

    @Bean
    public TelemetryStreamConsumer telemetryStreamConsumer(
            TrainingControlApi trainingControlApi,
            EventDeduplicator eventDeduplicator,
            TelemetryRingBuffer telemetryRingBuffer,
            StudioLoop studioLoop) {
        return new TelemetryStreamConsumer(
                trainingControlApi,
                eventDeduplicator,
                telemetryRingBuffer,
                new RunStateMachine(),
                new EventWindow(telemetryConfig.getEventWindowSize()),
                studioLoop,
                metricsConfig,
                telemetryConfig.getHistoryLimit()
        );
    }
}
