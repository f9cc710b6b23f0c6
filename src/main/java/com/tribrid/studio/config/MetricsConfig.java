package com.tribrid.studio.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics for the telemetry pipeline.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    private final Counter eventsApplied;
    private final Counter deduplicatedEvents;
    private final Counter malformedEvents;
    private final Counter streamErrors;
    private final Counter telemetryFlushes;

    private final Timer flushTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.eventsApplied = Counter.builder("studio.events.applied.count")
                .description("Number of metric events applied to the pipeline")
                .register(registry);

        this.deduplicatedEvents = Counter.builder("studio.dedup.count")
                .description("Number of metric events rejected as duplicates")
                .register(registry);

        this.malformedEvents = Counter.builder("studio.stream.malformed.count")
                .description("Number of unparseable stream payloads dropped")
                .register(registry);

        this.streamErrors = Counter.builder("studio.stream.error.count")
                .description("Number of live streams closed by a transport error")
                .register(registry);

        this.telemetryFlushes = Counter.builder("studio.telemetry.flush.count")
                .description("Number of coalesced telemetry buffer flushes")
                .register(registry);

        this.flushTimer = Timer.builder("studio.telemetry.flush.duration")
                .description("Time taken to merge pending points into the buffer")
                .register(registry);
    }

    /**
     * Registers a gauge for buffer occupancy.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerBufferGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
