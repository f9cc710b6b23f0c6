package com.tribrid.studio.telemetry;

import com.tribrid.studio.config.MetricsConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity FIFO store of visualization points with coalesced flushes.
 *
 * Pushed points wait in a pending queue; the first push after a flush
 * schedules exactly one flush for the next frame, which merges everything
 * pending in arrival order. The buffer never holds more than its capacity;
 * the oldest points are evicted first.
 *
 * Not thread-safe. Every method, including the scheduled flush, must run on
 * the studio loop.
 */
@Slf4j
public class TelemetryRingBuffer {

    private final TelemetryPoint[] slots;
    private final FrameScheduler frameScheduler;
    private final MetricsConfig metricsConfig;

    private final List<TelemetryPoint> pending = new ArrayList<>();
    private FrameScheduler.FrameHandle scheduledFlush;

    private int head;
    private int size;
    private long flushCount;

    public TelemetryRingBuffer(int capacity, FrameScheduler frameScheduler, MetricsConfig metricsConfig) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Ring capacity must be positive: " + capacity);
        }
        this.slots = new TelemetryPoint[capacity];
        this.frameScheduler = Objects.requireNonNull(frameScheduler, "frameScheduler");
        this.metricsConfig = Objects.requireNonNull(metricsConfig, "metricsConfig");
    }

    /**
     * Queues a point for the next flush.
     */
    public void push(TelemetryPoint point) {
        pending.add(Objects.requireNonNull(point, "point"));
        if (scheduledFlush == null) {
            scheduledFlush = frameScheduler.schedule(this::flush);
        }
    }

    /**
     * Merges pending points into the buffer. Invoked by the frame scheduler only.
     */
    void flush() {
        scheduledFlush = null;
        if (pending.isEmpty()) {
            return;
        }
        int merged = pending.size();
        metricsConfig.getFlushTimer().record(this::mergePending);
        flushCount++;
        metricsConfig.getTelemetryFlushes().increment();
        log.trace("Flushed {} telemetry points, buffer size {}", merged, size);
    }

    /**
     * Drops pending points and the scheduled flush; buffered points stay.
     */
    public void discardPending() {
        if (scheduledFlush != null) {
            scheduledFlush.cancel();
            scheduledFlush = null;
        }
        pending.clear();
    }

    /**
     * Clears pending and buffered points and cancels any scheduled flush.
     */
    public void reset() {
        discardPending();
        Arrays.fill(slots, null);
        head = 0;
        size = 0;
    }

    /**
     * Copies the buffered points, oldest first.
     */
    public List<TelemetryPoint> snapshot() {
        List<TelemetryPoint> points = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            points.add(slots[(head + i) % slots.length]);
        }
        return points;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.length;
    }

    public int pendingCount() {
        return pending.size();
    }

    public long flushCount() {
        return flushCount;
    }

    public boolean isFlushScheduled() {
        return scheduledFlush != null;
    }

    private void mergePending() {
        // Points that would be evicted within this same merge are skipped
        int skip = Math.max(0, pending.size() - slots.length);
        for (int i = skip; i < pending.size(); i++) {
            append(pending.get(i));
        }
        pending.clear();
    }

    private void append(TelemetryPoint point) {
        if (size < slots.length) {
            slots[(head + size) % slots.length] = point;
            size++;
        } else {
            slots[head] = point;
            head = (head + 1) % slots.length;
        }
    }
}
