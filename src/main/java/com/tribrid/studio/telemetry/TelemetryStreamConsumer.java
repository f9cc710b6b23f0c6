package com.tribrid.studio.telemetry;

import com.tribrid.studio.config.MetricsConfig;
import com.tribrid.studio.control.MetricEventSink;
import com.tribrid.studio.control.StreamHandle;
import com.tribrid.studio.control.TrainingControlApi;
import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.MetricEventType;
import com.tribrid.studio.control.model.Run;
import com.tribrid.studio.control.model.RunStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Owns the single live subscription of the selected run.
 *
 * Selecting a run closes the previous subscription and resets the pipeline,
 * loads the run detail and a page of history, then opens the live stream.
 * Historical and live events pass through the same pipeline: dedup, event
 * window, state machine, and the ring buffer for telemetry points.
 *
 * Every method must run on the studio loop. Transport callbacks are
 * re-posted onto the loop and dropped once their subscription is closed or
 * superseded.
 */
@Slf4j
public class TelemetryStreamConsumer {

    private final TrainingControlApi controlApi;
    private final EventDeduplicator deduplicator;
    private final TelemetryRingBuffer ringBuffer;
    private final RunStateMachine stateMachine;
    private final EventWindow eventWindow;
    private final StudioLoop loop;
    private final MetricsConfig metricsConfig;
    private final int historyLimit;

    private Subscription current;
    private Run selectedRun;

    public TelemetryStreamConsumer(
            TrainingControlApi controlApi,
            EventDeduplicator deduplicator,
            TelemetryRingBuffer ringBuffer,
            RunStateMachine stateMachine,
            EventWindow eventWindow,
            StudioLoop loop,
            MetricsConfig metricsConfig,
            int historyLimit) {
        this.controlApi = Objects.requireNonNull(controlApi, "controlApi");
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
        this.ringBuffer = Objects.requireNonNull(ringBuffer, "ringBuffer");
        this.stateMachine = Objects.requireNonNull(stateMachine, "stateMachine");
        this.eventWindow = Objects.requireNonNull(eventWindow, "eventWindow");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.metricsConfig = Objects.requireNonNull(metricsConfig, "metricsConfig");
        this.historyLimit = historyLimit;
    }

    /**
     * Switches the pipeline to a run.
     *
     * The previous subscription is closed and all pipeline state is reset
     * before this method returns; history and the live stream follow
     * asynchronously.
     *
     * @param runId the run to select
     * @param listener receiver of completion and error callbacks
     */
    public void select(String runId, TelemetryListener listener) {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(listener, "listener");

        close();
        reset();

        Subscription subscription = new Subscription(runId, listener);
        current = subscription;
        log.info("Selecting run: runId={}", runId);

        CompletableFuture<Run> detail;
        CompletableFuture<List<MetricEvent>> history;
        try {
            detail = controlApi.getRun(runId);
            history = controlApi.getMetrics(runId, historyLimit);
        } catch (RuntimeException e) {
            detail = CompletableFuture.failedFuture(e);
            history = CompletableFuture.completedFuture(List.of());
        }

        detail.thenCombine(history, LoadedRun::new)
                .whenCompleteAsync((loaded, error) -> onHistoryLoaded(subscription, loaded, error), loop);
    }

    /**
     * Closes the live stream and drops pending points. Safe to call repeatedly.
     * Buffered points, events and state are kept.
     */
    public void close() {
        Subscription subscription = current;
        if (subscription == null || subscription.closed) {
            ringBuffer.discardPending();
            return;
        }
        closeStream(subscription);
        ringBuffer.discardPending();
        log.debug("Closed subscription: runId={}", subscription.runId);
    }

    /**
     * Closes the subscription and clears all pipeline state.
     */
    public void deselect() {
        close();
        reset();
        current = null;
    }

    public Run selectedRun() {
        return selectedRun;
    }

    /**
     * Id of the run being loaded or streamed, null when nothing is selected.
     */
    public String selectedRunId() {
        return current != null ? current.runId : null;
    }

    public boolean isStreamOpen() {
        return current != null && current.handle != null && !current.closed;
    }

    public RunStatus status() {
        return stateMachine.getStatus();
    }

    public List<MetricEvent> events() {
        return eventWindow.events();
    }

    public int telemetrySize() {
        return ringBuffer.size();
    }

    public TelemetrySnapshot telemetrySnapshot() {
        return new TelemetrySnapshot(
                selectedRunId(),
                stateMachine.getStatus(),
                isStreamOpen(),
                ringBuffer.snapshot(),
                ringBuffer.capacity(),
                eventWindow.size()
        );
    }

    /**
     * @throws RunActionException if the run is not selected or already terminal
     */
    public void guardCancel(String runId) {
        requireSelected(runId);
        stateMachine.requireCancellable(runId);
    }

    /**
     * @throws RunActionException if the run is not selected or has not completed
     */
    public void guardPromote(String runId) {
        requireSelected(runId);
        stateMachine.requirePromotable(runId);
    }

    /**
     * Applies one event through the pipeline.
     *
     * @return true if the event was new
     */
    boolean apply(MetricEvent event) {
        String key = MetricEventKeys.computeKey(event);
        if (!deduplicator.isNew(key)) {
            metricsConfig.getDeduplicatedEvents().increment();
            return false;
        }
        deduplicator.mark(key);
        if (eventWindow.append(event, key)) {
            deduplicator.clear();
            for (String retained : eventWindow.keys()) {
                deduplicator.mark(retained);
            }
            log.debug("Event window truncated to {} events, dedup set rebuilt", eventWindow.size());
        }
        stateMachine.apply(event);
        TelemetryPoint.from(event).ifPresent(ringBuffer::push);
        metricsConfig.getEventsApplied().increment();
        return true;
    }

    private void onHistoryLoaded(Subscription subscription, LoadedRun loaded, Throwable error) {
        if (subscription != current || subscription.closed) {
            log.debug("Dropping history of superseded subscription: runId={}", subscription.runId);
            return;
        }
        if (error == null && loaded.run() == null) {
            error = new IllegalStateException("Run " + subscription.runId + " not found");
        }
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            log.warn("Failed to load run {}: {}", subscription.runId, cause.getMessage());
            reset();
            subscription.closed = true;
            current = null;
            subscription.reportError(describe(cause));
            return;
        }

        selectedRun = loaded.run();
        stateMachine.seed(selectedRun.getStatus());
        List<MetricEvent> history = loaded.history() != null ? loaded.history() : List.of();
        int applied = 0;
        for (MetricEvent event : history) {
            if (event != null && apply(event)) {
                applied++;
            }
        }
        log.info("Loaded run {}: status={}, historyEvents={}, applied={}",
                subscription.runId, stateMachine.getStatus().getWireName(), history.size(), applied);

        subscription.listener.onRunLoaded(selectedRun);
        openStream(subscription);
    }

    private void openStream(Subscription subscription) {
        if (subscription != current || subscription.closed) {
            return;
        }
        StreamHandle handle;
        try {
            handle = controlApi.streamRun(subscription.runId, new LoopSink(subscription));
        } catch (RuntimeException e) {
            onStreamError(subscription, describe(e));
            return;
        }
        if (subscription.closed) {
            // Closed while opening, e.g. a terminal event delivered synchronously
            closeQuietly(subscription.runId, handle);
            return;
        }
        subscription.handle = handle;
        log.debug("Opened live stream: runId={}", subscription.runId);
    }

    private void onLiveEvent(Subscription subscription, MetricEvent event) {
        if (subscription != current || subscription.closed) {
            return;
        }
        apply(event);
        if (!isTerminalEvent(event)) {
            return;
        }
        closeStream(subscription);
        RunStatus terminal = stateMachine.isTerminal()
                ? stateMachine.getStatus()
                : RunStatus.fromWire(event.getStatus());
        if (selectedRun != null && terminal.isTerminal()) {
            selectedRun = selectedRun.withTerminalStatus(terminal, event.getTs());
        }
        log.info("Run {} finished: status={}", subscription.runId, stateMachine.getStatus().getWireName());
        subscription.listener.onComplete(selectedRun);
    }

    private void onStreamError(Subscription subscription, String message) {
        if (subscription != current || subscription.closed) {
            return;
        }
        closeStream(subscription);
        metricsConfig.getStreamErrors().increment();
        log.warn("Live stream failed: runId={}, error={}", subscription.runId, message);
        subscription.reportError(message);
    }

    private void closeStream(Subscription subscription) {
        subscription.closed = true;
        StreamHandle handle = subscription.handle;
        subscription.handle = null;
        if (handle != null) {
            closeQuietly(subscription.runId, handle);
        }
    }

    private void closeQuietly(String runId, StreamHandle handle) {
        try {
            handle.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close live stream of run {}: {}", runId, e.getMessage());
        }
    }

    private void reset() {
        ringBuffer.reset();
        stateMachine.reset();
        eventWindow.clear();
        deduplicator.clear();
        selectedRun = null;
    }

    private void requireSelected(String runId) {
        if (current == null || selectedRun == null || !current.runId.equals(runId)) {
            throw new RunActionException(
                    "Run " + runId + " is not the selected run",
                    runId,
                    RunActionException.RUN_NOT_SELECTED
            );
        }
    }

    private static boolean isTerminalEvent(MetricEvent event) {
        return event.getType() == MetricEventType.COMPLETE
                || (event.getStatus() != null && RunStatus.fromWire(event.getStatus()).isTerminal());
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private record LoadedRun(Run run, List<MetricEvent> history) {}

    private static final class Subscription {

        private final String runId;
        private final TelemetryListener listener;
        private StreamHandle handle;
        private boolean closed;
        private boolean errorReported;

        private Subscription(String runId, TelemetryListener listener) {
            this.runId = runId;
            this.listener = listener;
        }

        private void reportError(String message) {
            if (errorReported) {
                return;
            }
            errorReported = true;
            listener.onError(runId, message);
        }
    }

    /**
     * Re-posts transport callbacks onto the loop.
     */
    private final class LoopSink implements MetricEventSink {

        private final Subscription subscription;

        private LoopSink(Subscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void onEvent(MetricEvent event) {
            loop.execute(() -> onLiveEvent(subscription, event));
        }

        @Override
        public void onError(String message) {
            loop.execute(() -> onStreamError(subscription, message));
        }
    }
}
