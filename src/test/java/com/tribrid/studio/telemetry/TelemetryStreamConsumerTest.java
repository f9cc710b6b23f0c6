package com.tribrid.studio.telemetry;

import com.tribrid.studio.config.MetricsConfig;
import com.tribrid.studio.config.StudioConfig;
import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.MetricEventType;
import com.tribrid.studio.control.model.Run;
import com.tribrid.studio.control.model.RunStatus;
import com.tribrid.studio.support.ManualFrameScheduler;
import com.tribrid.studio.support.StubTrainingControlApi;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.tribrid.studio.support.MetricEvents.complete;
import static com.tribrid.studio.support.MetricEvents.log;
import static com.tribrid.studio.support.MetricEvents.run;
import static com.tribrid.studio.support.MetricEvents.state;
import static com.tribrid.studio.support.MetricEvents.telemetry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for TelemetryStreamConsumer on a direct loop with manual frames.
 */
class TelemetryStreamConsumerTest {

    private StubTrainingControlApi api;
    private ManualFrameScheduler frames;
    private MetricsConfig metricsConfig;
    private DefaultEventDeduplicator deduplicator;
    private RunStateMachine stateMachine;
    private TelemetryStreamConsumer consumer;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        api = new StubTrainingControlApi();
        frames = new ManualFrameScheduler();
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        deduplicator = new DefaultEventDeduplicator(new StudioConfig());
        stateMachine = new RunStateMachine();
        listener = new RecordingListener();
        consumer = newConsumer(new EventWindow(100));
    }

    // ==================== Selection ====================

    @Test
    void select_appliesHistoryInOrder_thenOpensStream() {
        api.withRun(run("r1", RunStatus.RUNNING),
                log("starting", "T1"),
                telemetry(1, 0.1, 0.2),
                telemetry(2, 0.3, 0.4));

        consumer.select("r1", listener);
        frames.runPending();

        assertThat(consumer.events()).extracting(MetricEvent::getTs)
                .containsExactly("T1", telemetry(1, 0, 0).getTs(), telemetry(2, 0, 0).getTs());
        assertThat(consumer.telemetrySnapshot().points()).extracting(TelemetryPoint::step).containsExactly(1L, 2L);
        assertThat(consumer.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(api.streams()).hasSize(1);
        assertThat(consumer.isStreamOpen()).isTrue();
        assertThat(listener.loaded).extracting(Run::getRunId).containsExactly("r1");
    }

    @Test
    void liveTelemetry_appearsAfterNextFrame() {
        api.withRun(run("r1", RunStatus.RUNNING));
        consumer.select("r1", listener);

        api.lastStream().emit(telemetry(5, 1.0, 2.0));
        api.lastStream().emit(telemetry(6, 1.5, 2.5));

        assertThat(consumer.telemetrySize()).isZero();
        frames.runPending();
        assertThat(consumer.telemetrySnapshot().points()).extracting(TelemetryPoint::step).containsExactly(5L, 6L);
    }

    @Test
    @DisplayName("A completed state event delivered by history and stream applies once")
    void duplicateCompletedEvent_appliedOnce() {
        MetricEvent completed = state("completed", "T1");
        api.withRun(run("r1", RunStatus.RUNNING), completed);

        consumer.select("r1", listener);
        api.lastStream().emit(state("completed", "T1"));

        assertThat(consumer.events()).hasSize(1);
        assertThat(deduplicator.size()).isEqualTo(1);
        assertThat(stateMachine.getTransitionCount()).isEqualTo(2); // unknown -> running -> completed
        assertThat(consumer.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(metricsConfig.getDeduplicatedEvents().count()).isEqualTo(1.0);
    }

    @Test
    void replayedTerminalEvent_closesStreamAndCompletesOnce() {
        api.withRun(run("r1", RunStatus.RUNNING), complete("completed", "T9"));

        consumer.select("r1", listener);
        api.lastStream().emit(complete("completed", "T9"));
        api.lastStream().fail("Connection lost");

        assertThat(api.lastStream().isClosed()).isTrue();
        assertThat(listener.completed).hasSize(1);
        assertThat(listener.completed.get(0).getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(listener.completed.get(0).getCompletedAt()).isEqualTo("T9");
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void terminalStatusOnLiveEvent_closesStream() {
        api.withRun(run("r1", RunStatus.RUNNING));
        consumer.select("r1", listener);

        api.lastStream().emit(state("failed", "T5"));
        api.lastStream().emit(log("late line", "T6"));

        assertThat(consumer.isStreamOpen()).isFalse();
        assertThat(consumer.status()).isEqualTo(RunStatus.FAILED);
        assertThat(consumer.selectedRun().getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(consumer.events()).extracting(MetricEvent::getTs).containsExactly("T5");
    }

    @Test
    @DisplayName("Evaluation and unrecognized events in history keep the run selected")
    void historyWithEvaluationEvents_loadsAndStreams() {
        api.withRun(run("r1", RunStatus.RUNNING),
                MetricEvent.builder().type(MetricEventType.PROGRESS).ts("T1").step(10L).epoch(0.5).percent(25.0).build(),
                MetricEvent.builder().type(MetricEventType.METRICS).ts("T2").step(10L)
                        .metrics(Map.of("eval_loss", 0.42)).build(),
                MetricEvent.builder().type(MetricEventType.UNKNOWN).ts("T3").build());

        consumer.select("r1", listener);
        api.lastStream().emit(MetricEvent.builder().type(MetricEventType.METRICS).ts("T4")
                .metrics(Map.of("eval_loss", 0.40)).build());

        assertThat(listener.errors).isEmpty();
        assertThat(consumer.isStreamOpen()).isTrue();
        assertThat(consumer.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(consumer.events()).extracting(MetricEvent::getType).containsExactly(
                MetricEventType.PROGRESS, MetricEventType.METRICS, MetricEventType.UNKNOWN, MetricEventType.METRICS);
        assertThat(consumer.events().get(0).getEpoch()).isEqualTo(0.5);
    }

    // ==================== Run switch ====================

    @Test
    @DisplayName("Switching runs closes the old stream before opening the new one")
    void switchRun_closesOldStream_andIgnoresItsEvents() {
        api.withRun(run("r1", RunStatus.RUNNING), telemetry(1, 0, 0));
        api.withRun(run("r2", RunStatus.RUNNING));

        consumer.select("r1", listener);
        StubTrainingControlApi.OpenedStream first = api.lastStream();
        consumer.select("r2", listener);
        first.emit(telemetry(99, 9, 9));
        frames.runPending();

        assertThat(first.closeCalls()).isEqualTo(1);
        assertThat(api.streams()).hasSize(2);
        assertThat(api.openStreamCount()).isEqualTo(1);
        assertThat(consumer.selectedRunId()).isEqualTo("r2");
        assertThat(consumer.events()).isEmpty();
        assertThat(consumer.telemetrySize()).isZero();
    }

    @Test
    void switchRun_dropsPendingPointsOfOldRun() {
        api.withRun(run("r1", RunStatus.RUNNING));
        api.withRun(run("r2", RunStatus.RUNNING));
        consumer.select("r1", listener);
        api.lastStream().emit(telemetry(1, 0, 0));

        consumer.select("r2", listener);
        frames.runPending();

        assertThat(consumer.telemetrySize()).isZero();
    }

    @Test
    void historyOfSupersededSelection_isDropped() {
        CompletableFuture<Run> slow = api.deferRun("r1");
        api.withRun(run("r2", RunStatus.RUNNING));

        consumer.select("r1", listener);
        consumer.select("r2", listener);
        slow.complete(run("r1", RunStatus.COMPLETED));

        assertThat(consumer.selectedRun().getRunId()).isEqualTo("r2");
        assertThat(consumer.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(api.streams()).extracting(StubTrainingControlApi.OpenedStream::runId).containsExactly("r2");
    }

    // ==================== Errors and close ====================

    @Test
    void streamError_reportedOnce_andStateKept() {
        api.withRun(run("r1", RunStatus.RUNNING), telemetry(1, 0, 0));
        consumer.select("r1", listener);
        frames.runPending();

        api.lastStream().fail("Connection lost");
        api.lastStream().fail("Connection lost");
        api.lastStream().emit(telemetry(2, 0, 0));
        frames.runPending();

        assertThat(listener.errors).containsExactly("r1: Connection lost");
        assertThat(api.lastStream().isClosed()).isTrue();
        assertThat(consumer.telemetrySize()).isEqualTo(1);
        assertThat(consumer.status()).isEqualTo(RunStatus.RUNNING);
        assertThat(metricsConfig.getStreamErrors().count()).isEqualTo(1.0);
    }

    @Test
    void historyFailure_clearsSelection_withoutOpeningStream() {
        consumer.select("missing", listener);

        assertThat(listener.errors).hasSize(1);
        assertThat(listener.errors.get(0)).startsWith("missing: ").contains("404");
        assertThat(api.streams()).isEmpty();
        assertThat(consumer.selectedRun()).isNull();
        assertThat(consumer.selectedRunId()).isNull();
    }

    @Test
    void close_isIdempotent_andStopsApplyingEvents() {
        api.withRun(run("r1", RunStatus.RUNNING));
        consumer.select("r1", listener);
        StubTrainingControlApi.OpenedStream stream = api.lastStream();
        stream.emit(telemetry(1, 0, 0));

        consumer.close();
        assertThatCode(consumer::close).doesNotThrowAnyException();
        stream.emit(telemetry(2, 0, 0));
        frames.runPending();

        assertThat(stream.closeCalls()).isEqualTo(1);
        assertThat(consumer.events()).hasSize(1);
        assertThat(consumer.telemetrySize()).isZero();
    }

    @Test
    void closeBeforeAnySelection_doesNotThrow() {
        assertThatCode(consumer::close).doesNotThrowAnyException();
    }

    @Test
    void deselect_clearsEverything() {
        api.withRun(run("r1", RunStatus.RUNNING), telemetry(1, 0, 0));
        consumer.select("r1", listener);
        frames.runPending();

        consumer.deselect();

        assertThat(consumer.selectedRunId()).isNull();
        assertThat(consumer.telemetrySize()).isZero();
        assertThat(consumer.status()).isEqualTo(RunStatus.UNKNOWN);
        assertThat(api.openStreamCount()).isZero();
    }

    // ==================== Guards ====================

    @Test
    void guards_requireSelectedRun() {
        api.withRun(run("r1", RunStatus.RUNNING));
        consumer.select("r1", listener);

        assertThatThrownBy(() -> consumer.guardCancel("r2"))
                .isInstanceOf(RunActionException.class)
                .extracting("errorCode")
                .isEqualTo(RunActionException.RUN_NOT_SELECTED);
        consumer.guardCancel("r1");
        assertThatThrownBy(() -> consumer.guardPromote("r1"))
                .isInstanceOf(RunActionException.class)
                .extracting("errorCode")
                .isEqualTo(RunActionException.RUN_NOT_PROMOTABLE);
    }

    // ==================== Event window ====================

    @Test
    void windowTruncation_rebuildsDedupFromRetainedEvents() {
        consumer = newConsumer(new EventWindow(10));
        MetricEvent[] history = new MetricEvent[12];
        for (int i = 0; i < history.length; i++) {
            history[i] = log("line " + i, "T" + i);
        }
        api.withRun(run("r1", RunStatus.RUNNING), history);

        consumer.select("r1", listener);

        assertThat(consumer.events()).hasSize(10);
        assertThat(deduplicator.size()).isEqualTo(10);

        // A retained event is still a duplicate; an evicted one is applied again
        api.lastStream().emit(log("line 11", "T11"));
        api.lastStream().emit(log("line 0", "T0"));

        assertThat(consumer.events()).hasSize(11);
        assertThat(consumer.events().get(10).getMessage()).isEqualTo("line 0");
    }

    private TelemetryStreamConsumer newConsumer(EventWindow window) {
        return new TelemetryStreamConsumer(
                api,
                deduplicator,
                new TelemetryRingBuffer(100, frames, metricsConfig),
                stateMachine,
                window,
                StudioLoop.direct(),
                metricsConfig,
                2_000
        );
    }

    private static final class RecordingListener implements TelemetryListener {

        private final List<Run> loaded = new ArrayList<>();
        private final List<Run> completed = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();

        @Override
        public void onRunLoaded(Run run) {
            loaded.add(run);
        }

        @Override
        public void onComplete(Run run) {
            completed.add(run);
        }

        @Override
        public void onError(String runId, String message) {
            errors.add(runId + ": " + message);
        }
    }
}
