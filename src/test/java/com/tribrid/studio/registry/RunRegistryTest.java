package com.tribrid.studio.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tribrid.studio.config.ControlApiConfig;
import com.tribrid.studio.config.MetricsConfig;
import com.tribrid.studio.config.StudioConfig;
import com.tribrid.studio.control.TrainingControlException;
import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.MetricEventType;
import com.tribrid.studio.control.model.OkResponse;
import com.tribrid.studio.control.model.Run;
import com.tribrid.studio.control.model.RunScope;
import com.tribrid.studio.control.model.RunStatus;
import com.tribrid.studio.control.model.StartRunRequest;
import com.tribrid.studio.export.MetricEventExporter;
import com.tribrid.studio.support.ManualFrameScheduler;
import com.tribrid.studio.support.StubTrainingControlApi;
import com.tribrid.studio.telemetry.DefaultEventDeduplicator;
import com.tribrid.studio.telemetry.EventWindow;
import com.tribrid.studio.telemetry.RunActionException;
import com.tribrid.studio.telemetry.RunStateMachine;
import com.tribrid.studio.telemetry.StudioLoop;
import com.tribrid.studio.telemetry.TelemetryRingBuffer;
import com.tribrid.studio.telemetry.TelemetryStreamConsumer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tribrid.studio.support.MetricEvents.log;
import static com.tribrid.studio.support.MetricEvents.run;
import static com.tribrid.studio.support.MetricEvents.state;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunRegistryTest {

    private StubTrainingControlApi api;
    private ManualFrameScheduler frames;
    private RunRegistry registry;

    @BeforeEach
    void setUp() {
        api = new StubTrainingControlApi();
        frames = new ManualFrameScheduler();
        MetricsConfig metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        StudioLoop loop = StudioLoop.direct();

        TelemetryStreamConsumer consumer = new TelemetryStreamConsumer(
                api,
                new DefaultEventDeduplicator(new StudioConfig()),
                new TelemetryRingBuffer(1_000, frames, metricsConfig),
                new RunStateMachine(),
                new EventWindow(100),
                loop,
                metricsConfig,
                2_000
        );
        registry = new RunRegistry(
                api,
                consumer,
                loop,
                new RunHudFactory(),
                new MetricEventExporter(new ObjectMapper()),
                new ControlApiConfig()
        );
    }

    // ==================== Listing ====================

    @Test
    void listRuns_corpusScope_filtersAndSortsNewestFirst() {
        api.withRun(dated("old", "corpus-a", "2025-01-01T00:00:00Z"));
        api.withRun(dated("new", "corpus-a", "2025-03-01T00:00:00Z"));
        api.withRun(dated("undated", "corpus-a", null));
        api.withRun(dated("other", "corpus-b", "2025-04-01T00:00:00Z"));

        List<Run> runs = registry.listRuns("corpus-a", RunScope.CORPUS);

        assertThat(runs).extracting(Run::getRunId).containsExactly("new", "old", "undated");
        assertThat(registry.cachedRuns()).hasSize(3);
    }

    @Test
    void listRuns_allScope_keepsEveryCorpus() {
        api.withRun(dated("a", "corpus-a", "2025-01-01T00:00:00Z"));
        api.withRun(dated("b", "corpus-b", "2025-02-01T00:00:00Z"));

        assertThat(registry.listRuns(null, RunScope.ALL)).extracting(Run::getRunId).containsExactly("b", "a");
    }

    @Test
    void listRuns_corpusScopeWithoutCorpus_rejected() {
        assertThatThrownBy(() -> registry.listRuns(" ", RunScope.CORPUS))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void selectRun_blankId_rejected() {
        assertThatThrownBy(() -> registry.selectRun(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Guarded actions ====================

    @Test
    @DisplayName("Cancel goes to the backend but leaves the status until the stream reports it")
    void cancel_running_callsApi_withoutChangingStatus() {
        api.withRun(run("r1", RunStatus.RUNNING));
        registry.selectRun("r1");

        registry.cancel("r1");

        assertThat(api.cancelCalls()).isEqualTo(1);
        assertThat(registry.telemetry().status()).isEqualTo(RunStatus.RUNNING);

        api.lastStream().emit(state("cancelled", "T2"));
        assertThat(registry.telemetry().status()).isEqualTo(RunStatus.CANCELLED);
    }

    @Test
    void cancel_terminalRun_rejectedWithoutNetworkCall() {
        api.withRun(run("r1", RunStatus.COMPLETED));
        registry.selectRun("r1");

        assertThatThrownBy(() -> registry.cancel("r1"))
                .isInstanceOf(RunActionException.class)
                .extracting("errorCode")
                .isEqualTo(RunActionException.RUN_NOT_CANCELLABLE);
        assertThat(api.cancelCalls()).isZero();
    }

    @Test
    void cancel_rejectedByBackend_surfacesError_andKeepsStatus() {
        api.withRun(run("r1", RunStatus.RUNNING));
        api.setCancelResponse(OkResponse.rejected("worker gone"));
        registry.selectRun("r1");

        assertThatThrownBy(() -> registry.cancel("r1"))
                .isInstanceOf(TrainingControlException.class)
                .hasMessageContaining("worker gone")
                .extracting("errorCode")
                .isEqualTo(TrainingControlException.CONTROL_API_REJECTED);
        assertThat(registry.telemetry().status()).isEqualTo(RunStatus.RUNNING);
    }

    @Test
    void cancel_unselectedRun_rejected() {
        api.withRun(run("r1", RunStatus.RUNNING));
        registry.selectRun("r1");

        assertThatThrownBy(() -> registry.cancel("r2"))
                .isInstanceOf(RunActionException.class)
                .extracting("errorCode")
                .isEqualTo(RunActionException.RUN_NOT_SELECTED);
    }

    @Test
    void promote_running_rejectedWithoutNetworkCall() {
        api.withRun(run("r1", RunStatus.RUNNING));
        registry.selectRun("r1");

        assertThatThrownBy(() -> registry.promote("r1"))
                .isInstanceOf(RunActionException.class)
                .extracting("errorCode")
                .isEqualTo(RunActionException.RUN_NOT_PROMOTABLE);
        assertThat(api.promoteCalls()).isZero();
    }

    @Test
    void promote_completed_callsApi() {
        api.withRun(run("r1", RunStatus.RUNNING), state("completed", "T1"));
        registry.selectRun("r1");

        registry.promote("r1");

        assertThat(api.promoteCalls()).isEqualTo(1);
    }

    // ==================== Completion and errors ====================

    @Test
    void completion_updatesCachedRun() {
        api.withRun(run("r1", RunStatus.RUNNING));
        registry.listRuns("corpus-a", RunScope.CORPUS);
        registry.selectRun("r1");

        api.lastStream().emit(MetricEvent.builder()
                .type(MetricEventType.COMPLETE)
                .status("completed")
                .ts("2025-01-01T01:00:00Z")
                .build());

        Run cached = registry.cachedRuns().get(0);
        assertThat(cached.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(cached.getCompletedAt()).isEqualTo("2025-01-01T01:00:00Z");
        assertThat(registry.currentRun()).get().extracting(Run::getStatus).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void streamError_recordedAsLastError() {
        api.withRun(run("r1", RunStatus.RUNNING));
        registry.selectRun("r1");

        api.lastStream().fail("Connection lost");

        assertThat(registry.lastError()).get()
                .satisfies(error -> {
                    assertThat(error.runId()).isEqualTo("r1");
                    assertThat(error.message()).isEqualTo("Connection lost");
                });
    }

    @Test
    void startRun_selectsNewRun() {
        Run started = registry.startRun(StartRunRequest.builder().corpusId("corpus-a").build());

        assertThat(started.getRunId()).isEqualTo("corpus-a__new");
        assertThat(registry.currentRun()).get().extracting(Run::getRunId).isEqualTo("corpus-a__new");
        assertThat(api.lastStream().runId()).isEqualTo("corpus-a__new");
    }

    // ==================== Views ====================

    @Test
    void events_filteredByMessageOrType_ignoringCase() {
        api.withRun(run("r1", RunStatus.RUNNING),
                log("Loading corpus", "T1"),
                log("Epoch 1 done", "T2"),
                state("running", "T3"));
        registry.selectRun("r1");

        assertThat(registry.events("EPOCH")).extracting(MetricEvent::getTs).containsExactly("T2");
        assertThat(registry.events("state")).extracting(MetricEvent::getTs).containsExactly("T3");
        assertThat(registry.events(" ")).hasSize(3);
    }

    @Test
    void logEvents_onlyLogTypes_andClearHidesOlderLines() {
        api.withRun(run("r1", RunStatus.RUNNING),
                log("old line", "2020-01-01T00:00:00Z"),
                MetricEvent.builder().type(MetricEventType.PROGRESS).percent(10.0).ts("2020-01-01T00:00:01Z").build(),
                log("undated line", "not-a-date"));
        registry.selectRun("r1");

        assertThat(registry.logEvents()).extracting(MetricEvent::getMessage)
                .containsExactly("old line", "undated line");

        registry.clearLogs();
        api.lastStream().emit(log("new line", "2999-01-01T00:00:00Z"));

        assertThat(registry.logEvents()).extracting(MetricEvent::getMessage)
                .containsExactly("undated line", "new line");
        assertThat(registry.events(null)).hasSize(4);
    }

    @Test
    void hud_withoutSelection_rejected() {
        assertThatThrownBy(() -> registry.hud())
                .isInstanceOf(RunActionException.class)
                .extracting("errorCode")
                .isEqualTo(RunActionException.RUN_NOT_SELECTED);
    }

    @Test
    void hud_reflectsStateMachineStatus() {
        api.withRun(run("r1", RunStatus.RUNNING),
                MetricEvent.builder().type(MetricEventType.PROGRESS).percent(40.0).ts("T1").build());
        registry.selectRun("r1");

        RunHud hud = registry.hud();

        assertThat(hud.getRunId()).isEqualTo("r1");
        assertThat(hud.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(hud.getProgressLabel()).isEqualTo("40%");
        assertThat(hud.isStreamOpen()).isTrue();
    }

    @Test
    void download_exportsRetainedEvents() {
        api.withRun(run("r1", RunStatus.RUNNING), log("a", "T1"), log("b", "T2"));
        registry.selectRun("r1");

        MetricEventExporter.MetricExport export = registry.download();

        assertThat(export.fileName()).isEqualTo("train-r1.metrics.jsonl");
        assertThat(export.eventCount()).isEqualTo(2);
        assertThat(export.body().lines()).hasSize(2);
    }

    @Test
    void clearSelection_closesStream() {
        api.withRun(run("r1", RunStatus.RUNNING));
        registry.selectRun("r1");

        registry.clearSelection();

        assertThat(api.openStreamCount()).isZero();
        assertThat(registry.currentRun()).isEmpty();
    }

    private static Run dated(String runId, String corpusId, String startedAt) {
        return Run.builder()
                .runId(runId)
                .corpusId(corpusId)
                .status(RunStatus.COMPLETED)
                .startedAt(startedAt)
                .build();
    }
}
