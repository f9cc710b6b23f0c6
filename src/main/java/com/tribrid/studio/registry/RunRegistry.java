package com.tribrid.studio.registry;

import com.tribrid.studio.config.ControlApiConfig;
import com.tribrid.studio.control.TrainingControlApi;
import com.tribrid.studio.control.TrainingControlException;
import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.MetricEventType;
import com.tribrid.studio.control.model.OkResponse;
import com.tribrid.studio.control.model.Run;
import com.tribrid.studio.control.model.RunScope;
import com.tribrid.studio.control.model.RunStatus;
import com.tribrid.studio.control.model.StartRunRequest;
import com.tribrid.studio.control.model.StartRunResponse;
import com.tribrid.studio.export.MetricEventExporter;
import com.tribrid.studio.telemetry.RunActionException;
import com.tribrid.studio.telemetry.StudioLoop;
import com.tribrid.studio.telemetry.TelemetryListener;
import com.tribrid.studio.telemetry.TelemetrySnapshot;
import com.tribrid.studio.telemetry.TelemetryStreamConsumer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the studio: lists runs, selects the followed run and
 * performs guarded actions on it.
 *
 * Pipeline state is only touched on the studio loop; this service hands
 * work to the loop and blocks the calling request thread until it is done.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunRegistry implements TelemetryListener {

    private static final Set<MetricEventType> LOG_TYPES = EnumSet.of(
            MetricEventType.LOG,
            MetricEventType.ERROR,
            MetricEventType.STATE,
            MetricEventType.COMPLETE
    );

    private static final Comparator<Run> NEWEST_FIRST = Comparator.comparing(
            Run::getStartedAt,
            Comparator.nullsLast(Comparator.<String>reverseOrder())
    );

    private final TrainingControlApi controlApi;
    private final TelemetryStreamConsumer consumer;
    private final StudioLoop loop;
    private final RunHudFactory hudFactory;
    private final MetricEventExporter exporter;
    private final ControlApiConfig controlApiConfig;

    private final AtomicReference<List<Run>> runs = new AtomicReference<>(List.of());
    private final AtomicReference<RunError> lastError = new AtomicReference<>();

    // Loop-confined
    private Instant logsClearedAt;

    /**
     * Lists runs, newest first.
     *
     * @param corpusId the corpus; required for scope CORPUS
     * @param scope CORPUS to filter to the corpus, ALL for every run
     * @return the runs ordered by start time descending, undated runs last
     */
    public List<Run> listRuns(String corpusId, RunScope scope) {
        if (scope == RunScope.CORPUS && (corpusId == null || corpusId.isBlank())) {
            throw new IllegalArgumentException("corpusId is required for scope 'corpus'");
        }
        List<Run> fetched = await(controlApi.listRuns(corpusId, scope, controlApiConfig.getRunsLimit()));

        List<Run> result = new ArrayList<>();
        for (Run run : fetched) {
            if (scope == RunScope.ALL || corpusId.equals(run.getCorpusId())) {
                result.add(run);
            }
        }
        result.sort(NEWEST_FIRST);
        runs.set(List.copyOf(result));
        log.debug("Listed {} runs (scope={}, corpusId={})", result.size(), scope.getWireName(), corpusId);
        return result;
    }

    /**
     * The runs returned by the last listing, with terminal updates applied.
     */
    public List<Run> cachedRuns() {
        return runs.get();
    }

    /**
     * Follows a run. Returns once the previous run is closed and the
     * pipeline reset; history and stream load in the background.
     */
    public void selectRun(String runId) {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        loop.run(() -> {
            logsClearedAt = null;
            consumer.select(runId, this);
        });
    }

    public void clearSelection() {
        loop.run(() -> {
            logsClearedAt = null;
            consumer.deselect();
        });
        log.info("Selection cleared");
    }

    /**
     * Starts a run, refreshes the listing of its corpus and selects it.
     *
     * @return the new run as listed, or a queued placeholder if the listing lags
     */
    public Run startRun(StartRunRequest request) {
        StartRunResponse response = await(controlApi.startRun(request));
        if (!response.isOk() || response.getRunId() == null) {
            throw new TrainingControlException(
                    "Start rejected for corpus " + request.getCorpusId(),
                    null,
                    TrainingControlException.CONTROL_API_REJECTED
            );
        }
        String runId = response.getRunId();
        log.info("Started run: runId={}, corpusId={}", runId, request.getCorpusId());

        Run started = null;
        try {
            started = listRuns(request.getCorpusId(), RunScope.CORPUS).stream()
                    .filter(run -> runId.equals(run.getRunId()))
                    .findFirst()
                    .orElse(null);
        } catch (TrainingControlException e) {
            log.warn("Failed to refresh runs after start of {}: {}", runId, e.getMessage());
        }
        selectRun(runId);
        return started != null
                ? started
                : Run.builder().runId(runId).corpusId(request.getCorpusId()).status(RunStatus.QUEUED).build();
    }

    /**
     * Requests cancellation of the selected run.
     *
     * The run status is left alone; it turns cancelled only when the
     * backend reports it on the stream.
     *
     * @throws RunActionException if the run is not selected or already terminal
     * @throws TrainingControlException if the backend fails or rejects the request
     */
    public void cancel(String runId) {
        loop.run(() -> consumer.guardCancel(runId));
        requireAccepted("Cancel", runId, await(controlApi.cancelRun(runId)));
        log.info("Cancel requested: runId={}", runId);
    }

    /**
     * Promotes the selected run's artifact.
     *
     * @throws RunActionException if the run is not selected or not completed
     * @throws TrainingControlException if the backend fails or rejects the request
     */
    public void promote(String runId) {
        loop.run(() -> consumer.guardPromote(runId));
        requireAccepted("Promote", runId, await(controlApi.promoteRun(runId)));
        log.info("Run promoted: runId={}", runId);
    }

    public Optional<Run> currentRun() {
        return Optional.ofNullable(loop.call(consumer::selectedRun));
    }

    public TelemetrySnapshot telemetry() {
        return loop.call(consumer::telemetrySnapshot);
    }

    /**
     * Retained events whose message or type contains the query, ignoring case.
     */
    public List<MetricEvent> events(String query) {
        List<MetricEvent> events = loop.call(consumer::events);
        String q = query != null ? query.trim().toLowerCase(Locale.ROOT) : "";
        if (q.isEmpty()) {
            return events;
        }
        List<MetricEvent> matches = new ArrayList<>();
        for (MetricEvent event : events) {
            String message = event.getMessage() != null ? event.getMessage().toLowerCase(Locale.ROOT) : "";
            String type = event.getType() != null ? event.getType().getWireName() : "";
            if (message.contains(q) || type.contains(q)) {
                matches.add(event);
            }
        }
        return matches;
    }

    /**
     * Log, error, state and complete events not hidden by {@link #clearLogs()}.
     */
    public List<MetricEvent> logEvents() {
        return loop.call(() -> {
            List<MetricEvent> logs = new ArrayList<>();
            for (MetricEvent event : consumer.events()) {
                if (LOG_TYPES.contains(event.getType()) && !clearedFromLogs(event)) {
                    logs.add(event);
                }
            }
            return logs;
        });
    }

    /**
     * Hides the current log lines from {@link #logEvents()}; retained events are kept.
     */
    public void clearLogs() {
        loop.run(() -> logsClearedAt = Instant.now());
    }

    /**
     * @throws RunActionException if no run is loaded
     */
    public RunHud hud() {
        RunHud hud = loop.call(() -> {
            Run run = consumer.selectedRun();
            if (run == null) {
                return null;
            }
            return hudFactory.create(run, consumer.status(), consumer.events(),
                    consumer.telemetrySize(), consumer.isStreamOpen());
        });
        if (hud == null) {
            throw noSelection();
        }
        return hud;
    }

    /**
     * @throws RunActionException if no run is loaded
     */
    public MetricEventExporter.MetricExport download() {
        Run run = currentRun().orElseThrow(RunRegistry::noSelection);
        return exporter.export(run.getRunId(), loop.call(consumer::events));
    }

    public Optional<RunError> lastError() {
        return Optional.ofNullable(lastError.get());
    }

    @Override
    public void onRunLoaded(Run run) {
        replaceCached(run);
    }

    @Override
    public void onComplete(Run run) {
        if (run != null) {
            replaceCached(run);
            log.info("Run {} reached status {}", run.getRunId(), run.getStatus().getWireName());
        }
    }

    @Override
    public void onError(String runId, String message) {
        lastError.set(new RunError(runId, message, Instant.now()));
        log.warn("Telemetry error for run {}: {}", runId, message);
    }

    private boolean clearedFromLogs(MetricEvent event) {
        if (logsClearedAt == null) {
            return false;
        }
        Instant ts = RunHudFactory.parseInstant(event.getTs());
        return ts != null && ts.isBefore(logsClearedAt);
    }

    private void replaceCached(Run updated) {
        runs.updateAndGet(current -> {
            List<Run> next = new ArrayList<>(current.size());
            for (Run run : current) {
                next.add(updated.getRunId().equals(run.getRunId()) ? updated : run);
            }
            return List.copyOf(next);
        });
    }

    private static void requireAccepted(String action, String runId, OkResponse response) {
        if (response == null || !response.isOk()) {
            String reason = response != null && response.getError() != null ? response.getError() : "not accepted";
            log.warn("{} rejected for run {}: {}", action, runId, reason);
            throw new TrainingControlException(
                    action + " rejected for run " + runId + ": " + reason,
                    runId,
                    TrainingControlException.CONTROL_API_REJECTED
            );
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TrainingControlException) {
                throw (TrainingControlException) cause;
            }
            throw new TrainingControlException("Training Control API call failed: " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new TrainingControlException("Training Control API call was cancelled", e);
        }
    }

    private static RunActionException noSelection() {
        return new RunActionException("No run selected", null, RunActionException.RUN_NOT_SELECTED);
    }

    /**
     * Last load or stream failure reported by the pipeline.
     */
    public record RunError(String runId, String message, Instant at) {}
}
