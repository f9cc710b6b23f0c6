package com.tribrid.studio.control;

import com.tribrid.studio.control.model.MetricEvent;
import com.tribrid.studio.control.model.OkResponse;
import com.tribrid.studio.control.model.Run;
import com.tribrid.studio.control.model.RunScope;
import com.tribrid.studio.control.model.StartRunRequest;
import com.tribrid.studio.control.model.StartRunResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Client for the external Training Control API.
 *
 * Pull calls complete asynchronously; a failed call completes exceptionally
 * with a {@link TrainingControlException}.
 */
public interface TrainingControlApi {

    /**
     * Lists runs.
     *
     * @param corpusId the corpus to list for (may be blank for scope ALL)
     * @param scope CORPUS or ALL
     * @param limit maximum number of runs
     * @return the runs, in backend order
     */
    CompletableFuture<List<Run>> listRuns(String corpusId, RunScope scope, int limit);

    /**
     * Fetches the detail of one run.
     *
     * @param runId the run identifier
     * @return the run
     */
    CompletableFuture<Run> getRun(String runId);

    /**
     * Fetches a bounded page of historical events, oldest first.
     *
     * @param runId the run identifier
     * @param limit maximum number of events
     * @return the events
     */
    CompletableFuture<List<MetricEvent>> getMetrics(String runId, int limit);

    /**
     * Opens a live push stream for a run.
     *
     * Events and errors are delivered on transport threads. After an error
     * the sink receives nothing further.
     *
     * @param runId the run identifier
     * @param sink receiver of events
     * @return handle that closes the stream
     */
    StreamHandle streamRun(String runId, MetricEventSink sink);

    CompletableFuture<OkResponse> cancelRun(String runId);

    CompletableFuture<OkResponse> promoteRun(String runId);

    CompletableFuture<StartRunResponse> startRun(StartRunRequest request);
}
