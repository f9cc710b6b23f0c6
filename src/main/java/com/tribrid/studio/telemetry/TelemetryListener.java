package com.tribrid.studio.telemetry;

import com.tribrid.studio.control.model.Run;

/**
 * Callbacks from a TelemetryStreamConsumer subscription.
 *
 * Invoked on the studio loop thread.
 */
public interface TelemetryListener {

    /**
     * The run detail and its history have been applied.
     */
    default void onRunLoaded(Run run) {
    }

    /**
     * A terminal event arrived on the live stream; the stream is closed.
     *
     * @param run the selected run carrying its terminal status
     */
    void onComplete(Run run);

    /**
     * Loading or streaming failed. Called at most once per subscription.
     */
    void onError(String runId, String message);
}
