package com.tribrid.studio.control;

import com.tribrid.studio.control.model.MetricEvent;

/**
 * Receiver of a live metric stream.
 */
public interface MetricEventSink {

    /**
     * Called for every well-formed event, in delivery order.
     */
    void onEvent(MetricEvent event);

    /**
     * Called at most once when the transport fails or the server drops the
     * connection.
     */
    void onError(String message);
}
