package com.tribrid.studio.telemetry;

/**
 * Schedules work for the next display-refresh opportunity.
 */
public interface FrameScheduler {

    /**
     * Schedules a task to run once at the next frame.
     *
     * @param task the task
     * @return handle that cancels the task if it has not run yet
     */
    FrameHandle schedule(Runnable task);

    @FunctionalInterface
    interface FrameHandle {
        void cancel();
    }
}
