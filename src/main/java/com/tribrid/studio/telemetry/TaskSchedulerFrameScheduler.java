package com.tribrid.studio.telemetry;

import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * FrameScheduler backed by a Spring TaskScheduler.
 *
 * The scheduler must be the one driving the studio loop so that flushes run
 * on the same thread as event application.
 */
public class TaskSchedulerFrameScheduler implements FrameScheduler {

    private final TaskScheduler taskScheduler;
    private final Duration frameInterval;

    public TaskSchedulerFrameScheduler(TaskScheduler taskScheduler, Duration frameInterval) {
        this.taskScheduler = taskScheduler;
        this.frameInterval = frameInterval;
    }

    @Override
    public FrameHandle schedule(Runnable task) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, Instant.now().plus(frameInterval));
        return () -> future.cancel(false);
    }
}
