package com.tribrid.studio.telemetry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * The single-threaded event loop that owns all telemetry pipeline state.
 *
 * Transport callbacks and reads from request threads are funnelled through
 * this executor, so pipeline objects never need locking. {@link #call}
 * blocks the caller and must not be used from the loop thread itself.
 */
public class StudioLoop implements Executor {

    private final Executor executor;

    public StudioLoop(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * A loop that runs every task on the calling thread.
     */
    public static StudioLoop direct() {
        return new StudioLoop(Runnable::run);
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(task);
    }

    /**
     * Runs the task on the loop and waits for its result.
     * Runtime exceptions thrown by the task are rethrown as-is.
     */
    public <T> T call(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * Runs the task on the loop and waits for it to finish.
     */
    public void run(Runnable task) {
        call(() -> {
            task.run();
            return null;
        });
    }
}
