package com.imagefan.engine;

import java.util.function.Consumer;

/**
 * Starts an isolated worker for one item. The worker's only input is the item
 * handed over here; its only output is the outcome passed to {@code onOutcome}.
 */
public interface WorkerLauncher extends AutoCloseable {

    /**
     * Starts a worker for {@code item}. The launcher must pass exactly one outcome
     * to {@code onOutcome}, from any thread, including when the worker dies without
     * reporting (a {@link Stage#WORKER} failure). Cancelled workers may stay silent.
     *
     * @throws WorkerStartException if no worker could be started
     */
    WorkerHandle launch(WorkItem item, Consumer<WorkOutcome> onOutcome) throws WorkerStartException;

    /** Releases threads held for running workers. */
    @Override
    default void close() {}
}
