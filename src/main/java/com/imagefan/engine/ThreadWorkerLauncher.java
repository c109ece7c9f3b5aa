package com.imagefan.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs each worker on its own thread. The worker sees only its {@link WorkItem}
 * and hands back only its {@link WorkOutcome}.
 *
 * <p>Threads come from an unbounded cached pool: the dispatcher already bounds how
 * many are live, and a worker abandoned after a timeout must not hold up the next.
 */
public class ThreadWorkerLauncher implements WorkerLauncher {
    private static final Logger log = LoggerFactory.getLogger(ThreadWorkerLauncher.class);

    private final ItemProcessor processor;
    private final ExecutorService workers;

    public ThreadWorkerLauncher(ItemProcessor processor) {
        this.processor = Objects.requireNonNull(processor, "processor");
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("worker-" + seq.incrementAndGet());
            return t;
        });
    }

    @Override
    public WorkerHandle launch(WorkItem item, Consumer<WorkOutcome> onOutcome) throws WorkerStartException {
        Future<?> f;
        try {
            f = workers.submit(() -> onOutcome.accept(runIsolated(item)));
        } catch (RejectedExecutionException e) {
            throw new WorkerStartException(item.name, e);
        }
        return () -> f.cancel(true);
    }

    private WorkOutcome runIsolated(WorkItem item) {
        try {
            WorkOutcome outcome = processor.process(item);
            if (outcome == null) {
                return WorkOutcome.failed(item.name, new WorkFailure(Stage.WORKER, null, "processor returned no outcome"));
            }
            return outcome;
        } catch (Throwable t) {
            // a crash of the worker body still produces exactly one outcome
            log.error("Worker for {} crashed", item.name, t);
            return WorkOutcome.failed(item.name, WorkFailure.of(Stage.WORKER, t));
        }
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
