package com.imagefan.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool scheduler. Items wait in a FIFO queue and are handed to workers as
 * slots free up; at most {@code maxConcurrency} workers run at any instant, across
 * every batch submitted to this dispatcher.
 *
 * <p>All bookkeeping (queue, slot count, outcome slots) lives on a single
 * coordinator thread. Workers talk to it only through the outcome they report,
 * which is posted back onto that thread, so none of that state is locked.
 *
 * <p>A per-item failure is recorded like any other outcome. The future returned by
 * {@link #run(List)} fails only when a worker cannot be started at all; the refused
 * item and the items still queued behind it then get {@link Stage#WORKER} outcomes.
 */
public class Dispatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    private static final AtomicInteger SEQ = new AtomicInteger();

    private final DispatcherConfig cfg;
    private final WorkerLauncher launcher;
    private final DispatcherListener listener;
    private final BatchStats stats = new BatchStats();
    private final ScheduledThreadPoolExecutor coordinator;

    // coordinator thread only
    private final Deque<Assignment> pending = new ArrayDeque<>();
    private final Set<Assignment> running = new LinkedHashSet<>();
    private final Set<Batch> live = new LinkedHashSet<>();
    private int active = 0;

    public Dispatcher(DispatcherConfig cfg, WorkerLauncher launcher) {
        this(cfg, launcher, DispatcherListener.NONE);
    }

    public Dispatcher(DispatcherConfig cfg, WorkerLauncher launcher, DispatcherListener listener) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.listener = listener == null ? DispatcherListener.NONE : listener;

        String threadName = "dispatcher-" + SEQ.incrementAndGet();
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName(threadName);
            return t;
        });
        // recorded items cancel their deadline; drop it from the queue right away
        executor.setRemoveOnCancelPolicy(true);
        this.coordinator = executor;
    }

    public BatchStats stats() { return stats; }

    int queuedTimers() { return coordinator.getQueue().size(); }

    /**
     * Queues a batch. The returned future completes once every item has an outcome;
     * outcomes are listed in batch order whatever order the workers finished in.
     * Dependent stages attached without an executor run on the coordinator thread.
     *
     * @throws IllegalArgumentException if two items share a name
     * @throws IllegalStateException    if the dispatcher has been closed
     */
    public CompletableFuture<BatchResult> run(List<WorkItem> items) {
        Objects.requireNonNull(items, "items");
        requireUniqueNames(items);

        if (items.isEmpty()) {
            log.info("Empty batch, no workers started");
            return CompletableFuture.completedFuture(BatchResult.empty());
        }

        Batch batch = new Batch(items);
        try {
            coordinator.execute(() -> enqueue(batch));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Dispatcher is closed", e);
        }
        return batch.result;
    }

    /** Cancels running workers, fails unfinished batches and stops the coordinator. */
    @Override
    public void close() {
        if (coordinator.isShutdown()) return;

        try {
            coordinator.submit(this::abandonAll).get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Could not abandon outstanding work cleanly", e);
        } catch (RejectedExecutionException e) {
            log.debug("Dispatcher already shutting down");
        }

        coordinator.shutdown();
        try {
            coordinator.awaitTermination(10, TimeUnit.SECONDS);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    // -------------------------------------------------------------------------
    // coordinator thread

    private void enqueue(Batch batch) {
        live.add(batch);
        for (int i = 0; i < batch.items.size(); i++) {
            pending.add(new Assignment(batch, i));
        }
        log.info("Batch of {} items queued (maxConcurrency={}, pending={})",
                batch.items.size(), cfg.maxConcurrency, pending.size());
        pump();
    }

    /** Fills free slots from the head of the queue. */
    private void pump() {
        while (active < cfg.maxConcurrency) {
            Assignment next = pending.poll();
            if (next == null) return;
            start(next);
        }
    }

    private void start(Assignment a) {
        active++;
        a.batch.inFlight++;
        a.startNanos = System.nanoTime();
        stats.peakActive.accumulate(active);
        running.add(a);

        try {
            a.handle = launcher.launch(a.item, outcome -> deliver(a, outcome));
        } catch (WorkerStartException | RuntimeException e) {
            active--;
            a.batch.inFlight--;
            a.done = true;
            running.remove(a);

            WorkerStartException fault = e instanceof WorkerStartException
                    ? (WorkerStartException) e
                    : new WorkerStartException(a.item.name, e);
            log.error("Worker start refused for {}, abandoning the rest of its batch", a.item.name, fault);
            Batch batch = a.batch;
            batch.fault = fault;
            batch.settle(a.index, WorkOutcome.failed(a.item.name, WorkFailure.of(Stage.WORKER, fault)));
            stats.failed.increment();
            for (Iterator<Assignment> it = pending.iterator(); it.hasNext(); ) {
                Assignment p = it.next();
                if (p.batch != batch) continue;
                it.remove();
                p.done = true;
                batch.settle(p.index, WorkOutcome.failed(p.item.name,
                        new WorkFailure(Stage.WORKER, null, "not started: batch faulted")));
                stats.failed.increment();
            }
            finishIfDone(batch);
            return;
        }

        stats.started.increment();
        log.debug("Started {} (active={}/{})", a.item.name, active, cfg.maxConcurrency);
        notifyListener(() -> listener.onStart(a.item));

        if (cfg.hasTimeout()) {
            a.deadline = coordinator.schedule(() -> expire(a),
                    cfg.workerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /** Worker side: hands the outcome to the coordinator. */
    private void deliver(Assignment a, WorkOutcome outcome) {
        try {
            coordinator.execute(() -> record(a, outcome));
        } catch (RejectedExecutionException e) {
            log.warn("Dispatcher closed, dropping outcome of {}", a.item.name);
        }
    }

    private void record(Assignment a, WorkOutcome outcome) {
        if (a.done) {
            log.debug("Ignoring late outcome of {}", a.item.name);
            return;
        }
        a.done = true;
        running.remove(a);
        if (a.deadline != null) {
            a.deadline.cancel(false);
        }

        WorkOutcome checked;
        if (outcome == null) {
            checked = WorkOutcome.failed(a.item.name,
                    new WorkFailure(Stage.WORKER, null, "worker reported no outcome"));
        } else if (!a.item.name.equals(outcome.name)) {
            checked = WorkOutcome.failed(a.item.name,
                    new WorkFailure(Stage.WORKER, null, "worker reported for '" + outcome.name + "'"));
        } else {
            checked = outcome;
        }
        WorkOutcome recorded = checked.withElapsed(
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - a.startNanos));

        active--;
        Batch batch = a.batch;
        batch.inFlight--;
        batch.settle(a.index, recorded);

        if (recorded.succeeded()) {
            stats.succeeded.increment();
            log.debug("{} succeeded in {}ms", recorded.name, recorded.elapsedMillis);
        } else {
            stats.failed.increment();
            log.warn("{} failed {}", recorded.name, recorded.error);
        }
        notifyListener(() -> listener.onOutcome(recorded));

        pump();
        finishIfDone(batch);
    }

    private void expire(Assignment a) {
        if (a.done) return;

        log.error("{} reported nothing within {}ms, cancelling its worker",
                a.item.name, cfg.workerTimeout.toMillis());
        stats.timedOut.increment();
        try {
            a.handle.cancel();
        } catch (RuntimeException e) {
            log.warn("Cancelling worker for {} failed", a.item.name, e);
        }
        record(a, WorkOutcome.failed(a.item.name, new WorkFailure(Stage.TIMEOUT, null,
                "no outcome within " + cfg.workerTimeout.toMillis() + "ms")));
    }

    private void finishIfDone(Batch batch) {
        if (batch.result.isDone()) return;

        if (batch.fault != null) {
            if (batch.inFlight == 0) {
                live.remove(batch);
                batch.result.completeExceptionally(new BatchFaultException(
                        batch.fault.getMessage(), batch.fault, batch.recordedOutcomes()));
            }
            return;
        }

        if (batch.recorded == batch.items.size()) {
            live.remove(batch);
            long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - batch.startNanos);
            BatchResult result = new BatchResult(Arrays.asList(batch.outcomes), ms);
            log.info("Batch of {} items finished in {}ms: {} succeeded, {} failed",
                    result.size(), ms, result.succeeded().size(), result.failed().size());
            batch.result.complete(result);
        }
    }

    private void abandonAll() {
        pending.clear();
        for (Assignment a : running) {
            a.done = true;
            if (a.deadline != null) a.deadline.cancel(false);
            if (a.handle != null) {
                try {
                    a.handle.cancel();
                } catch (RuntimeException e) {
                    log.warn("Cancelling worker for {} failed", a.item.name, e);
                }
            }
        }
        running.clear();
        active = 0;

        for (Batch b : live) {
            b.result.completeExceptionally(new BatchFaultException(
                    "Dispatcher closed before the batch finished", null, b.recordedOutcomes()));
        }
        if (!live.isEmpty()) {
            log.warn("Dispatcher closed with {} unfinished batch(es)", live.size());
        }
        live.clear();
    }

    private void notifyListener(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Dispatcher listener threw", e);
        }
    }

    private static void requireUniqueNames(List<WorkItem> items) {
        Set<String> seen = new HashSet<>();
        for (WorkItem item : items) {
            Objects.requireNonNull(item, "batch contains a null item");
            if (!seen.add(item.name)) {
                throw new IllegalArgumentException("Duplicate work item name '" + item.name
                        + "': outputs would collide in the same directory");
            }
        }
    }

    private static final class Batch {
        final List<WorkItem> items;
        final WorkOutcome[] outcomes;
        final long startNanos = System.nanoTime();
        final CompletableFuture<BatchResult> result = new CompletableFuture<>();

        int recorded = 0;
        int inFlight = 0;
        WorkerStartException fault;

        Batch(List<WorkItem> items) {
            this.items = List.copyOf(items);
            this.outcomes = new WorkOutcome[items.size()];
        }

        void settle(int index, WorkOutcome outcome) {
            outcomes[index] = outcome;
            recorded++;
        }

        List<WorkOutcome> recordedOutcomes() {
            List<WorkOutcome> out = new ArrayList<>();
            for (WorkOutcome o : outcomes) {
                if (o != null) out.add(o);
            }
            return out;
        }
    }

    private static final class Assignment {
        final Batch batch;
        final int index;
        final WorkItem item;

        WorkerHandle handle;
        ScheduledFuture<?> deadline;
        long startNanos;
        boolean done;

        Assignment(Batch batch, int index) {
            this.batch = batch;
            this.index = index;
            this.item = batch.items.get(index);
        }
    }
}
