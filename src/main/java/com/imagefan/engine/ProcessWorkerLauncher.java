package com.imagefan.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs each worker in a child process, so a worker shares no memory with the
 * coordinator or its siblings. The start payload goes in on the child's stdin;
 * the completion message comes back as a JSON line on its stdout. Stdout and
 * stderr are drained on separate threads so a chatty child cannot block on a
 * full pipe.
 *
 * <p>A child that exits without a completion message is reported as a
 * {@link Stage#WORKER} failure carrying its exit code and first stderr line.
 */
public class ProcessWorkerLauncher implements WorkerLauncher {
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    private final List<String> command;
    private final ExecutorService io;

    /** @param command full argument list of the worker process (no shell expansion) */
    public ProcessWorkerLauncher(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("worker command must not be empty");
        }
        this.command = List.copyOf(command);
        AtomicInteger seq = new AtomicInteger();
        this.io = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("worker-proc-" + seq.incrementAndGet());
            return t;
        });
    }

    /**
     * Command that starts {@code mainClass} in a fresh JVM on this JVM's runtime and
     * class path.
     */
    public static List<String> javaCommand(String mainClass, String... args) {
        String javaBin = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        List<String> cmd = new ArrayList<>();
        cmd.add(javaBin);
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add(mainClass);
        cmd.addAll(List.of(args));
        return cmd;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public WorkerHandle launch(WorkItem item, Consumer<WorkOutcome> onOutcome) throws WorkerStartException {
        Process proc;
        try {
            proc = new ProcessBuilder(command).start();
        } catch (IOException | RuntimeException e) {
            throw new WorkerStartException(item.name, e);
        }
        log.debug("Worker process {} started for {}", proc.pid(), item.name);

        Future<?> waiter;
        try {
            waiter = io.submit(() -> onOutcome.accept(await(item, proc)));
        } catch (RejectedExecutionException e) {
            proc.destroyForcibly();
            throw new WorkerStartException(item.name, e);
        }

        return () -> {
            if (proc.isAlive()) {
                proc.destroyForcibly();
            }
            waiter.cancel(true);
        };
    }

    private WorkOutcome await(WorkItem item, Process proc) {
        Future<String> stdout = io.submit(() -> drain(proc.getInputStream()));
        Future<String> stderr = io.submit(() -> drain(proc.getErrorStream()));

        try (OutputStream in = proc.getOutputStream()) {
            in.write(WorkerMessages.encodeStart(item).getBytes(StandardCharsets.UTF_8));
            in.write('\n');
        } catch (IOException e) {
            // the child may already be gone; its exit code tells the rest
            log.debug("Could not send start payload to worker for {}: {}", item.name, e.getMessage());
        }

        try {
            int exit = proc.waitFor();
            String out = stdout.get(5, TimeUnit.SECONDS);
            String err = stderr.get(5, TimeUnit.SECONDS);

            WorkOutcome outcome = WorkerMessages.findCompletion(out);
            if (outcome != null) {
                log.debug("Worker process for {} exited with {}", item.name, exit);
                return outcome;
            }
            String detail = firstLine(err);
            return WorkOutcome.failed(item.name, new WorkFailure(Stage.WORKER, null,
                    "worker exited with code " + exit + " without a completion message"
                            + (detail.isEmpty() ? "" : ": " + detail)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return WorkOutcome.failed(item.name, new WorkFailure(Stage.WORKER, null, "interrupted while waiting for worker"));
        } catch (ExecutionException | TimeoutException e) {
            return WorkOutcome.failed(item.name, WorkFailure.of(Stage.WORKER, e));
        } finally {
            if (proc.isAlive()) {
                proc.destroyForcibly();
            }
        }
    }

    private static String drain(InputStream in) throws IOException {
        StringBuilder sb = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }

    private static String firstLine(String text) {
        return text.lines()
                .filter(l -> !l.isBlank())
                .findFirst()
                .orElse("")
                .trim();
    }

    @Override
    public void close() {
        io.shutdown();
        try {
            if (!io.awaitTermination(30, TimeUnit.SECONDS)) {
                io.shutdownNow();
            }
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
