package com.imagefan.app;

import com.imagefan.engine.*;
import com.imagefan.image.DerivativePipeline;
import com.imagefan.image.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletionException;

public class BatchRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ITEM_FAILURES = 1;
    public static final int EXIT_CONFIG = 2;
    public static final int EXIT_BATCH_FAULT = 3;

    private final ProcessorConfig cfg;
    private final PrintStream out;
    private final ImageDirectoryScanner scanner = new ImageDirectoryScanner();

    public BatchRunner(ProcessorConfig cfg, PrintStream out) {
        this.cfg = cfg;
        this.out = out;
    }

    public int run() {
        List<WorkItem> items;
        try {
            items = scanner.scan(Path.of(cfg.inputDir));
        } catch (EnumerationException e) {
            log.error("Enumeration failed", e);
            out.println("Cannot enumerate input: " + e.getMessage());
            return EXIT_BATCH_FAULT;
        }

        OutputLayout layout = new OutputLayout(Path.of(cfg.outputDir));
        DispatcherConfig dispatcherConfig = cfg.toDispatcherConfig();
        out.println("Images: " + items.size()
                + " | Slots: " + dispatcherConfig.maxConcurrency
                + " | Isolation: " + cfg.isolation);

        long startMs = System.currentTimeMillis();
        try (WorkerLauncher launcher = createLauncher(layout);
             Dispatcher dispatcher = new Dispatcher(dispatcherConfig, launcher)) {

            BatchResult result = dispatcher.run(items).join();
            long totalMs = System.currentTimeMillis() - startMs;

            printSummary(result.outcomes, totalMs, dispatcher.stats());
            writeFailureReport(result.failed());
            return result.allSucceeded() ? EXIT_OK : EXIT_ITEM_FAILURES;

        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            long totalMs = System.currentTimeMillis() - startMs;
            log.error("Batch aborted", cause);
            out.println("Batch aborted: " + cause.getMessage());
            if (cause instanceof BatchFaultException) {
                List<WorkOutcome> partial = ((BatchFaultException) cause).getPartialOutcomes();
                printSummary(partial, totalMs, null);
                writeFailureReport(partial.stream().filter(o -> !o.succeeded()).toList());
            }
            return EXIT_BATCH_FAULT;
        }
    }

    WorkerLauncher createLauncher(OutputLayout layout) {
        return switch (cfg.isolation) {
            case PROCESS -> new ProcessWorkerLauncher(ProcessWorkerLauncher.javaCommand(
                    WorkerMain.class.getName(), "--output-root", layout.root().toString()));
            case THREAD -> new ThreadWorkerLauncher(new DerivativePipeline(layout));
        };
    }

    private void printSummary(List<WorkOutcome> outcomes, long totalMs, BatchStats stats) {
        long ok = outcomes.stream().filter(WorkOutcome::succeeded).count();
        long failed = outcomes.size() - ok;
        double avg = outcomes.isEmpty() ? 0.0 : (double) totalMs / outcomes.size();

        out.println("=== SUMMARY ===");
        out.println("Items: " + outcomes.size() + " | Succeeded: " + ok + " | Failed: " + failed);
        out.println("Total time: " + totalMs + "ms (" + String.format("%.2f", totalMs / 1000.0) + "s)");
        out.println("Avg item time: " + String.format("%.0f", avg) + "ms");
        if (stats != null) {
            out.println("Peak workers: " + stats.peakActive.get() + " | Timed out: " + stats.timedOut.sum());
        }
        for (WorkOutcome o : outcomes) {
            if (o.succeeded()) {
                out.println(" - " + o.name + " processed in " + o.elapsedMillis + "ms");
            } else {
                out.println(" - " + o.name + " FAILED " + o.error);
            }
        }
        out.println("===============");
    }

    private void writeFailureReport(List<WorkOutcome> failed) {
        if (cfg.failureReport == null || cfg.failureReport.isBlank() || failed.isEmpty()) return;

        FailureReportWriter writer = new FailureReportWriter(Path.of(cfg.failureReport));
        for (WorkOutcome o : failed) {
            writer.append(o);
        }
        out.println("Failed items written to " + cfg.failureReport);
    }
}
