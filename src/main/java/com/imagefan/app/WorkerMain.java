package com.imagefan.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.imagefan.engine.WorkItem;
import com.imagefan.engine.WorkOutcome;
import com.imagefan.engine.WorkerMessages;
import com.imagefan.image.DerivativePipeline;
import com.imagefan.image.OutputLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Entry point of a process worker. Reads one start payload from stdin, runs the
 * derivative pipeline and prints exactly one completion message on stdout.
 * Logging goes to stderr.
 */
@Command(name = "imagefan-worker", description = "Processes one image described by a JSON payload on stdin.")
public class WorkerMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    @Option(names = "--output-root", required = true, description = "Output root shared by all workers.")
    Path outputRoot;

    @Override
    public Integer call() throws IOException {
        String payload = new String(System.in.readAllBytes(), StandardCharsets.UTF_8).trim();

        WorkItem item;
        try {
            item = WorkerMessages.decodeStart(payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Unusable start payload: {}", e.getMessage());
            return 2;
        }

        WorkOutcome outcome = new DerivativePipeline(new OutputLayout(outputRoot)).process(item);
        System.out.println(WorkerMessages.encodeCompletion(outcome));
        System.out.flush();
        return outcome.succeeded() ? 0 : 1;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new WorkerMain()).execute(args));
    }
}
