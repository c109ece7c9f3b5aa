package com.imagefan.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.List;

/**
 * JSON wire format between a coordinator and a process worker: one start payload
 * in on stdin, one completion message out on stdout.
 */
public final class WorkerMessages {
    private static final ObjectMapper M = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private WorkerMessages() {}

    /** {@code {"sourcePath": ..., "name": ...}} */
    public static class StartPayload {
        public String sourcePath;
        public String name;

        public StartPayload() {}

        public StartPayload(WorkItem item) {
            this.sourcePath = item.sourcePath.toString();
            this.name = item.name;
        }

        public WorkItem toWorkItem() {
            if (sourcePath == null || name == null) {
                throw new IllegalArgumentException("start payload needs sourcePath and name");
            }
            return new WorkItem(Path.of(sourcePath), name);
        }
    }

    /** {@code {"success": true, "filename": ...}} plus stage/variant/message on failure. */
    public static class CompletionMessage {
        public boolean success;
        public String filename;
        public Stage stage;
        public String variant;
        public String message;

        public CompletionMessage() {}

        public static CompletionMessage of(WorkOutcome outcome) {
            CompletionMessage m = new CompletionMessage();
            m.success = outcome.succeeded();
            m.filename = outcome.name;
            if (!outcome.succeeded()) {
                m.stage = outcome.error.stage;
                m.variant = outcome.error.variant;
                m.message = outcome.error.message;
            }
            return m;
        }

        public WorkOutcome toOutcome() {
            if (success) {
                return WorkOutcome.succeeded(filename);
            }
            return WorkOutcome.failed(filename,
                    new WorkFailure(stage == null ? Stage.WORKER : stage, variant, message));
        }
    }

    public static String encodeStart(WorkItem item) {
        return write(new StartPayload(item));
    }

    public static WorkItem decodeStart(String json) throws JsonProcessingException {
        return M.readValue(json, StartPayload.class).toWorkItem();
    }

    public static String encodeCompletion(WorkOutcome outcome) {
        return write(CompletionMessage.of(outcome));
    }

    /**
     * Finds the completion message in a worker's stdout: the last non-blank line
     * that parses as one. Returns null when there is none.
     */
    public static WorkOutcome findCompletion(String stdout) {
        List<String> lines = stdout.lines().filter(l -> !l.isBlank()).toList();
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i).trim();
            if (!line.startsWith("{")) continue;
            try {
                CompletionMessage m = M.readValue(line, CompletionMessage.class);
                if (m.filename != null) {
                    return m.toOutcome();
                }
            } catch (JsonProcessingException e) {
                // not the completion line, keep looking
            }
        }
        return null;
    }

    private static String write(Object value) {
        try {
            return M.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + value.getClass().getSimpleName(), e);
        }
    }
}
