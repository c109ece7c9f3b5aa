package com.imagefan.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.imagefan.engine.WorkOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

public class FailureReportWriter {
    private static final Logger log = LoggerFactory.getLogger(FailureReportWriter.class);
    private static final ObjectMapper M = new ObjectMapper();

    private final Path path;

    public FailureReportWriter(Path path) {
        this.path = path;
    }

    public synchronized void append(WorkOutcome outcome) {
        if (outcome.succeeded()) return;

        ObjectNode line = M.createObjectNode();
        line.put("name", outcome.name);
        line.put("stage", outcome.error.stage.name());
        if (outcome.error.variant != null) {
            line.put("variant", outcome.error.variant);
        }
        line.put("message", outcome.error.message);

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter bw = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                bw.write(M.writeValueAsString(line));
                bw.newLine();
            }
        } catch (IOException e) {
            // the summary on stdout still lists the failure
            log.error("Failure report write failed to {}: {}", path, e.getMessage());
        }
    }
}
