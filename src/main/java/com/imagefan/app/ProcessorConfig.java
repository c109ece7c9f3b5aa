package com.imagefan.app;

import com.fasterxml.jackson.databind.DatabindException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.imagefan.engine.DispatcherConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

public class ProcessorConfig {
    private static final ObjectMapper M = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    public String inputDir = "input-images";
    public String outputDir = "output";
    public Integer maxConcurrency;              // null: one slot per available processor
    public Isolation isolation = Isolation.THREAD;
    public int workerTimeoutSeconds = 0;        // 0: no deadline
    public String failureReport;                // JSON lines of failed items, optional

    public ProcessorConfig() {}

    public static ProcessorConfig load(Path file) throws ConfigException {
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Config file not found: " + file);
        }
        try {
            return M.readValue(file.toFile(), ProcessorConfig.class);
        } catch (DatabindException e) {
            throw new ConfigException("Invalid config " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Cannot read config " + file + ": " + e.getMessage(), e);
        }
    }

    public void validate() throws ConfigException {
        if (inputDir == null || inputDir.isBlank()) {
            throw new ConfigException("inputDir must be set");
        }
        if (outputDir == null || outputDir.isBlank()) {
            throw new ConfigException("outputDir must be set");
        }
        if (maxConcurrency != null && maxConcurrency < 1) {
            throw new ConfigException("maxConcurrency must be >= 1, got " + maxConcurrency);
        }
        if (isolation == null) {
            throw new ConfigException("isolation must be THREAD or PROCESS");
        }
        if (workerTimeoutSeconds < 0) {
            throw new ConfigException("workerTimeoutSeconds must be >= 0, got " + workerTimeoutSeconds);
        }
    }

    public int effectiveMaxConcurrency() {
        return maxConcurrency != null ? maxConcurrency : Runtime.getRuntime().availableProcessors();
    }

    public DispatcherConfig toDispatcherConfig() {
        Duration timeout = workerTimeoutSeconds > 0 ? Duration.ofSeconds(workerTimeoutSeconds) : null;
        return new DispatcherConfig(effectiveMaxConcurrency(), timeout);
    }
}
