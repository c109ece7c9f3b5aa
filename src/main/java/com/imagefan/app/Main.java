package com.imagefan.app;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
        name = "imagefan",
        mixinStandardHelpOptions = true,
        version = "imagefan 1.0.0",
        description = "Writes thumbnail, small, medium, large, grayscale and blur derivatives "
                + "for every image in a directory, on a bounded pool of isolated workers.",
        exitCodeListHeading = "Exit codes:%n",
        exitCodeList = {
                "0:every image succeeded",
                "1:one or more images failed",
                "2:invalid command line or configuration",
                "3:the batch could not run (input not listable, worker not startable)"
        }
)
public class Main implements Callable<Integer> {

    @Option(names = {"-c", "--config"}, description = "JSON config file; command-line options override it.")
    Path configPath;

    @Option(names = {"-i", "--input"}, description = "Directory of .jpg/.jpeg/.png/.webp images.")
    String inputDir;

    @Option(names = {"-o", "--output"}, description = "Output root; one subdirectory per image.")
    String outputDir;

    @Option(names = {"-j", "--max-concurrency"}, description = "Workers running at once (default: available processors).")
    Integer maxConcurrency;

    @Option(names = "--isolation", description = "THREAD or PROCESS.")
    Isolation isolation;

    @Option(names = "--timeout", description = "Seconds before a silent worker is failed; 0 disables.")
    Integer timeoutSeconds;

    @Option(names = "--failure-report", description = "Append failed items as JSON lines to this file.")
    String failureReport;

    @Override
    public Integer call() {
        ProcessorConfig cfg;
        try {
            cfg = resolveConfig();
        } catch (ConfigException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return BatchRunner.EXIT_CONFIG;
        }

        System.out.println("=== imagefan ===");
        System.out.println("Config: " + (configPath == null ? "(defaults)" : configPath));
        System.out.println("Input : " + cfg.inputDir);
        System.out.println("Output: " + cfg.outputDir);
        System.out.println("================");

        return new BatchRunner(cfg, System.out).run();
    }

    ProcessorConfig resolveConfig() throws ConfigException {
        ProcessorConfig cfg = configPath != null ? ProcessorConfig.load(configPath) : new ProcessorConfig();
        if (inputDir != null) cfg.inputDir = inputDir;
        if (outputDir != null) cfg.outputDir = outputDir;
        if (maxConcurrency != null) cfg.maxConcurrency = maxConcurrency;
        if (isolation != null) cfg.isolation = isolation;
        if (timeoutSeconds != null) cfg.workerTimeoutSeconds = timeoutSeconds;
        if (failureReport != null) cfg.failureReport = failureReport;
        cfg.validate();
        return cfg;
    }

    static CommandLine commandLine() {
        return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
