package com.reviewengine.core.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * ExternalToolRunner - blocking subprocess calls with a hard timeout.
 *
 * stderr is merged into stdout so tool output keeps its chronological order.
 * A command whose executable cannot be located is reported as NOT_FOUND
 * without starting a process; a process still running at the timeout is
 * killed and reported as TIMED_OUT.
 */
@Component
public class ExternalToolRunner {

    private static final Logger log = LoggerFactory.getLogger(ExternalToolRunner.class);

    private static final boolean IS_WINDOWS =
            System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");

    private static final String TEMP_FILE_PREFIX = "review_";
    private static final String TEMP_FILE_SUFFIX = ".py";

    /**
     * Splits a configured command line ("flake8 --isolated") into arguments.
     */
    public static List<String> splitCommand(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            return List.of();
        }
        return Arrays.asList(commandLine.trim().split("\\s+"));
    }

    public ToolExecutionResult run(List<String> command, int timeoutSeconds) {
        long startTime = System.currentTimeMillis();

        if (command == null || command.isEmpty()) {
            return ToolExecutionResult.error("empty command", 0);
        }

        String executable = command.get(0);
        if (!isResolvable(executable)) {
            log.warn("[ExternalToolRunner] Executable not found: {}", executable);
            return ToolExecutionResult.notFound(executable);
        }

        log.info("[ExternalToolRunner] Executing: {}", String.join(" ", command));

        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);

            Process process = builder.start();

            StringBuilder output = new StringBuilder();

            Thread outThread = new Thread(() -> {
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        synchronized (output) {
                            output.append(line).append("\n");
                        }
                    }
                } catch (IOException e) {
                    log.warn("[ExternalToolRunner] Error reading output: {}", e.getMessage());
                }
            }, "tool-output-reader");
            outThread.setDaemon(true);
            outThread.start();

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                log.warn("[ExternalToolRunner] Process timed out after {} seconds", timeoutSeconds);
                String partial;
                synchronized (output) {
                    partial = output.toString();
                }
                return ToolExecutionResult.timedOut(partial, timeoutSeconds, System.currentTimeMillis() - startTime);
            }

            outThread.join(1000);

            String mergedOutput;
            synchronized (output) {
                mergedOutput = output.toString();
            }
            int exitCode = process.exitValue();

            log.info("[ExternalToolRunner] Exit code: {}, Output length: {} chars",
                    exitCode, mergedOutput.length());

            return ToolExecutionResult.completed(exitCode, mergedOutput, System.currentTimeMillis() - startTime);

        } catch (IOException e) {
            log.error("[ExternalToolRunner] Execution failed: {}", e.getMessage());
            return ToolExecutionResult.error(e.getMessage(), System.currentTimeMillis() - startTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[ExternalToolRunner] Interrupted while waiting for {}", executable);
            return ToolExecutionResult.error("interrupted", System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Writes {@code content} to a uniquely named temporary .py file, runs
     * {@code commandPrefix + [file]}, reads the file back into
     * {@link ToolExecutionResult#getFileContent()} and deletes it, whatever the outcome.
     */
    public ToolExecutionResult runOnTempFile(String content, List<String> commandPrefix, int timeoutSeconds) {
        log.info("[ExternalToolRunner] Running on temp file ({} chars)", content.length());

        Path tempFile = null;
        try {
            tempFile = Files.createTempFile(TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
            Files.writeString(tempFile, content, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>(commandPrefix);
            command.add(tempFile.toString());

            ToolExecutionResult result = run(command, timeoutSeconds);
            if (!result.isCompleted()) {
                return result;
            }
            return result.withFileContent(Files.readString(tempFile, StandardCharsets.UTF_8));

        } catch (IOException e) {
            log.error("[ExternalToolRunner] Temp file handling failed: {}", e.getMessage());
            return ToolExecutionResult.error("temporary file error: " + e.getMessage(), 0);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("[ExternalToolRunner] Could not delete temp file {}: {}", tempFile, e.getMessage());
        }
    }

    /**
     * True when the executable is a path to an executable file, or a bare
     * name found on PATH.
     */
    static boolean isResolvable(String executable) {
        if (executable.contains("/") || executable.contains(File.separator)) {
            return Files.isExecutable(Path.of(executable));
        }
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) {
            return false;
        }
        List<String> candidates = new ArrayList<>();
        candidates.add(executable);
        if (IS_WINDOWS) {
            candidates.add(executable + ".exe");
            candidates.add(executable + ".cmd");
            candidates.add(executable + ".bat");
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            for (String candidate : candidates) {
                Path resolved = Path.of(dir, candidate);
                if (Files.isRegularFile(resolved) && Files.isExecutable(resolved)) {
                    return true;
                }
            }
        }
        return false;
    }
}
