package com.reviewengine.core.executor;

/**
 * ToolExecutionResult - outcome of running an external tool (style checker, formatter).
 *
 * Fields:
 *   - status: COMPLETED when the process ran to exit, otherwise why it did not
 *   - exitCode: process exit code, -1 when the process never exited normally
 *   - output: merged stdout + stderr in chronological order
 *   - errorMessage: human-readable reason for a non-COMPLETED status
 *   - fileContent: contents of the temp file after the run (runOnTempFile only)
 *   - elapsedTimeMs: wall-clock time of the call
 */
public class ToolExecutionResult {

    public enum Status {
        COMPLETED,
        NOT_FOUND,
        TIMED_OUT,
        FAILED
    }

    private final Status status;
    private final int exitCode;
    private final String output;
    private final String errorMessage;
    private final String fileContent;
    private final long elapsedTimeMs;

    public ToolExecutionResult(
            Status status,
            int exitCode,
            String output,
            String errorMessage,
            String fileContent,
            long elapsedTimeMs
    ) {
        this.status = status;
        this.exitCode = exitCode;
        this.output = output != null ? output : "";
        this.errorMessage = errorMessage != null ? errorMessage : "";
        this.fileContent = fileContent;
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public static ToolExecutionResult completed(int exitCode, String output, long elapsedTimeMs) {
        return new ToolExecutionResult(Status.COMPLETED, exitCode, output, null, null, elapsedTimeMs);
    }

    public static ToolExecutionResult notFound(String executable) {
        return new ToolExecutionResult(Status.NOT_FOUND, -1, "", executable + " not found", null, 0);
    }

    public static ToolExecutionResult timedOut(String output, int timeoutSeconds, long elapsedTimeMs) {
        return new ToolExecutionResult(
                Status.TIMED_OUT, -1, output, "timed out after " + timeoutSeconds + " seconds", null, elapsedTimeMs);
    }

    /**
     * Create an error result.
     * Used when the process cannot be started or the temp file cannot be written.
     */
    public static ToolExecutionResult error(String errorMessage, long elapsedTimeMs) {
        return new ToolExecutionResult(Status.FAILED, -1, "", errorMessage, null, elapsedTimeMs);
    }

    ToolExecutionResult withFileContent(String content) {
        return new ToolExecutionResult(status, exitCode, output, errorMessage, content, elapsedTimeMs);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    /** Completed with exit code 0. */
    public boolean isSuccess() {
        return status == Status.COMPLETED && exitCode == 0;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getFileContent() {
        return fileContent;
    }

    public long getElapsedTimeMs() {
        return elapsedTimeMs;
    }

    @Override
    public String toString() {
        return String.format(
            "ToolExecutionResult{status=%s, exitCode=%d, outputLen=%d, elapsedMs=%d}",
            status,
            exitCode,
            output.length(),
            elapsedTimeMs
        );
    }
}
