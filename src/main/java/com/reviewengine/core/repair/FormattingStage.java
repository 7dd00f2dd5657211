package com.reviewengine.core.repair;

import com.reviewengine.core.executor.ExternalToolRunner;
import com.reviewengine.core.executor.ToolExecutionResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * FormattingStage - hands the text to black, in place on a temporary file.
 *
 * Any failure (formatter missing, timeout, non-zero exit) skips the stage and
 * passes its input through.
 */
@Component
public class FormattingStage implements RepairStage {

    private static final Logger log = LoggerFactory.getLogger(FormattingStage.class);

    static final String QUIET_ARGUMENT = "-q";

    private final ExternalToolRunner runner;
    private final List<String> command;
    private final int timeoutSeconds;

    public FormattingStage(
            ExternalToolRunner runner,
            @Value("${code-review.format.command:black}") String command,
            @Value("${code-review.format.timeout-seconds:30}") int timeoutSeconds
    ) {
        this.runner = runner;
        List<String> full = new ArrayList<>(ExternalToolRunner.splitCommand(command));
        full.add(QUIET_ARGUMENT);
        this.command = List.copyOf(full);
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String getName() {
        return "formatting";
    }

    @Override
    public StageResult apply(String text) {
        ToolExecutionResult result = runner.runOnTempFile(text, command, timeoutSeconds);

        if (!result.isCompleted()) {
            log.warn("[Formatting] Skipped: {}", result.getErrorMessage());
            return StageResult.skipped(text, result.getErrorMessage());
        }
        if (result.getExitCode() != 0) {
            String reason = "formatter exited with code " + result.getExitCode();
            log.warn("[Formatting] Skipped: {}", reason);
            return StageResult.skipped(text, reason);
        }
        return StageResult.of(text, result.getFileContent());
    }
}
