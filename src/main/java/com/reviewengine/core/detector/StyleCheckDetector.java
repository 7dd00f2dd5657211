package com.reviewengine.core.detector;

import com.reviewengine.core.executor.ExternalToolRunner;
import com.reviewengine.core.executor.ToolExecutionResult;
import com.reviewengine.core.issue.Issue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * StyleCheckDetector - runs flake8 over a temporary copy of the source.
 *
 * flake8 is asked for one finding per line as {@code <row>: <code> - <text>}.
 * Exit code 0 means a clean file. Every output line of the form
 * {@code <digits>: <text>} becomes one style issue; other lines are ignored.
 */
@Component
public class StyleCheckDetector implements DefectDetector {

    private static final Logger log = LoggerFactory.getLogger(StyleCheckDetector.class);

    static final String TOOL_NAME = "flake8";
    static final String FORMAT_ARGUMENT = "--format=%(row)d: %(code)s - %(text)s";

    static final String NOT_INSTALLED_MESSAGE =
            "flake8 is not installed. Please install it using 'pip install flake8'.";

    private static final Pattern FINDING = Pattern.compile("^\\s*(\\d+):\\s*(.*)$");

    private final ExternalToolRunner runner;
    private final List<String> command;
    private final int timeoutSeconds;

    public StyleCheckDetector(
            ExternalToolRunner runner,
            @Value("${code-review.style.command:flake8}") String command,
            @Value("${code-review.style.timeout-seconds:30}") int timeoutSeconds
    ) {
        this.runner = runner;
        List<String> full = new ArrayList<>(ExternalToolRunner.splitCommand(command));
        full.add(FORMAT_ARGUMENT);
        this.command = List.copyOf(full);
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String getName() {
        return "style";
    }

    @Override
    public List<Issue> detect(String source) {
        ToolExecutionResult result = runner.runOnTempFile(source, command, timeoutSeconds);

        switch (result.getStatus()) {
            case NOT_FOUND:
                log.warn("[StyleCheck] {} not found", TOOL_NAME);
                return List.of(Issue.toolError(NOT_INSTALLED_MESSAGE));
            case TIMED_OUT:
            case FAILED:
                log.warn("[StyleCheck] {} failed: {}", TOOL_NAME, result.getErrorMessage());
                return List.of(Issue.toolError(failure(result.getErrorMessage())));
            default:
                break;
        }

        if (result.getExitCode() == 0) {
            return List.of();
        }

        List<Issue> issues = parseFindings(result.getOutput());
        if (issues.isEmpty() && !result.getOutput().isBlank()) {
            String firstLine = result.getOutput().strip().lines().findFirst().orElse("");
            log.warn("[StyleCheck] Exit code {} with no parseable findings", result.getExitCode());
            return List.of(Issue.toolError(failure(firstLine)));
        }
        log.info("[StyleCheck] {} findings", issues.size());
        return issues;
    }

    static List<Issue> parseFindings(String output) {
        List<Issue> issues = new ArrayList<>();
        for (String line : output.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            Matcher m = FINDING.matcher(line);
            if (!m.matches()) {
                log.debug("[StyleCheck] Skipping unparseable line: {}", line);
                continue;
            }
            try {
                int row = Integer.parseInt(m.group(1));
                issues.add(Issue.styleIssue(m.group(2).trim(), row));
            } catch (NumberFormatException e) {
                log.debug("[StyleCheck] Line number out of range: {}", line);
            }
        }
        return issues;
    }

    private static String failure(String reason) {
        return "Failed to run " + TOOL_NAME + ": " + reason;
    }
}
