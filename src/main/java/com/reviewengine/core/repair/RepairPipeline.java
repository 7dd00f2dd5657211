package com.reviewengine.core.repair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * RepairPipeline - runs the repair stages in fixed order over one text buffer.
 *
 * Default order:
 *   structural-token repair -> scope stub insertion -> return sanitization
 *   -> line truncation -> formatting
 *
 * With {@code code-review.repair.sanitize-returns-before-stubs=true} return
 * sanitization runs before stub insertion. Every stage always runs; a stage
 * that throws, or overflows the stack on deeply nested input, is recorded as
 * SKIPPED and its input passed on. No state is kept between calls.
 */
@Component
public class RepairPipeline {

    private static final Logger log = LoggerFactory.getLogger(RepairPipeline.class);

    private final List<RepairStage> textStages;
    private final RepairStage formatter;

    @Autowired
    public RepairPipeline(
            StructuralTokenRepairStage structural,
            ScopeStubStage stubs,
            ReturnSanitizationStage returns,
            LineTruncationStage truncation,
            FormattingStage formatting,
            @Value("${code-review.repair.sanitize-returns-before-stubs:false}") boolean sanitizeReturnsBeforeStubs
    ) {
        this(sanitizeReturnsBeforeStubs
                        ? List.of(structural, returns, stubs, truncation)
                        : List.of(structural, stubs, returns, truncation),
                formatting);
        log.info("[RepairPipeline] Stage order: {}", stageNames());
    }

    /**
     * @param textStages stages run in the given order
     * @param formatter  final stage, left out by {@link #repairWithoutFormatting(String)}; may be null
     */
    public RepairPipeline(List<RepairStage> textStages, RepairStage formatter) {
        this.textStages = List.copyOf(textStages);
        this.formatter = formatter;
    }

    public List<String> stageNames() {
        List<String> names = new ArrayList<>();
        for (RepairStage stage : textStages) {
            names.add(stage.getName());
        }
        if (formatter != null) {
            names.add(formatter.getName());
        }
        return names;
    }

    public RepairResult repair(String source) {
        return run(source, true);
    }

    /**
     * All stages except the formatter. Deterministic without external tools.
     */
    public RepairResult repairWithoutFormatting(String source) {
        return run(source, false);
    }

    private RepairResult run(String source, boolean format) {
        String original = source != null ? source : "";
        String current = original.replace("\r\n", "\n");
        List<StageReport> reports = new ArrayList<>();

        for (RepairStage stage : textStages) {
            current = runStage(stage, current, reports);
        }
        if (format && formatter != null) {
            current = runStage(formatter, current, reports);
        }

        log.info("[RepairPipeline] Done: {}", reports);
        return new RepairResult(original, current, reports);
    }

    private String runStage(RepairStage stage, String input, List<StageReport> reports) {
        StageResult result;
        try {
            result = stage.apply(input);
        } catch (RuntimeException | StackOverflowError e) {
            log.error("[RepairPipeline] Stage {} failed: {}", stage.getName(), e.toString());
            result = StageResult.skipped(input, failureReason(e));
        }
        log.debug("[RepairPipeline] {} -> {}", stage.getName(), result);
        reports.add(new StageReport(stage.getName(), result.getOutcome(), result.getReason()));
        return result.getText();
    }

    private static String failureReason(Throwable e) {
        String name = e.getClass().getSimpleName();
        return e.getMessage() == null ? name : name + ": " + e.getMessage();
    }
}
