package com.reviewengine.orchestrator;

import com.reviewengine.core.detector.LongFunctionDetector;
import com.reviewengine.core.detector.StyleCheckDetector;
import com.reviewengine.core.detector.SyntaxCheckDetector;
import com.reviewengine.core.detector.UndefinedVariableDetector;
import com.reviewengine.core.issue.Issue;
import com.reviewengine.core.issue.ReviewReport;
import com.reviewengine.core.repair.RepairPipeline;
import com.reviewengine.core.repair.RepairResult;
import com.reviewengine.core.syntax.ParseException;
import com.reviewengine.core.syntax.SourceParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * CodeReviewEngine - entry point for reviewing and repairing one source text.
 *
 * review:  syntax -> undefined variables -> long functions -> style, all four
 *          always run, issues kept in that order
 * repair:  the repair pipeline over the raw text; independent of review
 *
 * Both first make sure the input can be parsed or rejected with a located
 * syntax error. Any other parser failure is fatal and raised as
 * {@link ReviewEngineException}.
 */
@Component
public class CodeReviewEngine {

    private static final Logger log = LoggerFactory.getLogger(CodeReviewEngine.class);

    private final SourceParser              parser;
    private final SyntaxCheckDetector       syntaxCheck;
    private final UndefinedVariableDetector undefinedVariables;
    private final LongFunctionDetector      longFunctions;
    private final StyleCheckDetector        styleCheck;
    private final RepairPipeline            pipeline;

    public CodeReviewEngine(
            SourceParser              parser,
            SyntaxCheckDetector       syntaxCheck,
            UndefinedVariableDetector undefinedVariables,
            LongFunctionDetector      longFunctions,
            StyleCheckDetector        styleCheck,
            RepairPipeline            pipeline
    ) {
        this.parser             = parser;
        this.syntaxCheck        = syntaxCheck;
        this.undefinedVariables = undefinedVariables;
        this.longFunctions      = longFunctions;
        this.styleCheck         = styleCheck;
        this.pipeline           = pipeline;
    }

    // =========================================================================
    // REVIEW
    // =========================================================================

    public ReviewReport review(String source) {
        return review(source, longFunctions.getMaxStatements());
    }

    /**
     * @param maxFunctionStatements body-statement threshold for the long-function check
     */
    public ReviewReport review(String source, int maxFunctionStatements) {
        ensureAnalyzable(source);

        ReviewReport report = new ReviewReport();

        log.info("[CodeReviewEngine] Running syntax check...");
        report.addAll(syntaxCheck.detect(source));

        log.info("[CodeReviewEngine] Checking for undefined variables...");
        report.addAll(undefinedVariables.detect(source));

        log.info("[CodeReviewEngine] Checking for long functions (max {} statements)...", maxFunctionStatements);
        report.addAll(longFunctions.detect(source, maxFunctionStatements));

        log.info("[CodeReviewEngine] Running style check...");
        report.addAll(styleCheck.detect(source));

        log.info("[CodeReviewEngine] Review complete: {}", report);
        return report;
    }

    public List<Issue> detectSyntaxErrors(String source) {
        return syntaxCheck.detect(source);
    }

    public List<Issue> detectUndefinedVariables(String source) {
        return undefinedVariables.detect(source);
    }

    public List<Issue> detectLongFunctions(String source, int maxFunctionStatements) {
        return longFunctions.detect(source, maxFunctionStatements);
    }

    public List<Issue> detectStyleIssues(String source) {
        return styleCheck.detect(source);
    }

    // =========================================================================
    // REPAIR
    // =========================================================================

    public RepairResult repair(String source) {
        ensureAnalyzable(source);
        log.info("[CodeReviewEngine] Applying automatic fixes...");
        return pipeline.repair(source);
    }

    public RepairResult repairWithoutFormatting(String source) {
        ensureAnalyzable(source);
        return pipeline.repairWithoutFormatting(source);
    }

    private void ensureAnalyzable(String source) {
        try {
            parser.parse(source);
        } catch (ParseException e) {
            log.debug("[CodeReviewEngine] Input has a syntax error at line {}", e.getLine());
        } catch (RuntimeException | StackOverflowError e) {
            log.error("[CodeReviewEngine] Input cannot be analyzed: {}", e.toString());
            throw new ReviewEngineException("Source could not be analyzed: " + e, e);
        }
    }
}
