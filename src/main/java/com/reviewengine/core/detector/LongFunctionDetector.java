package com.reviewengine.core.detector;

import com.reviewengine.core.issue.Issue;
import com.reviewengine.core.syntax.ParseException;
import com.reviewengine.core.syntax.SourceParser;
import com.reviewengine.core.syntax.SyntaxNode;
import com.reviewengine.core.syntax.SyntaxTree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags functions whose body holds more than a threshold of statements.
 *
 * Only immediate body statements count; a nested block counts as one.
 */
@Component
public class LongFunctionDetector implements DefectDetector {

    private static final Logger log = LoggerFactory.getLogger(LongFunctionDetector.class);

    public static final int DEFAULT_MAX_STATEMENTS = 20;

    private final SourceParser parser;
    private final int maxStatements;

    public LongFunctionDetector(
            SourceParser parser,
            @Value("${code-review.long-function.max-statements:20}") int maxStatements
    ) {
        if (maxStatements < 0) {
            throw new IllegalArgumentException("max-statements must be >= 0, got " + maxStatements);
        }
        this.parser = parser;
        this.maxStatements = maxStatements;
    }

    @Override
    public String getName() {
        return "long-function";
    }

    public int getMaxStatements() {
        return maxStatements;
    }

    @Override
    public List<Issue> detect(String source) {
        return detect(source, maxStatements);
    }

    public List<Issue> detect(String source, int threshold) {
        SyntaxTree tree;
        try {
            tree = parser.parse(source);
        } catch (ParseException e) {
            log.debug("[LongFunction] Skipped, source does not parse: {}", e.getMessage());
            return List.of();
        }

        List<Issue> issues = new ArrayList<>();
        for (SyntaxNode node : tree.walk()) {
            if (!node.getKind().isFunctionDefinition()) {
                continue;
            }
            int count = node.getBody().size();
            if (count > threshold) {
                log.info("[LongFunction] '{}' has {} statements (max {})", node.getIdentifier(), count, threshold);
                issues.add(Issue.codeSmell(
                        "Function '" + node.getIdentifier() + "' is too long (" + count + " lines).",
                        node.getLine()));
            }
        }
        return issues;
    }
}
