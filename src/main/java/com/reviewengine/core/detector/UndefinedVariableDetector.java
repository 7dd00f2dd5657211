package com.reviewengine.core.detector;

import com.reviewengine.core.issue.Issue;
import com.reviewengine.core.scope.NameReference;
import com.reviewengine.core.scope.ScopeAnalysis;
import com.reviewengine.core.scope.ScopeAnalyzer;
import com.reviewengine.core.syntax.ParseException;
import com.reviewengine.core.syntax.SourceParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * One UndefinedVariable issue per unresolved read, at the read's line.
 * Unparseable source yields nothing; the syntax check reports it.
 */
@Component
public class UndefinedVariableDetector implements DefectDetector {

    private static final Logger log = LoggerFactory.getLogger(UndefinedVariableDetector.class);

    private final SourceParser parser;
    private final ScopeAnalyzer analyzer;

    public UndefinedVariableDetector(SourceParser parser, ScopeAnalyzer analyzer) {
        this.parser = parser;
        this.analyzer = analyzer;
    }

    @Override
    public String getName() {
        return "undefined-variable";
    }

    @Override
    public List<Issue> detect(String source) {
        ScopeAnalysis analysis;
        try {
            analysis = analyzer.analyze(parser.parse(source));
        } catch (ParseException e) {
            log.debug("[UndefinedVariable] Skipped, source does not parse: {}", e.getMessage());
            return List.of();
        }

        List<Issue> issues = new ArrayList<>();
        for (NameReference reference : analysis.getUndefinedReferences()) {
            issues.add(Issue.undefinedVariable(reference.getName(), reference.getLine()));
        }
        if (!issues.isEmpty()) {
            log.info("[UndefinedVariable] {} undefined reads: {}", issues.size(), analysis.undefinedNames());
        }
        return issues;
    }
}
