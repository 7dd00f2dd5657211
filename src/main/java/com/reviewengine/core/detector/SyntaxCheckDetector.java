package com.reviewengine.core.detector;

import com.reviewengine.core.issue.Issue;
import com.reviewengine.core.syntax.ParseException;
import com.reviewengine.core.syntax.SourceParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SyntaxCheckDetector implements DefectDetector {

    private static final Logger log = LoggerFactory.getLogger(SyntaxCheckDetector.class);

    private final SourceParser parser;

    public SyntaxCheckDetector(SourceParser parser) {
        this.parser = parser;
    }

    @Override
    public String getName() {
        return "syntax";
    }

    @Override
    public List<Issue> detect(String source) {
        try {
            parser.parse(source);
            return List.of();
        } catch (ParseException e) {
            log.info("[SyntaxCheck] Line {}: {}", e.getLine(), e.getMessage());
            return List.of(Issue.syntaxError(e.getMessage(), e.getLine()));
        }
    }
}
