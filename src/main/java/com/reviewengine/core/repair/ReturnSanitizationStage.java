package com.reviewengine.core.repair;

import com.reviewengine.core.scope.ScopeAnalysis;
import com.reviewengine.core.scope.ScopeAnalyzer;
import com.reviewengine.core.syntax.ParseException;
import com.reviewengine.core.syntax.SourceParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ReturnSanitizationStage - {@code return <name>} with a name that is not in
 * {@code defined} becomes {@code return None}.
 *
 * Only lines holding exactly one bare identifier operand (and optionally a
 * comment) are touched; indentation and comment are kept.
 */
@Component
public class ReturnSanitizationStage implements RepairStage {

    private static final Logger log = LoggerFactory.getLogger(ReturnSanitizationStage.class);

    static final String ABSENCE_VALUE = "None";

    private static final Pattern BARE_RETURN =
            Pattern.compile("^(\\s*)return\\s+([\\p{L}_][\\p{L}\\p{N}_]*)(\\s*#.*)?\\s*$");

    private static final Set<String> KEYWORD_CONSTANTS = Set.of("None", "True", "False");

    // keyword.kwlist without the constants above
    private static final Set<String> KEYWORDS = Set.of(
            "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del",
            "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while",
            "with", "yield");

    private final SourceParser parser;
    private final ScopeAnalyzer analyzer;

    public ReturnSanitizationStage(SourceParser parser, ScopeAnalyzer analyzer) {
        this.parser = parser;
        this.analyzer = analyzer;
    }

    @Override
    public String getName() {
        return "return-sanitization";
    }

    @Override
    public StageResult apply(String text) {
        ScopeAnalysis analysis;
        try {
            analysis = analyzer.analyze(parser.parse(text));
        } catch (ParseException e) {
            log.warn("[ReturnSanitization] Skipped, line {}: {}", e.getLine(), e.getMessage());
            return StageResult.skipped(text, "source does not parse: " + e.getMessage());
        }

        Set<String> defined = analysis.getDefined();
        List<String> lines = SourceLines.split(text);
        List<LineScanner.LineInfo> infos = LineScanner.scan(lines);

        int rewritten = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (!infos.get(i).isCode()) {
                continue;
            }
            Matcher m = BARE_RETURN.matcher(lines.get(i));
            if (!m.matches()) {
                continue;
            }
            String name = m.group(2);
            if (KEYWORD_CONSTANTS.contains(name) || KEYWORDS.contains(name) || defined.contains(name)) {
                continue;
            }
            String comment = m.group(3) != null ? m.group(3) : "";
            lines.set(i, m.group(1) + "return " + ABSENCE_VALUE + comment);
            log.info("[ReturnSanitization] Line {}: 'return {}' -> 'return {}'", i + 1, name, ABSENCE_VALUE);
            rewritten++;
        }

        if (rewritten == 0) {
            return StageResult.of(text, text);
        }
        return StageResult.of(text, SourceLines.join(lines));
    }
}
