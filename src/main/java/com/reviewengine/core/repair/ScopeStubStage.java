package com.reviewengine.core.repair;

import com.reviewengine.core.scope.ScopeAnalysis;
import com.reviewengine.core.scope.ScopeAnalyzer;
import com.reviewengine.core.syntax.NodeKind;
import com.reviewengine.core.syntax.ParseException;
import com.reviewengine.core.syntax.SourceParser;
import com.reviewengine.core.syntax.SyntaxNode;
import com.reviewengine.core.syntax.SyntaxTree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * ScopeStubStage - defines every unbound name with a zero stub at the top of
 * the file.
 *
 * One {@code name = 0} line per name in {@code used - defined - loopBound - builtins},
 * in first-use order. Stubs go after a shebang line, an encoding declaration
 * and any {@code from __future__} imports, which Python requires to come first.
 */
@Component
public class ScopeStubStage implements RepairStage {

    private static final Logger log = LoggerFactory.getLogger(ScopeStubStage.class);

    static final String STUB_VALUE = "0";

    private static final Pattern ENCODING_DECLARATION = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*[-\\w.]+.*$");

    private final SourceParser parser;
    private final ScopeAnalyzer analyzer;

    public ScopeStubStage(SourceParser parser, ScopeAnalyzer analyzer) {
        this.parser = parser;
        this.analyzer = analyzer;
    }

    @Override
    public String getName() {
        return "scope-stub-insertion";
    }

    @Override
    public StageResult apply(String text) {
        SyntaxTree tree;
        try {
            tree = parser.parse(text);
        } catch (ParseException e) {
            log.warn("[ScopeStub] Skipped, line {}: {}", e.getLine(), e.getMessage());
            return StageResult.skipped(text, "source does not parse: " + e.getMessage());
        }

        ScopeAnalysis analysis = analyzer.analyze(tree);
        Set<String> unbound = analysis.unboundNames();
        if (unbound.isEmpty()) {
            return StageResult.of(text, text);
        }

        List<String> lines = SourceLines.split(text);
        List<String> stubs = new ArrayList<>();
        for (String name : unbound) {
            stubs.add(name + " = " + STUB_VALUE);
        }
        lines.addAll(insertionIndex(lines, tree), stubs);

        log.info("[ScopeStub] Inserted stubs for {}", unbound);
        return StageResult.of(text, SourceLines.join(lines));
    }

    private int insertionIndex(List<String> lines, SyntaxTree tree) {
        int index = 0;
        if (!lines.isEmpty() && lines.get(0).startsWith("#!")) {
            index = 1;
        }
        for (int i = index; i < Math.min(2, lines.size()); i++) {
            if (ENCODING_DECLARATION.matcher(lines.get(i)).matches()) {
                index = i + 1;
            }
        }

        // Stubs go after a module docstring and any __future__ imports
        int lastHeaderLine = -1;
        List<SyntaxNode> body = tree.getRoot().getBody();
        for (int i = 0; i < body.size(); i++) {
            SyntaxNode statement = body.get(i);
            if (i == 0 && isDocstring(statement)) {
                lastHeaderLine = statement.getLine();
                continue;
            }
            if (statement.getKind() != NodeKind.IMPORT_FROM || !"__future__".equals(statement.getIdentifier())) {
                break;
            }
            lastHeaderLine = statement.getLine();
        }
        if (lastHeaderLine > 0) {
            List<LineScanner.LineInfo> infos = LineScanner.scan(lines);
            int end = lastHeaderLine - 1;
            while (end < lines.size() - 1 && infos.get(end).continuesAfter) {
                end++;
            }
            index = Math.max(index, end + 1);
        }
        return Math.min(index, lines.size());
    }

    private static boolean isDocstring(SyntaxNode statement) {
        if (statement.getKind() != NodeKind.EXPR) {
            return false;
        }
        SyntaxNode value = statement.getValue();
        return value != null && value.getKind() == NodeKind.CONSTANT
                && value.getIdentifier() != null
                && (value.getIdentifier().endsWith("\"") || value.getIdentifier().endsWith("'"));
    }
}
