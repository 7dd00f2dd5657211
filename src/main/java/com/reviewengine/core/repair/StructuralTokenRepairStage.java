package com.reviewengine.core.repair;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * StructuralTokenRepairStage - closes unterminated block openers.
 *
 * Three passes over the physical lines:
 *   1. an if/elif/for/while/def/class line with a clause but no block colon
 *      gets ':' (before a trailing comment, if any)
 *   2. every tab becomes four spaces
 *   3. a block opener ending in ':' whose next line is blank or missing gets
 *      a 'pass' body one level deeper
 *
 * Lines are only appended to or inserted; none is removed.
 */
@Component
public class StructuralTokenRepairStage implements RepairStage {

    private static final Logger log = LoggerFactory.getLogger(StructuralTokenRepairStage.class);

    static final String INDENT_UNIT = "    ";
    static final String PLACEHOLDER = "pass";

    // Keyword followed by a non-empty clause
    private static final Pattern DELIMITED_OPENER =
            Pattern.compile("^(?:async\\s+)?(?:if|elif|for|while|def|class)\\b\\s*\\S.*$");

    private static final Pattern BLOCK_OPENER =
            Pattern.compile("^(?:async\\s+)?(?:if|elif|else|for|while|def|class|try|except|finally|with)\\b.*$");

    @Override
    public String getName() {
        return "structural-token-repair";
    }

    @Override
    public StageResult apply(String text) {
        List<String> lines = SourceLines.split(text);

        int delimiters = addMissingDelimiters(lines);

        for (int i = 0; i < lines.size(); i++) {
            lines.set(i, lines.get(i).replace("\t", INDENT_UNIT));
        }

        int placeholders = addPlaceholderBodies(lines);

        if (delimiters + placeholders > 0) {
            log.info("[StructuralRepair] Added {} delimiters, {} placeholder bodies", delimiters, placeholders);
        }
        return StageResult.of(text, SourceLines.join(lines));
    }

    private int addMissingDelimiters(List<String> lines) {
        List<LineScanner.LineInfo> infos = LineScanner.scan(lines);
        int added = 0;
        for (int i = 0; i < lines.size(); i++) {
            LineScanner.LineInfo info = infos.get(i);
            String line = lines.get(i);
            if (!info.isCode() || info.topLevelColon || info.continuesAfter) {
                continue;
            }
            // The colon of a truncated opener was cut off with the rest of the line
            if (line.endsWith(LineTruncationStage.TRUNCATION_MARKER)) {
                continue;
            }
            String code = codePart(line, info);
            if (!DELIMITED_OPENER.matcher(code.strip()).matches()) {
                continue;
            }
            int end = code.stripTrailing().length();
            lines.set(i, line.substring(0, end) + ":" + line.substring(end));
            added++;
        }
        return added;
    }

    private int addPlaceholderBodies(List<String> lines) {
        List<LineScanner.LineInfo> infos = LineScanner.scan(lines);
        int added = 0;
        // Walk backwards so insertions do not shift lines still to be visited
        for (int i = lines.size() - 1; i >= 0; i--) {
            LineScanner.LineInfo info = infos.get(i);
            String line = lines.get(i);
            if (!info.isCode() || info.continuesAfter) {
                continue;
            }
            String code = codePart(line, info).strip();
            if (!code.endsWith(":") || !BLOCK_OPENER.matcher(code).matches()) {
                continue;
            }
            boolean bodyMissing = i + 1 >= lines.size() || lines.get(i + 1).isBlank();
            if (bodyMissing) {
                lines.add(i + 1, SourceLines.leadingWhitespace(line) + INDENT_UNIT + PLACEHOLDER);
                added++;
            }
        }
        return added;
    }

    private static String codePart(String line, LineScanner.LineInfo info) {
        return info.commentStart >= 0 ? line.substring(0, info.commentStart) : line;
    }
}
