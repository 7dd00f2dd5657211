package com.reviewengine.core.repair;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexical facts about each physical line that the line-oriented stages need
 * without a full parse: string and bracket state carried in from earlier
 * lines, where a trailing comment starts, and whether a block colon is
 * already present.
 */
final class LineScanner {

    static final class LineInfo {
        /** Line begins inside a triple-quoted string. */
        boolean startsInString;
        /** Line continues the previous logical line (open bracket or backslash). */
        boolean continuation;
        /** Index of a '#' comment outside strings, or -1. */
        int commentStart = -1;
        /** A ':' outside strings and brackets (walrus excluded). */
        boolean topLevelColon;
        /** Logical line is still open at the end of this physical line. */
        boolean continuesAfter;

        boolean isCode() {
            return !startsInString && !continuation;
        }
    }

    private LineScanner() {
    }

    static List<LineInfo> scan(List<String> lines) {
        List<LineInfo> infos = new ArrayList<>(lines.size());
        String triple = null;
        int depth = 0;
        boolean backslash = false;

        for (String line : lines) {
            LineInfo info = new LineInfo();
            info.startsInString = triple != null;
            info.continuation = depth > 0 || backslash;
            backslash = false;

            int i = 0;
            while (i < line.length()) {
                if (triple != null) {
                    int close = line.indexOf(triple, i);
                    if (close < 0) {
                        i = line.length();
                        break;
                    }
                    i = close + 3;
                    triple = null;
                    continue;
                }
                char c = line.charAt(i);
                if (c == '#') {
                    info.commentStart = i;
                    break;
                }
                if (c == '"' || c == '\'') {
                    String three = String.valueOf(c).repeat(3);
                    if (line.startsWith(three, i)) {
                        triple = three;
                        i += 3;
                        continue;
                    }
                    i = skipSingleQuoted(line, i);
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || c == '}') {
                    depth = Math.max(0, depth - 1);
                } else if (c == ':' && depth == 0
                        && !(i + 1 < line.length() && line.charAt(i + 1) == '=')) {
                    info.topLevelColon = true;
                }
                i++;
            }

            if (triple == null) {
                String code = info.commentStart >= 0 ? line.substring(0, info.commentStart) : line;
                backslash = info.commentStart < 0 && code.stripTrailing().endsWith("\\");
            }
            info.continuesAfter = triple != null || depth > 0 || backslash;
            infos.add(info);
        }
        return infos;
    }

    private static int skipSingleQuoted(String line, int start) {
        char quote = line.charAt(start);
        int i = start + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return line.length();
    }
}
