package com.reviewengine.core.repair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Physical-line view of a text. Splitting then joining returns the original
 * text, trailing newline included.
 */
final class SourceLines {

    private SourceLines() {
    }

    static List<String> split(String text) {
        return new ArrayList<>(Arrays.asList(text.split("\n", -1)));
    }

    static String join(List<String> lines) {
        return String.join("\n", lines);
    }

    static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }
}
