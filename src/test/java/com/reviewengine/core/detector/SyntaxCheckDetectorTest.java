package com.reviewengine.core.detector;

import com.reviewengine.core.issue.Issue;
import com.reviewengine.core.issue.IssueKind;
import com.reviewengine.core.syntax.PythonParser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxCheckDetectorTest {

    private final SyntaxCheckDetector detector = new SyntaxCheckDetector(new PythonParser());

    @Test
    void testValidSourceHasNoIssues() {
        assertTrue(detector.detect("def add(a, b):\n    return a + b\n").isEmpty());
    }

    @Test
    void testMissingColon() {
        List<Issue> issues = detector.detect("def f():\n    if x > 5\n        return y\n");

        assertEquals(1, issues.size());
        assertEquals(IssueKind.SYNTAX_ERROR, issues.get(0).getKind());
        assertEquals(2, issues.get(0).getLine());
        assertEquals("expected ':'", issues.get(0).getMessage());
    }

    @Test
    void testParserMessageIsVerbatim() {
        List<Issue> issues = detector.detect("x = (1,\n");

        assertEquals("'(' was never closed", issues.get(0).getMessage());
        assertEquals(1, issues.get(0).getLine());
    }
}
