package com.reviewengine.core.detector;

import com.reviewengine.core.issue.Issue;
import com.reviewengine.core.issue.IssueKind;
import com.reviewengine.core.syntax.PythonParser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LongFunctionDetectorTest {

    private final LongFunctionDetector detector =
            new LongFunctionDetector(new PythonParser(), LongFunctionDetector.DEFAULT_MAX_STATEMENTS);

    static String functionWithStatements(String name, int count) {
        StringBuilder source = new StringBuilder("def " + name + "():\n");
        for (int i = 0; i < count; i++) {
            source.append("    x").append(i).append(" = ").append(i).append('\n');
        }
        return source.toString();
    }

    @Test
    void testTwentyFiveStatementsIsOneSmell() {
        List<Issue> issues = detector.detect(functionWithStatements("big", 25));

        assertEquals(1, issues.size());
        assertEquals(IssueKind.CODE_SMELL, issues.get(0).getKind());
        assertEquals("Function 'big' is too long (25 lines).", issues.get(0).getMessage());
        assertEquals(1, issues.get(0).getLine());
    }

    @Test
    void testThresholdIsExclusive() {
        assertTrue(detector.detect(functionWithStatements("edge", 20)).isEmpty());
        assertEquals(1, detector.detect(functionWithStatements("edge", 21)).size());
    }

    @Test
    void testOnlyImmediateBodyCounts() {
        StringBuilder source = new StringBuilder("def nested():\n    if True:\n");
        for (int i = 0; i < 30; i++) {
            source.append("        y").append(i).append(" = ").append(i).append('\n');
        }

        assertTrue(detector.detect(source.toString()).isEmpty());
    }

    @Test
    void testCallerSuppliedThreshold() {
        String source = "x = 1\n\n" + functionWithStatements("medium", 6);

        List<Issue> issues = detector.detect(source, 5);

        assertEquals(1, issues.size());
        assertEquals(3, issues.get(0).getLine());
        assertTrue(detector.detect(source, 6).isEmpty());
    }

    @Test
    void testMethodsAndAsyncFunctionsAreChecked() {
        String source = "class A:\n"
                + functionWithStatements("method", 3).replaceAll("(?m)^", "    ")
                + "async " + functionWithStatements("fetch", 3);

        assertEquals(2, detector.detect(source, 2).size());
    }

    @Test
    void testUnparseableSourceYieldsNothing() {
        assertTrue(detector.detect("def f(\n", 0).isEmpty());
    }
}
