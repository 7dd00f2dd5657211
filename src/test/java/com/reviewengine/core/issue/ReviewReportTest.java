package com.reviewengine.core.issue;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReviewReportTest {

    private ReviewReport sampleReport() {
        ReviewReport report = new ReviewReport();
        report.addAll(List.of(Issue.undefinedVariable("x", 3)));
        report.addAll(List.of(Issue.codeSmell("Function 'f' is too long (25 lines).", 1)));
        report.addAll(List.of(
                Issue.styleIssue("E225 - missing whitespace around operator", 3),
                Issue.undefinedVariable("y", 4)));
        return report;
    }

    @Test
    void testIssuesKeepInsertionOrder() {
        List<Issue> issues = sampleReport().getIssues();

        assertEquals(4, issues.size());
        assertEquals(IssueKind.UNDEFINED_VARIABLE, issues.get(0).getKind());
        assertEquals(IssueKind.CODE_SMELL, issues.get(1).getKind());
        assertEquals(IssueKind.STYLE_ISSUE, issues.get(2).getKind());
        assertEquals("Undefined variable 'y'", issues.get(3).getMessage());
    }

    @Test
    void testSameLineFromTwoDetectorsIsKept() {
        ReviewReport report = sampleReport();

        long onLineThree = report.getIssues().stream().filter(issue -> issue.getLine() == 3).count();
        assertEquals(2, onLineThree);
    }

    @Test
    void testCountsAndFilters() {
        ReviewReport report = sampleReport();

        assertEquals(Map.of(
                IssueKind.UNDEFINED_VARIABLE, 2,
                IssueKind.CODE_SMELL, 1,
                IssueKind.STYLE_ISSUE, 1), report.countsByKind());
        assertEquals(2, report.byKind(IssueKind.UNDEFINED_VARIABLE).size());
        assertTrue(report.hasKind(IssueKind.CODE_SMELL));
        assertFalse(report.hasKind(IssueKind.SYNTAX_ERROR));
    }

    @Test
    void testRender() {
        ReviewReport report = new ReviewReport(List.of(
                Issue.syntaxError("expected ':'", 2),
                Issue.toolError("flake8 is not installed. Please install it using 'pip install flake8'.")));

        assertEquals(
                "Line 2: [Syntax Error] expected ':'\n"
                        + "Line 0: [Error] flake8 is not installed. Please install it using 'pip install flake8'.",
                report.render());
    }

    @Test
    void testToolErrorHasNoLocation() {
        assertEquals(Issue.NO_LINE, Issue.toolError("boom").getLine());
    }

    @Test
    void testNegativeLineIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Issue(IssueKind.CODE_SMELL, "x", -1));
    }

    @Test
    void testEmptyReport() {
        ReviewReport report = new ReviewReport();

        assertTrue(report.isEmpty());
        assertEquals("", report.render());
        assertTrue(report.countsByKind().isEmpty());
    }
}
