package com.reviewengine.core.issue;

/**
 * Closed set of finding categories, with the label shown in rendered reports.
 */
public enum IssueKind {

    SYNTAX_ERROR("Syntax Error"),
    UNDEFINED_VARIABLE("Undefined Variable"),
    CODE_SMELL("Code Smell"),
    STYLE_ISSUE("Style/Formatting Issue"),
    TOOL_ERROR("Error");

    private final String label;

    IssueKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
