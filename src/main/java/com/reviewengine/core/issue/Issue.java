package com.reviewengine.core.issue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Issue - one finding produced by a detector.
 *
 * Line numbers are 1-based; line 0 marks an issue with no source location
 * (tool invocation failures).
 */
public final class Issue {

    public static final int NO_LINE = 0;

    private final IssueKind kind;
    private final String message;
    private final int line;

    public Issue(IssueKind kind, String message, int line) {
        if (kind == null) {
            throw new IllegalArgumentException("Issue kind is required");
        }
        if (line < 0) {
            throw new IllegalArgumentException("Issue line must be >= 0, got " + line);
        }
        this.kind = kind;
        this.message = message != null ? message : "";
        this.line = line;
    }

    public static Issue syntaxError(String message, int line) {
        return new Issue(IssueKind.SYNTAX_ERROR, message, line);
    }

    public static Issue undefinedVariable(String name, int line) {
        return new Issue(IssueKind.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'", line);
    }

    public static Issue codeSmell(String message, int line) {
        return new Issue(IssueKind.CODE_SMELL, message, line);
    }

    public static Issue styleIssue(String message, int line) {
        return new Issue(IssueKind.STYLE_ISSUE, message, line);
    }

    public static Issue toolError(String message) {
        return new Issue(IssueKind.TOOL_ERROR, message, NO_LINE);
    }

    @JsonIgnore
    public IssueKind getKind() {
        return kind;
    }

    @JsonProperty("type")
    public String getLabel() {
        return kind.getLabel();
    }

    public String getMessage() {
        return message;
    }

    public int getLine() {
        return line;
    }

    /**
     * Report line, e.g. {@code Line 3: [Undefined Variable] Undefined variable 'x'}.
     */
    public String render() {
        return "Line " + line + ": [" + kind.getLabel() + "] " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Issue)) return false;
        Issue other = (Issue) o;
        return line == other.line && kind == other.kind && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, line);
    }

    @Override
    public String toString() {
        return render();
    }
}
