package com.reviewengine.core.syntax;

/**
 * Raised when source text cannot be turned into a {@link SyntaxTree}.
 *
 * The message is the parser's diagnostic on its own (e.g. {@code expected ':'}),
 * the line is 1-based.
 */
public class ParseException extends Exception {

    private final int line;

    public ParseException(int line, String message) {
        super(message);
        this.line = Math.max(line, 1);
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return String.format("ParseException{line=%d, message=%s}", line, getMessage());
    }
}
