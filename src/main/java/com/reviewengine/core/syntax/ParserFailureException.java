package com.reviewengine.core.syntax;

/**
 * The parser could not give an answer at all: the interpreter is missing,
 * timed out, or gave up on the input (recursion or memory limits).
 *
 * Distinct from {@link ParseException}, which is a located syntax error in
 * otherwise analyzable input.
 */
public class ParserFailureException extends RuntimeException {

    public ParserFailureException(String message) {
        super(message);
    }

    public ParserFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
