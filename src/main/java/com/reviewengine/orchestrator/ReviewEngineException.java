package com.reviewengine.orchestrator;

/**
 * Raised when the original input cannot be analyzed for a reason other than
 * a reportable syntax error (e.g. nesting deep enough to exhaust the stack).
 * No review or repair is attempted on such input.
 */
public class ReviewEngineException extends RuntimeException {

    public ReviewEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
