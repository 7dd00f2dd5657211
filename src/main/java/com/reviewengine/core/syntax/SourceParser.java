package com.reviewengine.core.syntax;

/**
 * Parser boundary: source text in, syntax tree or located failure out.
 */
@FunctionalInterface
public interface SourceParser {

    /**
     * @param source full source text
     * @return a fresh, immutable tree owned by the caller
     * @throws ParseException if the text is not valid for the target grammar
     */
    SyntaxTree parse(String source) throws ParseException;
}
