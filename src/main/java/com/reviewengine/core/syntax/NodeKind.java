package com.reviewengine.core.syntax;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of Python syntax node kinds.
 *
 * Names follow Python's own ast module, whose output the tree is built
 * from, so walk order and field layout match it one-to-one.
 */
public enum NodeKind {

    // Module / statements
    MODULE,
    FUNCTION_DEF,
    ASYNC_FUNCTION_DEF,
    CLASS_DEF,
    RETURN,
    DELETE,
    ASSIGN,
    AUG_ASSIGN,
    ANN_ASSIGN,
    FOR,
    ASYNC_FOR,
    WHILE,
    IF,
    WITH,
    ASYNC_WITH,
    RAISE,
    TRY,
    TRY_STAR,
    ASSERT,
    IMPORT,
    IMPORT_FROM,
    GLOBAL,
    NONLOCAL,
    EXPR,
    PASS,
    BREAK,
    CONTINUE,
    MATCH,
    TYPE_ALIAS,

    // Expressions
    BOOL_OP,
    NAMED_EXPR,
    BIN_OP,
    UNARY_OP,
    LAMBDA,
    IF_EXP,
    DICT,
    SET,
    LIST_COMP,
    SET_COMP,
    DICT_COMP,
    GENERATOR_EXP,
    AWAIT,
    YIELD,
    YIELD_FROM,
    COMPARE,
    CALL,
    FORMATTED_VALUE,
    JOINED_STR,
    CONSTANT,
    ATTRIBUTE,
    SUBSCRIPT,
    STARRED,
    NAME,
    LIST,
    TUPLE,
    SLICE,

    // Auxiliary
    COMPREHENSION,
    EXCEPT_HANDLER,
    ARGUMENTS,
    ARG,
    KEYWORD,
    ALIAS,
    WITH_ITEM,
    TYPE_IGNORE,

    // Patterns (match statement)
    MATCH_CASE,
    MATCH_VALUE,
    MATCH_SINGLETON,
    MATCH_SEQUENCE,
    MATCH_MAPPING,
    MATCH_CLASS,
    MATCH_STAR,
    MATCH_AS,
    MATCH_OR,

    // Type parameters
    TYPE_VAR,
    PARAM_SPEC,
    TYPE_VAR_TUPLE,

    // Any ast class newer than this list
    OTHER;

    private static final Map<String, NodeKind> BY_NAME = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_NAME.put(kind.name(), kind);
        }
    }

    /**
     * Kind for an ast class name already in upper snake case
     * ({@code FunctionDef} arrives as {@code FUNCTION_DEF}); unknown names map to OTHER.
     */
    public static NodeKind fromAstName(String name) {
        return BY_NAME.getOrDefault(name, OTHER);
    }

    public boolean isFunctionDefinition() {
        return this == FUNCTION_DEF || this == ASYNC_FUNCTION_DEF;
    }

    public boolean isLoop() {
        return this == FOR || this == ASYNC_FOR;
    }
}
