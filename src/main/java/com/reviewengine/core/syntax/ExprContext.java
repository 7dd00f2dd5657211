package com.reviewengine.core.syntax;

/**
 * How an expression node is used: read, bound, or deleted.
 */
public enum ExprContext {
    LOAD,
    STORE,
    DEL
}
