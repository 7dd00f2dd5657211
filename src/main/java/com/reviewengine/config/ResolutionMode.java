package com.reviewengine.config;

/**
 * How the scope analyzer decides whether a read is covered by a binding.
 *
 *   ORDERED   - a read is checked against the bindings seen so far in walk order;
 *               a use that precedes its assignment in the walk is undefined
 *   TWO_PHASE - all bindings are collected first, then every read is checked
 */
public enum ResolutionMode {
    ORDERED,
    TWO_PHASE
}
