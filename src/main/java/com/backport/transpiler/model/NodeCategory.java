package com.backport.transpiler.model;

/**
 * Syntactic role of a node kind. Field schemas state which role a child
 * must have, so statements never end up in expression slots and vice versa.
 */
public enum NodeCategory {
    MODULE,
    STATEMENT,
    EXPRESSION,
    /**
     * Helper nodes that are neither statements nor expressions
     * (parameters, keywords, import aliases, exception handlers, subscript slices).
     */
    SUPPORT
}
