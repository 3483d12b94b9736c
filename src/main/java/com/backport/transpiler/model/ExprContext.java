package com.backport.transpiler.model;

/**
 * Whether a name-like expression is read, written or deleted.
 */
public enum ExprContext {
    LOAD,
    STORE,
    DEL
}
