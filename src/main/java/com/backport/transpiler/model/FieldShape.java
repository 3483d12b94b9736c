package com.backport.transpiler.model;

/**
 * What a field of a node holds.
 */
public enum FieldShape {
    /** A single child node, possibly absent if the field is optional. */
    NODE,
    /** An ordered list of child nodes. */
    NODE_LIST,
    /** An ordered list of statements forming a block body. */
    STATEMENT_LIST,
    /** A string, number, boolean, {@link ExprContext} or null. */
    VALUE
}
