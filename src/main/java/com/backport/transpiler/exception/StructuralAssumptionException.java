package com.backport.transpiler.exception;

/**
 * A fixer met a tree shape it cannot rewrite safely, e.g. a non-name
 * assignment target or a non-literal keyword-only default.
 */
public class StructuralAssumptionException extends TranspileException {

    private static final long serialVersionUID = 1L;

    public StructuralAssumptionException(String message) {
        super(message);
    }
}
