package com.backport.transpiler.exception;

/**
 * Base class for every failure raised while resolving or applying fixers.
 * All failures are local to one source unit; the caller decides whether
 * to abort the batch or skip the unit.
 */
public class TranspileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TranspileException(String message) {
        super(message);
    }

    public TranspileException(String message, Throwable cause) {
        super(message, cause);
    }
}
