package com.backport.transpiler.exception;

/**
 * Source uses a construct that a checker forbids for the target version.
 */
public class CheckerViolationException extends TranspileException {

    private static final long serialVersionUID = 1L;
    private final String checkerName;

    public CheckerViolationException(String checkerName, String message) {
        super("[" + checkerName + "] " + message);
        this.checkerName = checkerName;
    }

    public String getCheckerName() {
        return checkerName;
    }
}
