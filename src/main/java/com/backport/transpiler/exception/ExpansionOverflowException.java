package com.backport.transpiler.exception;

/**
 * The fixed-point expansion of a statement block grew past its bound.
 * Indicates a nesting pattern the expansion does not converge on.
 */
public class ExpansionOverflowException extends TranspileException {

    private static final long serialVersionUID = 1L;
    private final int initialLength;
    private final int currentLength;

    public ExpansionOverflowException(int initialLength, int currentLength) {
        super("Expansion overflow: block grew from " + initialLength + " to " + currentLength + " statements");
        this.initialLength = initialLength;
        this.currentLength = currentLength;
    }

    public int getInitialLength() {
        return initialLength;
    }

    public int getCurrentLength() {
        return currentLength;
    }
}
