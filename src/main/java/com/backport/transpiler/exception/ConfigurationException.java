package com.backport.transpiler.exception;

/**
 * Invalid or contradictory build configuration: unknown fixer or checker
 * names, unparsable versions, impossible version windows.
 * Raised before any tree is touched.
 */
public class ConfigurationException extends TranspileException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
