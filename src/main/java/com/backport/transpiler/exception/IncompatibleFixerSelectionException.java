package com.backport.transpiler.exception;

import java.util.List;

/**
 * A selected fixer is outside its own compatibility window for the
 * requested target version.
 */
public class IncompatibleFixerSelectionException extends TranspileException {

    private static final long serialVersionUID = 1L;
    private final List<String> fixerNames;

    public IncompatibleFixerSelectionException(String targetVersion, List<String> fixerNames) {
        super("Fixers " + fixerNames + " are not compatible with target version " + targetVersion);
        this.fixerNames = List.copyOf(fixerNames);
    }

    public List<String> getFixerNames() {
        return fixerNames;
    }
}
