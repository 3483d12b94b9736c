package com.backport.transpiler.cli.exception;

import java.util.List;

/**
 * Every problem found in the {@code resolve} options (target version, fixer
 * and checker allowlists), reported together instead of one per run.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(errors.size() == 1
                ? "Invalid resolve option: " + errors.get(0)
                : "Invalid resolve options (" + errors.size() + "):" + System.lineSeparator()
                        + String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
