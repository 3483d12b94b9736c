package com.backport.transpiler.checker;

import java.util.Set;

import com.backport.transpiler.model.ExprContext;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Rejects modules that rebind one of the builtins renamed by fixers, so that
 * every load of such a name really refers to the builtin.
 * Covers binding names of every statement kind and parameters.
 */
public class NoOverriddenBuiltinsChecker extends AbstractChecker {

    public static final String NAME = "no_overridden_builtins";

    static final Set<String> PROTECTED_BUILTINS = Set.of("map", "zip", "filter", "range");

    public NoOverriddenBuiltinsChecker() {
        super(NAME, ApplicabilityWindow.of("1.0", "2.7"));
    }

    @Override
    protected void checkNode(Node node) {
        switch (node.getKind()) {
            case NAME -> {
                if (node.getContext() != ExprContext.LOAD) {
                    checkName(node.getString("id"), "assignment");
                }
            }
            case FUNCTION_DEF -> checkName(node.getString("name"), "function definition");
            case CLASS_DEF -> checkName(node.getString("name"), "class definition");
            case ARG -> checkName(node.getString("arg"), "parameter");
            case EXCEPT_HANDLER -> checkName(node.getString("name"), "exception handler");
            case ALIAS -> {
                String asname = node.getString("asname");
                checkName(asname != null ? asname : node.getString("name"), "import");
            }
            default -> {
            }
        }
    }

    private void checkName(String name, String where) {
        if (PROTECTED_BUILTINS.contains(name)) {
            throw violation("Builtin '" + name + "' must not be overridden (" + where + ")");
        }
    }
}
