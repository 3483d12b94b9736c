package com.backport.transpiler.checker;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.exception.CheckerViolationException;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.rewrite.TreeWalker;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Checker that inspects every node of the module in document order.
 */
public abstract class AbstractChecker implements Checker {

    private final String name;
    private final ApplicabilityWindow applicability;

    protected AbstractChecker(String name, ApplicabilityWindow applicability) {
        this.name = name;
        this.applicability = applicability;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ApplicabilityWindow getApplicability() {
        return applicability;
    }

    @Override
    public void check(BuildConfig config, Node module) {
        for (Node node : TreeWalker.walk(module)) {
            checkNode(node);
        }
    }

    protected abstract void checkNode(Node node);

    protected CheckerViolationException violation(String message) {
        return new CheckerViolationException(name, message);
    }

    @Override
    public String toString() {
        return name + " (" + applicability + ")";
    }
}
