package com.backport.transpiler.fixer;

import java.util.Set;

import com.backport.transpiler.checker.NoOverriddenBuiltinsChecker;
import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.model.ExprContext;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.rewrite.TreeWalker;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Renames reads of {@code range} to the lazy {@code xrange}.
 */
public class RangeToXrangeFixer extends AbstractFixer {

    public static final String NAME = "range_to_xrange";

    public RangeToXrangeFixer() {
        super(NAME, ApplicabilityWindow.of("1.0", "2.7"));
    }

    @Override
    public Set<String> getRequiredCheckers() {
        return Set.of(NoOverriddenBuiltinsChecker.NAME);
    }

    @Override
    public Node apply(BuildConfig config, Node module) {
        for (Node name : TreeWalker.walk(module, NodeKind.NAME)) {
            if ("range".equals(name.getString("id")) && name.getContext() == ExprContext.LOAD) {
                name.set("id", "xrange");
            }
        }
        return module;
    }
}
