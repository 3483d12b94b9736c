package com.backport.transpiler.fixer;

import java.util.Map;
import java.util.Set;

import com.backport.transpiler.checker.NoOverriddenBuiltinsChecker;
import com.backport.transpiler.model.ExprContext;
import com.backport.transpiler.model.ImportDeclaration;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.model.Nodes;
import com.backport.transpiler.rewrite.VisitResult;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Replaces reads of {@code map}, {@code zip} and {@code filter} with their lazy
 * {@code itertools} counterparts and requires {@code import itertools} when any
 * was found.
 *
 * <p>Matches by name only, so it depends on the builtins not being rebound in
 * the module (see {@link NoOverriddenBuiltinsChecker}).
 */
public class ItertoolsBuiltinsFixer extends AbstractTransformerFixer {

    public static final String NAME = "itertools_builtins";

    private static final String ITERTOOLS = "itertools";

    private static final Map<String, String> REPLACEMENTS = Map.of(
            "map", "imap",
            "zip", "izip",
            "filter", "ifilter");

    public ItertoolsBuiltinsFixer() {
        super(NAME, ApplicabilityWindow.of("2.0", "2.7"));
    }

    @Override
    public Set<String> getRequiredCheckers() {
        return Set.of(NoOverriddenBuiltinsChecker.NAME);
    }

    @Override
    protected VisitResult visit(Node node) {
        if (!node.is(NodeKind.NAME) || node.getContext() != ExprContext.LOAD) {
            return genericVisit(node);
        }
        String replacement = REPLACEMENTS.get(node.getString("id"));
        if (replacement == null) {
            return VisitResult.keep(node);
        }
        requireImport(ImportDeclaration.module(ITERTOOLS));
        return VisitResult.replaceWith(Nodes.attribute(Nodes.name(ITERTOOLS), replacement));
    }
}
