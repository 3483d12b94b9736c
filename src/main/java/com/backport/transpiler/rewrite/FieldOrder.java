package com.backport.transpiler.rewrite;

import java.util.Comparator;
import java.util.List;

import com.backport.transpiler.model.FieldSpec;
import com.backport.transpiler.model.Node;

import lombok.experimental.UtilityClass;

/**
 * Deterministic order in which rewriting visits the fields of a node:
 * expression-level fields first, statement blocks last, by name within each group.
 * Expressions of a statement are therefore expanded and hoisted before the
 * engine descends into its nested blocks.
 */
@UtilityClass
public class FieldOrder {

    private static final Comparator<FieldSpec> REWRITE_ORDER = Comparator
            .comparing(FieldSpec::isStatementList)
            .thenComparing(FieldSpec::getName);

    public static List<FieldSpec> sorted(Node node) {
        return node.getKind().getFields().stream()
                .sorted(REWRITE_ORDER)
                .toList();
    }
}
