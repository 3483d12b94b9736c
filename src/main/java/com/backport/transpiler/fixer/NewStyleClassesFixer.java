package com.backport.transpiler.fixer;

import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.model.Nodes;
import com.backport.transpiler.rewrite.VisitResult;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Makes classes without explicit bases inherit from {@code object}.
 */
public class NewStyleClassesFixer extends AbstractTransformerFixer {

    public static final String NAME = "new_style_classes";

    public NewStyleClassesFixer() {
        super(NAME, ApplicabilityWindow.of("2.0", "2.7"));
    }

    @Override
    protected VisitResult visit(Node node) {
        if (node.is(NodeKind.CLASS_DEF) && node.getNodes("bases").isEmpty()) {
            node.getNodes("bases").add(Nodes.name("object"));
        }
        return genericVisit(node);
    }
}
