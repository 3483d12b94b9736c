package com.backport.transpiler.fixer;

import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.model.Nodes;
import com.backport.transpiler.rewrite.VisitResult;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Rewrites {@code x: T = v} to {@code x = v} and a bare {@code x: T} to {@code x = None}.
 */
public class RemoveAnnAssignFixer extends AbstractTransformerFixer {

    public static final String NAME = "remove_ann_assign";

    public RemoveAnnAssignFixer() {
        super(NAME, ApplicabilityWindow.of("1.0", "3.5"));
    }

    @Override
    protected VisitResult visit(Node node) {
        if (!node.is(NodeKind.ANN_ASSIGN)) {
            return genericVisit(node);
        }
        Node target = node.getNode("target");
        if (!target.is(NodeKind.NAME)) {
            throw new StructuralAssumptionException("Annotated assignment target must be a name, got "
                    + target.getKind().getDisplayName());
        }
        Node value = node.getNode("value");
        return VisitResult.replaceWith(Nodes.assign(target, value != null ? value : Nodes.none()));
    }
}
