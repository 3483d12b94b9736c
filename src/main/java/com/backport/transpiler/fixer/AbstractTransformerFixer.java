package com.backport.transpiler.fixer;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.rewrite.NodeTransformer;
import com.backport.transpiler.rewrite.VisitResult;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Fixer that rewrites specific node kinds wherever the structural engine
 * meets them. Subclasses override {@link #visit(Node)} and call
 * {@link #genericVisit(Node)} for kinds they leave alone.
 */
public abstract class AbstractTransformerFixer extends AbstractFixer {

    private final DelegatingTransformer transformer = new DelegatingTransformer();

    protected AbstractTransformerFixer(String name, ApplicabilityWindow applicability) {
        super(name, applicability);
    }

    @Override
    public Node apply(BuildConfig config, Node module) {
        return transformer.transformTree(module);
    }

    protected abstract VisitResult visit(Node node);

    protected final VisitResult genericVisit(Node node) {
        return transformer.descend(node);
    }

    private final class DelegatingTransformer extends NodeTransformer {

        @Override
        protected VisitResult visit(Node node) {
            return AbstractTransformerFixer.this.visit(node);
        }

        VisitResult descend(Node node) {
            return genericVisit(node);
        }
    }
}
