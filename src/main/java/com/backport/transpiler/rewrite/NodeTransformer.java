package com.backport.transpiler.rewrite;

import java.util.ArrayList;
import java.util.List;

import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.model.FieldSpec;
import com.backport.transpiler.model.Node;

/**
 * Structural transform over a tree. Subclasses override {@link #visit(Node)},
 * switch on the node kind and either return a {@link VisitResult} or fall
 * back to {@link #genericVisit(Node)}, which visits every child and applies
 * the results by mutating the parent's fields in place.
 *
 * <p>Children are visited in {@link FieldOrder}.
 */
public abstract class NodeTransformer {

    /**
     * Transforms the tree rooted at {@code root} and returns the (possibly new) root.
     */
    public Node transformTree(Node root) {
        VisitResult result = visit(root);
        if (!result.isSingle()) {
            throw new StructuralAssumptionException("Root " + root.getKind().getDisplayName()
                    + " must be replaced by exactly one node");
        }
        return result.getNode();
    }

    protected VisitResult visit(Node node) {
        return genericVisit(node);
    }

    protected final VisitResult genericVisit(Node node) {
        for (FieldSpec spec : FieldOrder.sorted(node)) {
            switch (spec.getShape()) {
                case NODE -> visitSingleField(node, spec);
                case NODE_LIST, STATEMENT_LIST -> visitListField(node, spec);
                case VALUE -> {
                    // nothing to visit
                }
            }
        }
        return VisitResult.keep(node);
    }

    private void visitSingleField(Node parent, FieldSpec spec) {
        Node child = parent.getNode(spec.getName());
        if (child == null) {
            return;
        }
        VisitResult result = visit(child);
        if (result.isDeleted()) {
            // rejected by the schema if the field is required
            parent.set(spec.getName(), null);
        } else if (result.isSingle()) {
            if (result.getNode() != child) {
                parent.set(spec.getName(), result.getNode());
            }
        } else {
            throw new StructuralAssumptionException("Cannot splice " + result.getNodes().size()
                    + " nodes into single-node field " + parent.getKind().getDisplayName() + "." + spec.getName());
        }
    }

    private void visitListField(Node parent, FieldSpec spec) {
        List<Node> original = parent.getNodes(spec.getName());
        List<Node> rewritten = new ArrayList<>(original.size());
        boolean changed = false;
        for (Node child : new ArrayList<>(original)) {
            if (child == null) {
                rewritten.add(null);
                continue;
            }
            VisitResult result = visit(child);
            if (result.isSingle() && result.getNode() == child) {
                rewritten.add(child);
                continue;
            }
            changed = true;
            rewritten.addAll(result.getNodes());
        }
        if (changed) {
            parent.set(spec.getName(), rewritten);
        }
    }
}
