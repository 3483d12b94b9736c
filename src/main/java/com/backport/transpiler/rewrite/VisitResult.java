package com.backport.transpiler.rewrite;

import java.util.List;

import com.backport.transpiler.model.Node;

/**
 * Outcome of visiting a node with a {@link NodeTransformer}: keep it as is,
 * replace it with one node, splice in several nodes (list positions only),
 * or delete it.
 */
public final class VisitResult {

    private static final VisitResult DELETE = new VisitResult(List.of(), true);

    private final List<Node> nodes;
    private final boolean deleted;

    private VisitResult(List<Node> nodes, boolean deleted) {
        this.nodes = nodes;
        this.deleted = deleted;
    }

    public static VisitResult replaceWith(Node node) {
        return new VisitResult(List.of(node), false);
    }

    public static VisitResult keep(Node node) {
        return replaceWith(node);
    }

    public static VisitResult expandTo(List<Node> nodes) {
        return new VisitResult(List.copyOf(nodes), false);
    }

    public static VisitResult delete() {
        return DELETE;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public boolean isSingle() {
        return !deleted && nodes.size() == 1;
    }

    public Node getNode() {
        if (!isSingle()) {
            throw new IllegalStateException("Visit result does not hold exactly one node");
        }
        return nodes.get(0);
    }

    public List<Node> getNodes() {
        return nodes;
    }
}
