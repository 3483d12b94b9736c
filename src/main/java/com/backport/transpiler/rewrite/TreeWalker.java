package com.backport.transpiler.rewrite;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.backport.transpiler.model.FieldSpec;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;

import lombok.experimental.UtilityClass;

/**
 * Whole-tree scans. Nodes are returned in document order (pre-order, fields
 * in schema order). The result is a snapshot, so callers may mutate the
 * visited nodes while iterating.
 */
@UtilityClass
public class TreeWalker {

    public static List<Node> walk(Node root) {
        List<Node> result = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            result.add(node);
            List<Node> children = children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    public static List<Node> walk(Node root, NodeKind first, NodeKind... rest) {
        Set<NodeKind> kinds = EnumSet.of(first, rest);
        return walk(root).stream()
                .filter(node -> kinds.contains(node.getKind()))
                .toList();
    }

    /**
     * Direct children of a node in schema order, skipping absent ones.
     */
    public static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        for (FieldSpec spec : node.getKind().getFields()) {
            switch (spec.getShape()) {
                case NODE -> {
                    Node child = node.getNode(spec.getName());
                    if (child != null) {
                        children.add(child);
                    }
                }
                case NODE_LIST, STATEMENT_LIST -> {
                    for (Node child : node.getNodes(spec.getName())) {
                        if (child != null) {
                            children.add(child);
                        }
                    }
                }
                case VALUE -> {
                    // primitives have no children
                }
            }
        }
        return children;
    }
}
