package com.backport.transpiler.fixer;

import java.util.ArrayList;
import java.util.List;

import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.model.Nodes;
import com.backport.transpiler.rewrite.TreeWalker;
import com.backport.transpiler.rewrite.VisitResult;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Rewrites zero-argument {@code super()} inside methods to
 * {@code super(ClassName, self)}, where {@code self} is the method's first parameter.
 */
public class ShortToLongFormSuperFixer extends AbstractTransformerFixer {

    public static final String NAME = "short_to_long_form_super";

    public ShortToLongFormSuperFixer() {
        super(NAME, ApplicabilityWindow.of("2.2", "2.7"));
    }

    @Override
    protected VisitResult visit(Node node) {
        if (node.is(NodeKind.CLASS_DEF)) {
            String className = node.getString("name");
            List<Node> methods = new ArrayList<>();
            collectMethods(node.getNodes("body"), methods);
            for (Node method : methods) {
                fixMethod(className, method);
            }
        }
        // nested classes are handled when the engine reaches them
        return genericVisit(node);
    }

    /**
     * Methods of a class body, including those under {@code if} or {@code try}
     * in the body. Stops at nested classes.
     */
    private static void collectMethods(List<Node> nodes, List<Node> methods) {
        for (Node node : nodes) {
            if (node == null || node.is(NodeKind.CLASS_DEF)) {
                continue;
            }
            if (node.is(NodeKind.FUNCTION_DEF)) {
                methods.add(node);
                continue;
            }
            collectMethods(TreeWalker.children(node), methods);
        }
    }

    private void fixMethod(String className, Node method) {
        List<Node> params = method.getNode("args").getNodes("args");
        if (params.isEmpty()) {
            return;
        }
        String selfName = params.get(0).getString("arg");
        for (Node call : superCalls(method)) {
            call.set("args", List.of(Nodes.name(className), Nodes.name(selfName)));
        }
    }

    private static List<Node> superCalls(Node method) {
        List<Node> calls = new ArrayList<>();
        collectSuperCalls(method.getNodes("body"), calls);
        return calls;
    }

    private static void collectSuperCalls(List<Node> nodes, List<Node> calls) {
        for (Node node : nodes) {
            if (node == null || node.is(NodeKind.CLASS_DEF)) {
                continue;
            }
            if (isBareSuperCall(node)) {
                calls.add(node);
            }
            collectSuperCalls(TreeWalker.children(node), calls);
        }
    }

    private static boolean isBareSuperCall(Node node) {
        if (!node.is(NodeKind.CALL) || !node.getNodes("args").isEmpty()) {
            return false;
        }
        Node func = node.getNode("func");
        return func.is(NodeKind.NAME) && "super".equals(func.getString("id"));
    }
}
