package com.backport.transpiler.fixer;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.rewrite.TreeWalker;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Strips return and parameter annotations from function definitions.
 */
public class RemoveFunctionDefAnnotationsFixer extends AbstractFixer {

    public static final String NAME = "remove_function_def_annotations";

    public RemoveFunctionDefAnnotationsFixer() {
        super(NAME, ApplicabilityWindow.of("1.0", "2.7"));
    }

    @Override
    public Node apply(BuildConfig config, Node module) {
        for (Node function : TreeWalker.walk(module, NodeKind.FUNCTION_DEF)) {
            function.set("returns", null);
            Node args = function.getNode("args");
            args.getNodes("args").forEach(arg -> arg.set("annotation", null));
            args.getNodes("kwonlyargs").forEach(arg -> arg.set("annotation", null));
            clearAnnotation(args.getNode("vararg"));
            clearAnnotation(args.getNode("kwarg"));
        }
        return module;
    }

    private static void clearAnnotation(Node arg) {
        if (arg != null) {
            arg.set("annotation", null);
        }
    }
}
