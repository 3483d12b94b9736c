package com.backport.transpiler.pipeline;

import java.util.List;

import com.backport.transpiler.model.ImportDeclaration;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;

import lombok.Value;

/**
 * The rewritten module together with the imports it needs. Printing the
 * imports is left to the caller, or done in the tree by {@link #withImportsPrepended()}.
 */
@Value
public class TranspileResult {

    Node module;
    RequiredImports requiredImports;

    /**
     * Inserts the required imports at the top of the module, after a leading
     * docstring, skipping imports the module already has. Mutates and returns the module.
     */
    public Node withImportsPrepended() {
        List<Node> body = module.getNodes("body");
        int position = hasDocstring(body) ? 1 : 0;
        for (ImportDeclaration declaration : requiredImports.ordered()) {
            boolean present = body.stream().anyMatch(declaration::isProvidedBy);
            if (!present) {
                body.add(position++, declaration.toStatement());
            }
        }
        return module;
    }

    private static boolean hasDocstring(List<Node> body) {
        if (body.isEmpty()) {
            return false;
        }
        Node first = body.get(0);
        return first.is(NodeKind.EXPR) && first.getNode("value").is(NodeKind.STR);
    }
}
