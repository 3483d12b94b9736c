package com.backport.transpiler.checker;

import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Rejects the {@code @} operator, which has no equivalent before 3.5.
 */
public class NoMatMulOperatorChecker extends AbstractChecker {

    public static final String NAME = "no_matmul_operator";

    static final String MATMUL = "@";

    public NoMatMulOperatorChecker() {
        super(NAME, ApplicabilityWindow.of("1.0", "3.4"));
    }

    @Override
    protected void checkNode(Node node) {
        if (node.is(NodeKind.BIN_OP) && MATMUL.equals(node.getString("op"))) {
            throw violation("Matrix multiplication operator '@' is not supported by the target version");
        }
    }
}
