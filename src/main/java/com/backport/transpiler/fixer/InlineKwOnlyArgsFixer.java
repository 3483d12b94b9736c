package com.backport.transpiler.fixer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.model.ExprContext;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.model.Nodes;
import com.backport.transpiler.rewrite.VisitResult;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Replaces keyword-only parameters with explicit lookups on the catch-all
 * keyword mapping.
 *
 * <pre>
 * def f(*, x, y=2):          def f(**kwargs):
 *     ...               →        x = kwargs["x"]
 *                                y = kwargs.get("y", 2)
 *                                ...
 * </pre>
 *
 * Defaults must be literals: the lookup runs at call time while the original
 * default was evaluated once at definition time.
 */
public class InlineKwOnlyArgsFixer extends AbstractTransformerFixer {

    public static final String NAME = "inline_kw_only_args";

    static final String DEFAULT_KWARGS_NAME = "kwargs";

    private static final Set<NodeKind> LITERAL_KINDS =
            EnumSet.of(NodeKind.NUM, NodeKind.STR, NodeKind.BYTES, NodeKind.NAME_CONSTANT);

    public InlineKwOnlyArgsFixer() {
        super(NAME, ApplicabilityWindow.of("1.0", "3.5"));
    }

    @Override
    protected VisitResult visit(Node node) {
        if (node.is(NodeKind.FUNCTION_DEF)) {
            inlineKwOnlyArgs(node);
        }
        return genericVisit(node);
    }

    private void inlineKwOnlyArgs(Node function) {
        Node args = function.getNode("args");
        List<Node> kwOnlyArgs = args.getNodes("kwonlyargs");
        if (kwOnlyArgs.isEmpty()) {
            return;
        }
        List<Node> kwDefaults = args.getNodes("kwDefaults");

        Node kwarg = args.getNode("kwarg");
        String kwName;
        if (kwarg != null) {
            kwName = kwarg.getString("arg");
        } else {
            kwName = DEFAULT_KWARGS_NAME;
            args.set("kwarg", Nodes.arg(kwName));
        }

        List<Node> lookups = new ArrayList<>(kwOnlyArgs.size());
        for (int i = 0; i < kwOnlyArgs.size(); i++) {
            String argName = kwOnlyArgs.get(i).getString("arg");
            Node defaultValue = i < kwDefaults.size() ? kwDefaults.get(i) : null;
            lookups.add(lookup(function, kwName, argName, defaultValue));
        }
        function.getNodes("body").addAll(0, lookups);

        args.set("kwonlyargs", List.of());
        args.set("kwDefaults", List.of());
    }

    private Node lookup(Node function, String kwName, String argName, Node defaultValue) {
        if (defaultValue == null) {
            return Nodes.assign(argName, Nodes.subscript(Nodes.name(kwName), Nodes.str(argName), ExprContext.LOAD));
        }
        if (!LITERAL_KINDS.contains(defaultValue.getKind())) {
            throw new StructuralAssumptionException("Keyword-only argument '" + argName + "' of function '"
                    + function.getString("name") + "' must have a literal default, found "
                    + defaultValue.getKind().getDisplayName());
        }
        return Nodes.assign(argName, Nodes.methodCall(kwName, "get", Nodes.str(argName), defaultValue));
    }
}
