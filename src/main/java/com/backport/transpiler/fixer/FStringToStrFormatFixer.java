package com.backport.transpiler.fixer;

import java.util.ArrayList;
import java.util.List;

import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.model.Nodes;
import com.backport.transpiler.rewrite.VisitResult;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Rewrites f-strings into {@code str.format} calls with positional indices.
 *
 * <pre>
 * f"{a!r:>{width}} items"   →   "{0!r:>{1}} items".format(a, width)
 * </pre>
 *
 * Substituted values are numbered in the order they appear, including the
 * ones nested inside format specs.
 */
public class FStringToStrFormatFixer extends AbstractTransformerFixer {

    public static final String NAME = "fstring_to_str_format";

    private static final int NO_CONVERSION = -1;

    public FStringToStrFormatFixer() {
        super(NAME, ApplicabilityWindow.of("2.6", "3.5"));
    }

    @Override
    protected VisitResult visit(Node node) {
        if (!node.is(NodeKind.JOINED_STR)) {
            return genericVisit(node);
        }
        List<Node> argNodes = new ArrayList<>();
        String template = joinedStrTemplate(node, argNodes);
        Node call = Nodes.call(Nodes.attribute(Nodes.str(template), "format"), argNodes, List.of());
        // substituted values may contain f-strings themselves
        return genericVisit(call);
    }

    private String joinedStrTemplate(Node joinedStr, List<Node> argNodes) {
        StringBuilder template = new StringBuilder();
        for (Node part : joinedStr.getNodes("values")) {
            switch (part.getKind()) {
                case STR -> template.append(escapeBraces(part.getString("s")));
                case FORMATTED_VALUE -> template.append(formattedValueField(part, argNodes));
                default -> throw new StructuralAssumptionException("Unexpected f-string part "
                        + part.getKind().getDisplayName());
            }
        }
        return template.toString();
    }

    private String formattedValueField(Node formattedValue, List<Node> argNodes) {
        int argIndex = argNodes.size();
        argNodes.add(formattedValue.getNode("value"));

        StringBuilder field = new StringBuilder("{").append(argIndex);
        field.append(conversionSuffix(formattedValue.get("conversion")));

        Node formatSpec = formattedValue.getNode("formatSpec");
        if (formatSpec != null) {
            if (!formatSpec.is(NodeKind.JOINED_STR)) {
                throw new StructuralAssumptionException("Unexpected format spec "
                        + formatSpec.getKind().getDisplayName());
            }
            field.append(':').append(joinedStrTemplate(formatSpec, argNodes));
        }
        return field.append('}').toString();
    }

    private static String conversionSuffix(Object conversion) {
        int code = conversion instanceof Number number ? number.intValue() : NO_CONVERSION;
        return switch (code) {
            case NO_CONVERSION -> "";
            case 's' -> "!s";
            case 'r' -> "!r";
            case 'a' -> "!a";
            default -> throw new StructuralAssumptionException("Unknown f-string conversion " + code);
        };
    }

    private static String escapeBraces(String literal) {
        return literal.replace("{", "{{").replace("}", "}}");
    }
}
