package com.backport.transpiler.rewrite;

import java.util.List;

import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.model.FieldSpec;
import com.backport.transpiler.model.Node;

import lombok.experimental.UtilityClass;

/**
 * Checks every node reachable from a root against its kind's schema.
 * Field setters already reject bad values; this catches what was added
 * through the live list views and required fields that were never set.
 */
@UtilityClass
public class TreeValidator {

    public static void validate(Node root) {
        validate(root, root.getKind().getDisplayName());
    }

    private static void validate(Node node, String path) {
        for (FieldSpec spec : node.getKind().getFields()) {
            String fieldPath = path + "." + spec.getName();
            switch (spec.getShape()) {
                case NODE -> {
                    Node child = node.getNode(spec.getName());
                    if (child == null) {
                        if (!spec.isOptional()) {
                            throw new StructuralAssumptionException("Missing required field " + fieldPath);
                        }
                    } else {
                        checkCategory(spec, child, fieldPath);
                        validate(child, fieldPath);
                    }
                }
                case NODE_LIST, STATEMENT_LIST -> {
                    List<Node> children = node.getNodes(spec.getName());
                    for (int i = 0; i < children.size(); i++) {
                        Node child = children.get(i);
                        String elementPath = fieldPath + "[" + i + "]";
                        if (child == null) {
                            if (!spec.isOptional()) {
                                throw new StructuralAssumptionException("Empty entry at " + elementPath);
                            }
                            continue;
                        }
                        checkCategory(spec, child, elementPath);
                        validate(child, elementPath);
                    }
                }
                case VALUE -> {
                    // primitives carry no schema
                }
            }
        }
    }

    private static void checkCategory(FieldSpec spec, Node child, String path) {
        if (child.getKind().getCategory() != spec.getCategory()) {
            throw new StructuralAssumptionException(path + " expects " + spec.getCategory()
                    + " but holds " + child.getKind().getDisplayName());
        }
    }
}
