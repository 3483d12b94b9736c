package com.backport.transpiler.model;

import lombok.Value;

/**
 * Schema entry for one named field of a {@link NodeKind}.
 */
@Value
public class FieldSpec {

    String name;
    FieldShape shape;
    NodeCategory category;
    boolean optional;

    public static FieldSpec node(String name) {
        return new FieldSpec(name, FieldShape.NODE, NodeCategory.EXPRESSION, false);
    }

    public static FieldSpec optionalNode(String name) {
        return new FieldSpec(name, FieldShape.NODE, NodeCategory.EXPRESSION, true);
    }

    public static FieldSpec support(String name) {
        return new FieldSpec(name, FieldShape.NODE, NodeCategory.SUPPORT, false);
    }

    public static FieldSpec optionalSupport(String name) {
        return new FieldSpec(name, FieldShape.NODE, NodeCategory.SUPPORT, true);
    }

    public static FieldSpec nodes(String name) {
        return new FieldSpec(name, FieldShape.NODE_LIST, NodeCategory.EXPRESSION, false);
    }

    /**
     * Expression list whose entries may be null (dict keys of {@code **} entries,
     * missing keyword-only defaults).
     */
    public static FieldSpec nullableNodes(String name) {
        return new FieldSpec(name, FieldShape.NODE_LIST, NodeCategory.EXPRESSION, true);
    }

    public static FieldSpec supportNodes(String name) {
        return new FieldSpec(name, FieldShape.NODE_LIST, NodeCategory.SUPPORT, false);
    }

    public static FieldSpec statements(String name) {
        return new FieldSpec(name, FieldShape.STATEMENT_LIST, NodeCategory.STATEMENT, false);
    }

    public static FieldSpec value(String name) {
        return new FieldSpec(name, FieldShape.VALUE, null, true);
    }

    public boolean isStatementList() {
        return shape == FieldShape.STATEMENT_LIST;
    }

    public boolean isList() {
        return shape == FieldShape.NODE_LIST || shape == FieldShape.STATEMENT_LIST;
    }

    public boolean holdsNodes() {
        return shape != FieldShape.VALUE;
    }
}
