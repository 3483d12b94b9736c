package com.backport.transpiler.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import com.backport.transpiler.exception.StructuralAssumptionException;

/**
 * A syntax tree node: a {@link NodeKind} plus the values of the fields its
 * schema declares.
 *
 * <p>List fields are always non-null, mutable and owned by this node. Setting
 * a field checks the value against the schema, so a node never holds a child
 * of the wrong category. A child is owned by exactly one parent; fixers
 * replace children outright rather than sharing them between parents.
 */
public final class Node {

    private final NodeKind kind;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private Node(NodeKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
        for (FieldSpec spec : kind.getFields()) {
            fields.put(spec.getName(), spec.isList() ? new ArrayList<Node>() : null);
        }
    }

    public static Node of(NodeKind kind) {
        return new Node(kind);
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean is(NodeKind candidate) {
        return kind == candidate;
    }

    /**
     * Sets a field and returns this node, for builder-style construction.
     */
    public Node with(String field, Object value) {
        set(field, value);
        return this;
    }

    public void set(String field, Object value) {
        FieldSpec spec = spec(field);
        switch (spec.getShape()) {
            case NODE -> fields.put(field, checkChild(spec, value));
            case NODE_LIST, STATEMENT_LIST -> fields.put(field, checkList(spec, value));
            case VALUE -> fields.put(field, checkValue(spec, value));
        }
    }

    public Object get(String field) {
        spec(field);
        return fields.get(field);
    }

    public Node getNode(String field) {
        FieldSpec spec = spec(field);
        if (spec.getShape() != FieldShape.NODE) {
            throw new StructuralAssumptionException(describe(spec) + " is not a single-node field");
        }
        return (Node) fields.get(field);
    }

    /**
     * Live, mutable view of a list field.
     */
    @SuppressWarnings("unchecked")
    public List<Node> getNodes(String field) {
        FieldSpec spec = spec(field);
        if (!spec.isList()) {
            throw new StructuralAssumptionException(describe(spec) + " is not a list field");
        }
        return (List<Node>) fields.get(field);
    }

    public String getString(String field) {
        Object value = get(field);
        if (value != null && !(value instanceof String)) {
            throw new StructuralAssumptionException(kind.getDisplayName() + "." + field + " is not a string: " + value);
        }
        return (String) value;
    }

    public ExprContext getContext() {
        Object value = get("ctx");
        return value instanceof ExprContext ctx ? ctx : null;
    }

    public boolean hasField(String field) {
        return kind.hasField(field);
    }

    /**
     * Structural copy; the result shares no nodes or lists with this node.
     */
    public Node deepCopy() {
        Node copy = new Node(kind);
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Node child) {
                copy.fields.put(entry.getKey(), child.deepCopy());
            } else if (value instanceof List<?> list) {
                List<Node> copied = new ArrayList<>(list.size());
                for (Object element : list) {
                    copied.add(element == null ? null : ((Node) element).deepCopy());
                }
                copy.fields.put(entry.getKey(), copied);
            } else {
                copy.fields.put(entry.getKey(), value);
            }
        }
        return copy;
    }

    private FieldSpec spec(String field) {
        return kind.findField(field).orElseThrow(() -> new StructuralAssumptionException(
                kind.getDisplayName() + " has no field '" + field + "'"));
    }

    private Node checkChild(FieldSpec spec, Object value) {
        if (value == null) {
            if (!spec.isOptional()) {
                throw new StructuralAssumptionException(describe(spec) + " is required");
            }
            return null;
        }
        if (!(value instanceof Node child)) {
            throw new StructuralAssumptionException(describe(spec) + " expects a node, got " + value);
        }
        checkCategory(spec, child);
        return child;
    }

    private List<Node> checkList(FieldSpec spec, Object value) {
        if (!(value instanceof Collection<?> collection)) {
            throw new StructuralAssumptionException(describe(spec) + " expects a list, got " + value);
        }
        List<Node> result = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (element == null) {
                if (!spec.isOptional()) {
                    throw new StructuralAssumptionException(describe(spec) + " does not allow empty entries");
                }
                result.add(null);
                continue;
            }
            if (!(element instanceof Node child)) {
                throw new StructuralAssumptionException(describe(spec) + " expects nodes, got " + element);
            }
            checkCategory(spec, child);
            result.add(child);
        }
        return result;
    }

    private Object checkValue(FieldSpec spec, Object value) {
        if (value instanceof Node || value instanceof Collection) {
            throw new StructuralAssumptionException(describe(spec) + " expects a primitive value, got " + value);
        }
        return value;
    }

    private void checkCategory(FieldSpec spec, Node child) {
        if (child.kind.getCategory() != spec.getCategory()) {
            throw new StructuralAssumptionException(describe(spec) + " expects " + spec.getCategory()
                    + " but got " + child.kind.getDisplayName());
        }
    }

    private String describe(FieldSpec spec) {
        return kind.getDisplayName() + "." + spec.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node other)) {
            return false;
        }
        return kind == other.kind && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, fields);
    }

    /**
     * Dump in the style {@code Call(func=Name(id='f', ctx=LOAD), args=[], keywords=[])}.
     */
    @Override
    public String toString() {
        return fields.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + dump(entry.getValue()))
                .collect(Collectors.joining(", ", kind.getDisplayName() + "(", ")"));
    }

    private static String dump(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(Node::dump).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof String s) {
            return "'" + s + "'";
        }
        return String.valueOf(value);
    }
}
