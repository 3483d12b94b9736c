package com.backport.transpiler.model;

import static com.backport.transpiler.model.FieldSpec.node;
import static com.backport.transpiler.model.FieldSpec.nodes;
import static com.backport.transpiler.model.FieldSpec.nullableNodes;
import static com.backport.transpiler.model.FieldSpec.optionalNode;
import static com.backport.transpiler.model.FieldSpec.optionalSupport;
import static com.backport.transpiler.model.FieldSpec.statements;
import static com.backport.transpiler.model.FieldSpec.support;
import static com.backport.transpiler.model.FieldSpec.supportNodes;
import static com.backport.transpiler.model.FieldSpec.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of syntax node kinds with the field schema of each kind.
 * Field declaration order is document order and drives {@code TreeWalker}.
 */
public enum NodeKind {

    MODULE(NodeCategory.MODULE, statements("body")),

    // Statements
    FUNCTION_DEF(NodeCategory.STATEMENT, value("name"), support("args"), statements("body"),
            nodes("decoratorList"), optionalNode("returns")),
    CLASS_DEF(NodeCategory.STATEMENT, value("name"), nodes("bases"), supportNodes("keywords"),
            statements("body"), nodes("decoratorList")),
    RETURN(NodeCategory.STATEMENT, optionalNode("value")),
    DELETE(NodeCategory.STATEMENT, nodes("targets")),
    ASSIGN(NodeCategory.STATEMENT, nodes("targets"), node("value")),
    ANN_ASSIGN(NodeCategory.STATEMENT, node("target"), node("annotation"), optionalNode("value"), value("simple")),
    FOR(NodeCategory.STATEMENT, node("target"), node("iter"), statements("body"), statements("orelse")),
    WHILE(NodeCategory.STATEMENT, node("test"), statements("body"), statements("orelse")),
    IF(NodeCategory.STATEMENT, node("test"), statements("body"), statements("orelse")),
    RAISE(NodeCategory.STATEMENT, optionalNode("exc"), optionalNode("cause")),
    TRY(NodeCategory.STATEMENT, statements("body"), supportNodes("handlers"), statements("orelse"),
            statements("finalbody")),
    IMPORT(NodeCategory.STATEMENT, supportNodes("names")),
    IMPORT_FROM(NodeCategory.STATEMENT, value("module"), supportNodes("names"), value("level")),
    EXPR(NodeCategory.STATEMENT, node("value")),
    PASS(NodeCategory.STATEMENT),
    BREAK(NodeCategory.STATEMENT),
    CONTINUE(NodeCategory.STATEMENT),

    // Expressions
    BIN_OP(NodeCategory.EXPRESSION, node("left"), value("op"), node("right")),
    LAMBDA(NodeCategory.EXPRESSION, support("args"), node("body")),
    DICT(NodeCategory.EXPRESSION, nullableNodes("keys"), nodes("values")),
    SET(NodeCategory.EXPRESSION, nodes("elts")),
    CALL(NodeCategory.EXPRESSION, node("func"), nodes("args"), supportNodes("keywords")),
    NUM(NodeCategory.EXPRESSION, value("n")),
    STR(NodeCategory.EXPRESSION, value("s")),
    BYTES(NodeCategory.EXPRESSION, value("s")),
    JOINED_STR(NodeCategory.EXPRESSION, nodes("values")),
    FORMATTED_VALUE(NodeCategory.EXPRESSION, node("value"), value("conversion"), optionalNode("formatSpec")),
    NAME_CONSTANT(NodeCategory.EXPRESSION, value("value")),
    ATTRIBUTE(NodeCategory.EXPRESSION, node("value"), value("attr"), value("ctx")),
    SUBSCRIPT(NodeCategory.EXPRESSION, node("value"), support("slice"), value("ctx")),
    STARRED(NodeCategory.EXPRESSION, node("value"), value("ctx")),
    NAME(NodeCategory.EXPRESSION, value("id"), value("ctx")),
    LIST(NodeCategory.EXPRESSION, nodes("elts"), value("ctx")),
    TUPLE(NodeCategory.EXPRESSION, nodes("elts"), value("ctx")),

    // Support nodes
    ARGUMENTS(NodeCategory.SUPPORT, supportNodes("args"), optionalSupport("vararg"), supportNodes("kwonlyargs"),
            nullableNodes("kwDefaults"), optionalSupport("kwarg"), nodes("defaults")),
    ARG(NodeCategory.SUPPORT, value("arg"), optionalNode("annotation")),
    KEYWORD(NodeCategory.SUPPORT, value("arg"), node("value")),
    ALIAS(NodeCategory.SUPPORT, value("name"), value("asname")),
    EXCEPT_HANDLER(NodeCategory.SUPPORT, optionalNode("type"), value("name"), statements("body")),
    INDEX(NodeCategory.SUPPORT, node("value"));

    private final NodeCategory category;
    private final Map<String, FieldSpec> fields;

    NodeKind(NodeCategory category, FieldSpec... fields) {
        this.category = category;
        Map<String, FieldSpec> byName = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            byName.put(field.getName(), field);
        }
        this.fields = Collections.unmodifiableMap(byName);
    }

    public NodeCategory getCategory() {
        return category;
    }

    /**
     * Fields in declaration (document) order.
     */
    public List<FieldSpec> getFields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldSpec> findField(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public boolean isStatement() {
        return category == NodeCategory.STATEMENT;
    }

    public boolean isExpression() {
        return category == NodeCategory.EXPRESSION;
    }

    /**
     * True if any field of this kind holds a statement block.
     */
    public boolean hasStatementLists() {
        return fields.values().stream().anyMatch(FieldSpec::isStatementList);
    }

    /**
     * Python-style display name, e.g. {@code FunctionDef} for {@link #FUNCTION_DEF}.
     */
    public String getDisplayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
