package com.backport.transpiler.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factory methods for building trees in code. Fixers use these to
 * synthesize replacement nodes; tests use them in place of a parser.
 */
public final class Nodes {

    private Nodes() {
    }

    // ---- Module & statements ----

    public static Node module(Node... body) {
        return Node.of(NodeKind.MODULE).with("body", Arrays.asList(body));
    }

    public static Node functionDef(String name, Node args, List<Node> body) {
        return Node.of(NodeKind.FUNCTION_DEF)
                .with("name", name)
                .with("args", args)
                .with("body", body);
    }

    public static Node functionDef(String name, Node args, Node... body) {
        return functionDef(name, args, Arrays.asList(body));
    }

    public static Node classDef(String name, List<Node> bases, Node... body) {
        return Node.of(NodeKind.CLASS_DEF)
                .with("name", name)
                .with("bases", bases)
                .with("body", Arrays.asList(body));
    }

    public static Node returnStmt(Node value) {
        return Node.of(NodeKind.RETURN).with("value", value);
    }

    public static Node delete(String... names) {
        List<Node> targets = new ArrayList<>();
        for (String name : names) {
            targets.add(name(name, ExprContext.DEL));
        }
        return Node.of(NodeKind.DELETE).with("targets", targets);
    }

    public static Node assign(Node target, Node value) {
        return Node.of(NodeKind.ASSIGN)
                .with("targets", List.of(target))
                .with("value", value);
    }

    public static Node assign(String target, Node value) {
        return assign(name(target, ExprContext.STORE), value);
    }

    public static Node annAssign(Node target, Node annotation, Node value) {
        return Node.of(NodeKind.ANN_ASSIGN)
                .with("target", target)
                .with("annotation", annotation)
                .with("value", value)
                .with("simple", Boolean.TRUE);
    }

    public static Node forStmt(Node target, Node iter, Node... body) {
        return Node.of(NodeKind.FOR)
                .with("target", target)
                .with("iter", iter)
                .with("body", Arrays.asList(body));
    }

    public static Node whileStmt(Node test, Node... body) {
        return Node.of(NodeKind.WHILE)
                .with("test", test)
                .with("body", Arrays.asList(body));
    }

    public static Node ifStmt(Node test, List<Node> body, List<Node> orelse) {
        return Node.of(NodeKind.IF)
                .with("test", test)
                .with("body", body)
                .with("orelse", orelse);
    }

    public static Node tryStmt(List<Node> body, List<Node> handlers, List<Node> finalbody) {
        return Node.of(NodeKind.TRY)
                .with("body", body)
                .with("handlers", handlers)
                .with("finalbody", finalbody);
    }

    public static Node exceptHandler(Node type, String name, Node... body) {
        return Node.of(NodeKind.EXCEPT_HANDLER)
                .with("type", type)
                .with("name", name)
                .with("body", Arrays.asList(body));
    }

    public static Node importStmt(String module) {
        return Node.of(NodeKind.IMPORT).with("names", List.of(alias(module)));
    }

    public static Node importFrom(String module, String... members) {
        List<Node> names = new ArrayList<>();
        for (String member : members) {
            names.add(alias(member));
        }
        return Node.of(NodeKind.IMPORT_FROM)
                .with("module", module)
                .with("names", names)
                .with("level", 0);
    }

    public static Node alias(String name) {
        return Node.of(NodeKind.ALIAS).with("name", name);
    }

    public static Node expr(Node value) {
        return Node.of(NodeKind.EXPR).with("value", value);
    }

    public static Node pass() {
        return Node.of(NodeKind.PASS);
    }

    // ---- Expressions ----

    public static Node name(String id) {
        return name(id, ExprContext.LOAD);
    }

    public static Node name(String id, ExprContext ctx) {
        return Node.of(NodeKind.NAME).with("id", id).with("ctx", ctx);
    }

    public static Node attribute(Node value, String attr) {
        return Node.of(NodeKind.ATTRIBUTE)
                .with("value", value)
                .with("attr", attr)
                .with("ctx", ExprContext.LOAD);
    }

    public static Node subscript(Node value, Node index, ExprContext ctx) {
        return Node.of(NodeKind.SUBSCRIPT)
                .with("value", value)
                .with("slice", Node.of(NodeKind.INDEX).with("value", index))
                .with("ctx", ctx);
    }

    public static Node call(Node func, List<Node> args, List<Node> keywords) {
        return Node.of(NodeKind.CALL)
                .with("func", func)
                .with("args", args)
                .with("keywords", keywords);
    }

    public static Node call(Node func, Node... args) {
        return call(func, Arrays.asList(args), List.of());
    }

    /**
     * {@code target.method(args...)}
     */
    public static Node methodCall(String target, String method, Node... args) {
        return call(attribute(name(target), method), args);
    }

    public static Node keyword(String arg, Node value) {
        return Node.of(NodeKind.KEYWORD).with("arg", arg).with("value", value);
    }

    /**
     * {@code **value} in a call.
     */
    public static Node doubleStarred(Node value) {
        return keyword(null, value);
    }

    public static Node starred(Node value) {
        return Node.of(NodeKind.STARRED).with("value", value).with("ctx", ExprContext.LOAD);
    }

    public static Node list(Node... elts) {
        return Node.of(NodeKind.LIST).with("elts", Arrays.asList(elts)).with("ctx", ExprContext.LOAD);
    }

    public static Node tuple(Node... elts) {
        return Node.of(NodeKind.TUPLE).with("elts", Arrays.asList(elts)).with("ctx", ExprContext.LOAD);
    }

    public static Node set(Node... elts) {
        return Node.of(NodeKind.SET).with("elts", Arrays.asList(elts));
    }

    /**
     * Dict literal; a null key marks a {@code **value} entry.
     */
    public static Node dict(List<Node> keys, List<Node> values) {
        return Node.of(NodeKind.DICT).with("keys", keys).with("values", values);
    }

    public static Node num(Number n) {
        return Node.of(NodeKind.NUM).with("n", n);
    }

    public static Node str(String s) {
        return Node.of(NodeKind.STR).with("s", s);
    }

    public static Node constant(Boolean value) {
        return Node.of(NodeKind.NAME_CONSTANT).with("value", value);
    }

    public static Node none() {
        return constant(null);
    }

    public static Node binOp(Node left, String op, Node right) {
        return Node.of(NodeKind.BIN_OP).with("left", left).with("op", op).with("right", right);
    }

    public static Node lambda(Node args, Node body) {
        return Node.of(NodeKind.LAMBDA).with("args", args).with("body", body);
    }

    public static Node joinedStr(Node... values) {
        return Node.of(NodeKind.JOINED_STR).with("values", Arrays.asList(values));
    }

    public static Node formattedValue(Node value, int conversion, Node formatSpec) {
        return Node.of(NodeKind.FORMATTED_VALUE)
                .with("value", value)
                .with("conversion", conversion)
                .with("formatSpec", formatSpec);
    }

    // ---- Parameters ----

    public static Node arguments(String... names) {
        List<Node> args = new ArrayList<>();
        for (String name : names) {
            args.add(arg(name));
        }
        return Node.of(NodeKind.ARGUMENTS).with("args", args);
    }

    public static Node arg(String name) {
        return Node.of(NodeKind.ARG).with("arg", name);
    }

    public static Node arg(String name, Node annotation) {
        return arg(name).with("annotation", annotation);
    }
}
