package com.backport.transpiler.fixer.unpacking;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.exception.ExpansionOverflowException;
import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.fixer.AbstractFixer;
import com.backport.transpiler.model.ExprContext;
import com.backport.transpiler.model.FieldSpec;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.model.Nodes;
import com.backport.transpiler.rewrite.FieldOrder;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Removes generalized unpacking: more than one {@code *} / {@code **} in a call,
 * or anything following a {@code *} / {@code **}, in calls and in list, tuple,
 * set and dict displays.
 *
 * <pre>
 * f(*a, 1, *b)          upg_args_0 = []
 *                       upg_args_0.extend(a)
 *                 →     upg_args_0.append(1)
 *                       upg_args_0.extend(b)
 *                       f(*upg_args_0)
 *                       del upg_args_0
 * </pre>
 *
 * Keyword unpacking is handled the same way with a dict temporary,
 * {@code upg_kwargs_N[key] = value} and {@code upg_kwargs_N.update(mapping)}.
 *
 * <p>Each block is rewritten until its length stops changing, because hoisted
 * statements may carry nested unpacking that needs another pass. Expressions
 * inside a lambda body are hoisted into a named function that replaces the lambda.
 *
 * <p>The temporary counter belongs to this instance, so an instance must only
 * process one source unit.
 */
public class UnpackingGeneralizationsFixer extends AbstractFixer {

    private static final Logger log = LoggerFactory.getLogger(UnpackingGeneralizationsFixer.class);

    public static final String NAME = "unpacking_generalizations";

    /**
     * A block may grow to this many times its initial length before expansion is aborted.
     */
    static final int MAX_GROWTH_FACTOR = 100;

    static final String ARGS_PREFIX = "upg_args_";
    static final String KWARGS_PREFIX = "upg_kwargs_";
    static final String LAMBDA_PREFIX = "upg_lambda_";

    private static final Set<NodeKind> ARG_UNPACK_KINDS =
            EnumSet.of(NodeKind.CALL, NodeKind.LIST, NodeKind.TUPLE, NodeKind.SET);
    private static final Set<NodeKind> KWARG_UNPACK_KINDS = EnumSet.of(NodeKind.CALL, NodeKind.DICT);

    private int tmpVarIndex = 0;

    public UnpackingGeneralizationsFixer() {
        super(NAME, ApplicabilityWindow.of("2.0", "3.4"));
    }

    @Override
    public Node apply(BuildConfig config, Node module) {
        applyBodyUpdates(module.getNodes("body"));
        log.debug("Unpacking expansion used {} temporaries", tmpVarIndex);
        return module;
    }

    // ---- Detection ----

    boolean hasArgsUnpacking(Node node) {
        List<Node> elts = switch (node.getKind()) {
            case CALL -> node.getNodes("args");
            case LIST, TUPLE, SET -> node.getNodes("elts");
            default -> throw new StructuralAssumptionException("Unexpected node for argument unpacking: "
                    + node.getKind().getDisplayName());
        };
        boolean afterStarred = false;
        for (Node elt : elts) {
            // anything after * needs the rewrite
            if (afterStarred) {
                return true;
            }
            afterStarred = elt.is(NodeKind.STARRED);
        }
        return false;
    }

    boolean hasKwargsUnpacking(Node node) {
        boolean afterDoubleStarred = false;
        switch (node.getKind()) {
            case CALL -> {
                for (Node keyword : node.getNodes("keywords")) {
                    if (afterDoubleStarred) {
                        return true;
                    }
                    afterDoubleStarred = keyword.getString("arg") == null;
                }
            }
            case DICT -> {
                for (Node key : node.getNodes("keys")) {
                    if (afterDoubleStarred) {
                        return true;
                    }
                    afterDoubleStarred = key == null;
                }
            }
            default -> throw new StructuralAssumptionException("Unexpected node for keyword unpacking: "
                    + node.getKind().getDisplayName());
        }
        return false;
    }

    // ---- Expansion of a single call or display ----

    private ExpansionUpdate expandArgsUnpacking(Node node) {
        String tmpName = ARGS_PREFIX + nextTmpIndex();
        List<Node> prefix = new ArrayList<>();
        prefix.add(Nodes.assign(tmpName, Nodes.list()));

        Node func;
        List<Node> keywords;
        List<Node> elts;
        if (node.is(NodeKind.CALL)) {
            func = node.getNode("func");
            keywords = node.getNodes("keywords");
            elts = node.getNodes("args");
        } else {
            func = Nodes.name(node.getKind().name().toLowerCase(Locale.ROOT));
            keywords = List.of();
            elts = node.getNodes("elts");
        }

        for (Node elt : elts) {
            if (elt.is(NodeKind.STARRED)) {
                prefix.add(Nodes.expr(Nodes.methodCall(tmpName, "extend", elt.getNode("value"))));
            } else {
                prefix.add(Nodes.expr(Nodes.methodCall(tmpName, "append", elt)));
            }
        }

        Node replacement = Nodes.call(func, List.of(Nodes.starred(Nodes.name(tmpName))), keywords);
        return new ExpansionUpdate(prefix, replacement, List.of(Nodes.delete(tmpName)));
    }

    private ExpansionUpdate expandKwargsUnpacking(Node node) {
        String tmpName = KWARGS_PREFIX + nextTmpIndex();
        List<Node> prefix = new ArrayList<>();
        prefix.add(Nodes.assign(tmpName, Nodes.dict(List.of(), List.of())));

        Node func;
        List<Node> args;
        if (node.is(NodeKind.CALL)) {
            func = node.getNode("func");
            args = node.getNodes("args");
            for (Node keyword : node.getNodes("keywords")) {
                String arg = keyword.getString("arg");
                prefix.add(keywordEntry(tmpName, arg == null ? null : Nodes.str(arg), keyword.getNode("value")));
            }
        } else {
            func = Nodes.name("dict");
            args = List.of();
            List<Node> keys = node.getNodes("keys");
            List<Node> values = node.getNodes("values");
            for (int i = 0; i < keys.size(); i++) {
                Node key = keys.get(i);
                if (key != null && !key.is(NodeKind.STR)) {
                    throw new StructuralAssumptionException("Dict display with keyword unpacking must use string keys, got "
                            + key.getKind().getDisplayName());
                }
                prefix.add(keywordEntry(tmpName, key, values.get(i)));
            }
        }

        Node replacement = Nodes.call(func, args, List.of(Nodes.doubleStarred(Nodes.name(tmpName))));
        return new ExpansionUpdate(prefix, replacement, List.of(Nodes.delete(tmpName)));
    }

    /**
     * {@code tmp.update(value)} for a {@code **} entry, {@code tmp[key] = value} otherwise.
     */
    private static Node keywordEntry(String tmpName, Node key, Node value) {
        if (key == null) {
            return Nodes.expr(Nodes.methodCall(tmpName, "update", value));
        }
        return Nodes.assign(Nodes.subscript(Nodes.name(tmpName), key, ExprContext.STORE), value);
    }

    private int nextTmpIndex() {
        return tmpVarIndex++;
    }

    // ---- Recursive descent ----

    private Optional<ExpansionUpdate> makeValueUpdate(Node node) {
        List<Node> prefix = new ArrayList<>();
        List<Node> cleanup = new ArrayList<>();
        Node current = node;

        if (ARG_UNPACK_KINDS.contains(current.getKind()) && hasArgsUnpacking(current)) {
            ExpansionUpdate update = expandArgsUnpacking(current);
            prefix.addAll(update.getPrefix());
            cleanup.addAll(update.getCleanup());
            current = update.getReplacement();
        }
        if (KWARG_UNPACK_KINDS.contains(current.getKind()) && hasKwargsUnpacking(current)) {
            ExpansionUpdate update = expandKwargsUnpacking(current);
            prefix.addAll(update.getPrefix());
            cleanup.addAll(update.getCleanup());
            current = update.getReplacement();
        }

        if (prefix.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ExpansionUpdate(prefix, current, cleanup));
    }

    private Optional<ExpansionUpdate> makeSingleFieldUpdate(Node node) {
        if (node == null) {
            return Optional.empty();
        }
        if (ARG_UNPACK_KINDS.contains(node.getKind()) || KWARG_UNPACK_KINDS.contains(node.getKind())) {
            Optional<ExpansionUpdate> valueUpdate = makeValueUpdate(node);
            if (valueUpdate.isPresent()) {
                // nested unpacking inside the hoisted statements is handled by the next pass
                return valueUpdate;
            }
        }
        if (node.getKind().hasStatementLists()) {
            throw new StructuralAssumptionException("Unexpected statement block inside expression "
                    + node.getKind().getDisplayName());
        }

        List<Node> prefix = new ArrayList<>();
        List<Node> cleanup = new ArrayList<>();
        Node current = node;

        for (FieldSpec spec : FieldOrder.sorted(node)) {
            if (!spec.holdsNodes()) {
                continue;
            }
            if (node.is(NodeKind.LAMBDA) && "body".equals(spec.getName())) {
                Optional<ExpansionUpdate> bodyUpdate = makeSingleFieldUpdate(node.getNode("body"));
                if (bodyUpdate.isPresent()) {
                    if (!node.getNode("args").getNodes("kwonlyargs").isEmpty()) {
                        throw new StructuralAssumptionException(
                                "Cannot convert a lambda with keyword-only parameters into a function");
                    }
                    String functionName = LAMBDA_PREFIX + nextTmpIndex();
                    prefix.add(lambdaAsFunctionDef(functionName, node, bodyUpdate.get()));
                    cleanup.add(Nodes.delete(functionName));
                    current = Nodes.name(functionName);
                }
                continue;
            }
            makeFieldUpdate(node, spec).ifPresent(hoisted -> {
                prefix.addAll(hoisted.getPrefix());
                cleanup.addAll(hoisted.getCleanup());
            });
        }

        if (prefix.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ExpansionUpdate(prefix, current, cleanup));
    }

    /**
     * Statements hoisted out of a lambda body may reference the lambda's
     * parameters and must run on every call, so they become the body of a
     * named function. Temporaries go out of scope at the return, so the
     * body update's cleanup is dropped.
     */
    private static Node lambdaAsFunctionDef(String functionName, Node lambda, ExpansionUpdate bodyUpdate) {
        List<Node> body = new ArrayList<>(bodyUpdate.getPrefix());
        body.add(Nodes.returnStmt(bodyUpdate.getReplacement()));
        return Nodes.functionDef(functionName, lambda.getNode("args"), body);
    }

    private Optional<ListExpansionUpdate> makeListFieldUpdate(List<Node> nodes) {
        if (nodes.isEmpty()) {
            return Optional.empty();
        }
        List<Node> prefix = new ArrayList<>();
        List<Node> replacements = new ArrayList<>(nodes.size());
        List<Node> cleanup = new ArrayList<>();

        for (Node node : nodes) {
            Optional<ExpansionUpdate> update = makeSingleFieldUpdate(node);
            if (update.isEmpty()) {
                replacements.add(node);
                continue;
            }
            prefix.addAll(update.get().getPrefix());
            replacements.add(update.get().getReplacement());
            cleanup.addAll(update.get().getCleanup());
        }

        if (prefix.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ListExpansionUpdate(prefix, replacements, cleanup));
    }

    /**
     * Rewrites one expression field of {@code parent} in place and returns what
     * has to be hoisted around the enclosing statement.
     */
    private Optional<HoistedStatements> makeFieldUpdate(Node parent, FieldSpec spec) {
        String field = spec.getName();
        if (spec.isList()) {
            return makeListFieldUpdate(parent.getNodes(field)).map(update -> {
                parent.set(field, update.getReplacements());
                return new HoistedStatements(update.getPrefix(), update.getCleanup());
            });
        }
        return makeSingleFieldUpdate(parent.getNode(field)).map(update -> {
            parent.set(field, update.getReplacement());
            return new HoistedStatements(update.getPrefix(), update.getCleanup());
        });
    }

    /**
     * Rewrites the expression fields of a statement (or of a block-hosting
     * helper node such as an except handler) and recurses into its blocks.
     * Updates of all fields are combined so every hoisted statement lands
     * before the statement and every cleanup after it.
     */
    private Optional<HoistedStatements> makeStatementUpdate(Node statement) {
        List<Node> prefix = new ArrayList<>();
        List<Node> cleanup = new ArrayList<>();

        for (FieldSpec spec : FieldOrder.sorted(statement)) {
            if (!spec.holdsNodes()) {
                continue;
            }
            if (spec.isStatementList()) {
                applyBodyUpdates(statement.getNodes(spec.getName()));
                continue;
            }
            if (spec.isList() && hostsBlocks(statement.getNodes(spec.getName()))) {
                for (Node host : statement.getNodes(spec.getName())) {
                    makeStatementUpdate(host).ifPresent(hoisted -> {
                        prefix.addAll(hoisted.getPrefix());
                        cleanup.addAll(hoisted.getCleanup());
                    });
                }
                continue;
            }
            Optional<HoistedStatements> update = makeFieldUpdate(statement, spec);
            if (update.isEmpty()) {
                continue;
            }
            if (statement.is(NodeKind.WHILE) && "test".equals(spec.getName())) {
                throw new StructuralAssumptionException(
                        "Cannot hoist unpacking out of a while condition, it is evaluated on every iteration");
            }
            if (statement.is(NodeKind.EXCEPT_HANDLER) && "type".equals(spec.getName())) {
                throw new StructuralAssumptionException(
                        "Cannot hoist unpacking out of an except clause type, it is evaluated only after the try body raises");
            }
            prefix.addAll(update.get().getPrefix());
            cleanup.addAll(update.get().getCleanup());
        }

        if (prefix.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new HoistedStatements(prefix, cleanup));
    }

    private static boolean hostsBlocks(List<Node> nodes) {
        return nodes.stream().anyMatch(node -> node != null && node.getKind().hasStatementLists());
    }

    /**
     * Rewrites a block until its length no longer changes.
     */
    void applyBodyUpdates(List<Node> body) {
        int initialLength = body.size();
        int previousLength = -1;
        while (previousLength != body.size()) {
            if (body.size() > initialLength * MAX_GROWTH_FACTOR) {
                throw new ExpansionOverflowException(initialLength, body.size());
            }
            previousLength = body.size();

            int offset = 0;
            // the body is modified while iterating its snapshot
            List<Node> snapshot = new ArrayList<>(body);
            for (int i = 0; i < snapshot.size(); i++) {
                Node statement = snapshot.get(i);
                Optional<HoistedStatements> update = makeStatementUpdate(statement);
                if (update.isEmpty()) {
                    continue;
                }
                List<Node> prefix = update.get().getPrefix();
                int position = i + offset;
                body.addAll(position, prefix);
                offset += prefix.size();

                // no need to release temporaries right before leaving the block
                if (statement.is(NodeKind.RETURN)) {
                    continue;
                }
                List<Node> cleanup = update.get().getCleanup();
                body.addAll(position + prefix.size() + 1, cleanup);
                offset += cleanup.size();
            }
        }
    }
}
