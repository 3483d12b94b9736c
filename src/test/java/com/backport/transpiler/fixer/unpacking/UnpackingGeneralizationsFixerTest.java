package com.backport.transpiler.fixer.unpacking;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Test;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.exception.ExpansionOverflowException;
import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.model.ExprContext;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.rewrite.TreeValidator;
import com.backport.transpiler.rewrite.TreeWalker;
import com.backport.transpiler.support.SourceRenderer;

import static com.backport.transpiler.model.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for UnpackingGeneralizationsFixer.
 */
class UnpackingGeneralizationsFixerTest {

    private final BuildConfig config = BuildConfig.forTarget("2.7");

    private String fix(Node module) {
        Node result = new UnpackingGeneralizationsFixer().apply(config, module);
        TreeValidator.validate(result);
        return SourceRenderer.render(result);
    }

    @Test
    void testPositionalUnpackingInCall() {
        Node module = module(expr(call(name("f"), starred(name("a")), num(1), starred(name("b")))));

        assertThat(fix(module)).isEqualTo("""
                upg_args_0 = []
                upg_args_0.extend(a)
                upg_args_0.append(1)
                upg_args_0.extend(b)
                f(*upg_args_0)
                del upg_args_0""");
    }

    @Test
    void testListDisplay() {
        Node module = module(assign("result", list(num(1), starred(name("xs")), starred(name("ys")))));

        assertThat(fix(module)).isEqualTo("""
                upg_args_0 = []
                upg_args_0.append(1)
                upg_args_0.extend(xs)
                upg_args_0.extend(ys)
                result = list(*upg_args_0)
                del upg_args_0""");
    }

    @Test
    void testListDisplayUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Node module = module(assign("r", list(num(1), starred(name("xs")), starred(name("ys")))));

            assertThat(fix(module)).contains("r = list(*upg_args_0)");
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void testTupleAndSetDisplays() {
        Node module = module(
                assign("t", tuple(starred(name("a")), name("b"))),
                assign("s", set(starred(name("a")), starred(name("b")))));

        assertThat(fix(module)).isEqualTo("""
                upg_args_0 = []
                upg_args_0.extend(a)
                upg_args_0.append(b)
                t = tuple(*upg_args_0)
                del upg_args_0
                upg_args_1 = []
                upg_args_1.extend(a)
                upg_args_1.extend(b)
                s = set(*upg_args_1)
                del upg_args_1""");
    }

    @Test
    void testKeywordUnpackingInCall() {
        Node module = module(expr(call(name("f"), List.of(name("x")),
                List.of(doubleStarred(name("a")), keyword("b", num(1))))));

        assertThat(fix(module)).isEqualTo("""
                upg_kwargs_0 = {}
                upg_kwargs_0.update(a)
                upg_kwargs_0["b"] = 1
                f(x, **upg_kwargs_0)
                del upg_kwargs_0""");
    }

    @Test
    void testPositionalAndKeywordUnpackingInOneCall() {
        Node module = module(expr(call(name("f"),
                List.of(starred(name("a")), starred(name("b"))),
                List.of(doubleStarred(name("c")), doubleStarred(name("d"))))));

        assertThat(fix(module)).isEqualTo("""
                upg_args_0 = []
                upg_args_0.extend(a)
                upg_args_0.extend(b)
                upg_kwargs_1 = {}
                upg_kwargs_1.update(c)
                upg_kwargs_1.update(d)
                f(*upg_args_0, **upg_kwargs_1)
                del upg_args_0
                del upg_kwargs_1""");
    }

    @Test
    void testDictDisplay() {
        Node module = module(assign("d", dict(Arrays.asList(null, str("k")), List.of(name("a"), num(1)))));

        assertThat(fix(module)).isEqualTo("""
                upg_kwargs_0 = {}
                upg_kwargs_0.update(a)
                upg_kwargs_0["k"] = 1
                d = dict(**upg_kwargs_0)
                del upg_kwargs_0""");
    }

    @Test
    void testDictDisplayWithNonStringKeyRejected() {
        Node module = module(assign("d", dict(Arrays.asList(null, num(1)), List.of(name("a"), num(2)))));

        assertThatThrownBy(() -> fix(module))
                .isInstanceOf(StructuralAssumptionException.class)
                .hasMessageContaining("string keys");
    }

    @Test
    void testSingleTrailingSpreadUntouched() {
        Node module = module(
                expr(call(name("f"), name("a"), starred(name("b")))),
                expr(call(name("g"), starred(name("a")))),
                expr(call(name("h"), List.of(), List.of(keyword("k", num(1)), doubleStarred(name("m"))))),
                assign("d", dict(Arrays.asList(str("a"), null), List.of(num(1), name("m")))));
        Node before = module.deepCopy();

        fix(module);

        assertThat(module).isEqualTo(before);
    }

    @Test
    void testNoCleanupBeforeReturn() {
        Node module = module(functionDef("f", arguments(),
                returnStmt(call(name("g"), starred(name("a")), starred(name("b"))))));

        assertThat(fix(module)).isEqualTo("""
                def f():
                    upg_args_0 = []
                    upg_args_0.extend(a)
                    upg_args_0.extend(b)
                    return g(*upg_args_0)""");
    }

    @Test
    void testNestedUnpackingPreservesEvaluationOrder() {
        Node inner = call(name("g"), starred(name("b")), starred(name("c")));
        Node module = module(expr(call(name("f"), starred(name("a")), starred(inner))));

        assertThat(fix(module)).isEqualTo("""
                upg_args_0 = []
                upg_args_0.extend(a)
                upg_args_1 = []
                upg_args_1.extend(b)
                upg_args_1.extend(c)
                upg_args_0.extend(g(*upg_args_1))
                del upg_args_1
                f(*upg_args_0)
                del upg_args_0""");
    }

    @Test
    void testConsecutiveStatements() {
        Node module = module(
                expr(call(name("f"), starred(name("a")), starred(name("b")))),
                expr(call(name("g"), starred(name("c")), starred(name("d")))));

        assertThat(fix(module)).isEqualTo("""
                upg_args_0 = []
                upg_args_0.extend(a)
                upg_args_0.extend(b)
                f(*upg_args_0)
                del upg_args_0
                upg_args_1 = []
                upg_args_1.extend(c)
                upg_args_1.extend(d)
                g(*upg_args_1)
                del upg_args_1""");
    }

    @Test
    void testIfTestHoistedAndBodyRewrittenInPlace() {
        Node module = module(ifStmt(
                call(name("f"), starred(name("a")), starred(name("b"))),
                List.of(expr(call(name("g"), starred(name("c")), starred(name("d"))))),
                List.of()));

        assertThat(fix(module)).isEqualTo("""
                upg_args_0 = []
                upg_args_0.extend(a)
                upg_args_0.extend(b)
                if f(*upg_args_0):
                    upg_args_1 = []
                    upg_args_1.extend(c)
                    upg_args_1.extend(d)
                    g(*upg_args_1)
                    del upg_args_1
                del upg_args_0""");
    }

    @Test
    void testFunctionDefaultHoistedBeforeDefinition() {
        Node args = arguments("x");
        args.getNodes("defaults").add(call(name("g"), starred(name("a")), starred(name("b"))));
        Node module = module(functionDef("f", args, pass()));

        assertThat(fix(module)).isEqualTo("""
                upg_args_0 = []
                upg_args_0.extend(a)
                upg_args_0.extend(b)
                def f(x=g(*upg_args_0)):
                    pass
                del upg_args_0""");
    }

    @Test
    void testExceptHandlerBodyRewritten() {
        Node handler = exceptHandler(name("ValueError"), null,
                expr(call(name("log"), starred(name("a")), starred(name("b")))));
        Node module = module(tryStmt(List.of(pass()), List.of(handler), List.of()));

        assertThat(fix(module)).isEqualTo("""
                try:
                    pass
                except ValueError:
                    upg_args_0 = []
                    upg_args_0.extend(a)
                    upg_args_0.extend(b)
                    log(*upg_args_0)
                    del upg_args_0""");
    }

    @Test
    void testLambdaBodyBecomesNamedFunction() {
        Node lambda = lambda(arguments("x"), call(name("f"), starred(name("x")), starred(name("x"))));
        Node module = module(
                assign("h", lambda),
                expr(call(name("h"), list())));

        assertThat(fix(module)).isEqualTo("""
                def upg_lambda_1(x):
                    upg_args_0 = []
                    upg_args_0.extend(x)
                    upg_args_0.extend(x)
                    return f(*upg_args_0)
                h = upg_lambda_1
                del upg_lambda_1
                h([])""");
    }

    @Test
    void testLambdaWithKeywordOnlyParametersRejected() {
        Node args = arguments();
        args.getNodes("kwonlyargs").add(arg("k"));
        args.getNodes("kwDefaults").add(null);
        Node module = module(assign("h", lambda(args, call(name("f"), starred(name("a")), starred(name("b"))))));

        assertThatThrownBy(() -> fix(module))
                .isInstanceOf(StructuralAssumptionException.class)
                .hasMessageContaining("keyword-only");
    }

    @Test
    void testLambdaPassedAsArgument() {
        Node lambda = lambda(arguments("x"), list(starred(name("x")), num(0)));
        Node module = module(expr(call(name("sorted"), List.of(name("items")), List.of(keyword("key", lambda)))));

        String source = fix(module);

        assertThat(source).startsWith("def upg_lambda_1(x):");
        assertThat(source).contains("sorted(items, key=upg_lambda_1)");
        assertThat(source).endsWith("del upg_lambda_1");
        assertThat(TreeWalker.walk(module, NodeKind.LAMBDA)).isEmpty();
    }

    @Test
    void testWhileTestRejected() {
        Node module = module(whileStmt(call(name("f"), starred(name("a")), starred(name("b"))), pass()));

        assertThatThrownBy(() -> fix(module))
                .isInstanceOf(StructuralAssumptionException.class)
                .hasMessageContaining("while");
    }

    @Test
    void testExceptTypeRejected() {
        Node handler = exceptHandler(tuple(starred(name("errs")), name("KeyError")), null, pass());
        Node module = module(tryStmt(List.of(assign("errs", tuple(name("ValueError")))), List.of(handler), List.of()));

        assertThatThrownBy(() -> fix(module))
                .isInstanceOf(StructuralAssumptionException.class)
                .hasMessageContaining("except clause");
    }

    @Test
    void testWhileBodyIsRewritten() {
        Node module = module(whileStmt(name("running"),
                expr(call(name("f"), starred(name("a")), starred(name("b"))))));

        assertThat(fix(module)).startsWith("""
                while running:
                    upg_args_0 = []""");
    }

    @Test
    void testExpansionEliminatesAllUnpacking() {
        Node module = module(
                assign(name("x", ExprContext.STORE), call(name("f"),
                        List.of(starred(name("a")), list(num(1), starred(name("b")), name("c"))),
                        List.of(doubleStarred(name("k")), keyword("z", dict(Arrays.asList(null, str("q")),
                                List.of(name("m"), set(starred(name("s")), name("t")))))))),
                returnStmt(tuple(starred(name("a")), starred(name("b")))));
        UnpackingGeneralizationsFixer fixer = new UnpackingGeneralizationsFixer();

        fixer.apply(config, module);

        for (Node node : TreeWalker.walk(module, NodeKind.CALL, NodeKind.LIST, NodeKind.TUPLE, NodeKind.SET)) {
            assertThat(fixer.hasArgsUnpacking(node)).as(node.toString()).isFalse();
        }
        for (Node node : TreeWalker.walk(module, NodeKind.CALL, NodeKind.DICT)) {
            assertThat(fixer.hasKwargsUnpacking(node)).as(node.toString()).isFalse();
        }
    }

    @Test
    void testSecondApplicationIsNoOp() {
        Node module = module(expr(call(name("f"), List.of(starred(name("a")), starred(name("b"))),
                List.of(doubleStarred(name("c")), keyword("d", num(1))))));
        fix(module);
        Node once = module.deepCopy();

        fix(module);

        assertThat(module).isEqualTo(once);
    }

    @Test
    void testDeepNestingWithinBoundTerminates() {
        Node module = module(expr(nestedUnpackingCall(10)));

        String source = fix(module);

        assertThat(module.getNodes("body")).hasSize(1 + 4 * 10);
        assertThat(source).contains("upg_args_9");
    }

    @Test
    void testExpansionOverflow() {
        Node module = module(expr(nestedUnpackingCall(40)));

        assertThatThrownBy(() -> fix(module))
                .isInstanceOfSatisfying(ExpansionOverflowException.class,
                        e -> assertThat(e.getInitialLength()).isEqualTo(1));
    }

    @Test
    void testTemporaryCounterIsPerInstance() {
        Node first = module(expr(call(name("f"), starred(name("a")), starred(name("b")))));
        Node second = first.deepCopy();

        assertThat(fix(first)).isEqualTo(fix(second));
    }

    @Test
    void testDetection() {
        UnpackingGeneralizationsFixer fixer = new UnpackingGeneralizationsFixer();

        assertThat(fixer.hasArgsUnpacking(call(name("f"), starred(name("a")), name("b")))).isTrue();
        assertThat(fixer.hasArgsUnpacking(call(name("f"), name("a"), starred(name("b"))))).isFalse();
        assertThat(fixer.hasArgsUnpacking(list())).isFalse();
        assertThat(fixer.hasKwargsUnpacking(dict(Arrays.asList(null, null), List.of(name("a"), name("b"))))).isTrue();
        assertThatThrownBy(() -> fixer.hasArgsUnpacking(name("x")))
                .isInstanceOf(StructuralAssumptionException.class);
    }

    /**
     * {@code f(*a, *f(*a, *f(...)))} with the given number of calls.
     */
    private static Node nestedUnpackingCall(int depth) {
        Node current = call(name("f"), starred(name("a")), starred(name("a")));
        for (int i = 1; i < depth; i++) {
            current = call(name("f"), starred(name("a")), starred(current));
        }
        return current;
    }
}
