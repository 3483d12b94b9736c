package com.backport.transpiler.fixer;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.support.SourceRenderer;

import static com.backport.transpiler.model.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for InlineKwOnlyArgsFixer.
 */
class InlineKwOnlyArgsFixerTest {

    private final BuildConfig config = BuildConfig.forTarget("2.7");

    private static Node kwOnlyArguments(List<String> names, List<Node> defaults) {
        Node args = arguments();
        names.forEach(name -> args.getNodes("kwonlyargs").add(arg(name)));
        args.set("kwDefaults", defaults);
        return args;
    }

    @Test
    void testRequiredAndDefaultedKeywordOnlyArgs() {
        Node module = module(functionDef("f",
                kwOnlyArguments(List.of("x", "y"), Arrays.asList(null, num(2))),
                returnStmt(binOp(name("x"), "+", name("y")))));

        new InlineKwOnlyArgsFixer().apply(config, module);

        assertThat(SourceRenderer.render(module)).isEqualTo("""
                def f(**kwargs):
                    x = kwargs["x"]
                    y = kwargs.get("y", 2)
                    return x + y""");
    }

    @Test
    void testExistingKwargsNameIsReused() {
        Node args = kwOnlyArguments(List.of("flag"), List.of(constant(Boolean.FALSE)));
        args.getNodes("args").add(arg("a"));
        args.set("kwarg", arg("options"));
        Node module = module(functionDef("g", args, pass()));

        new InlineKwOnlyArgsFixer().apply(config, module);

        assertThat(SourceRenderer.render(module)).isEqualTo("""
                def g(a, **options):
                    flag = options.get("flag", False)
                    pass""");
    }

    @Test
    void testNestedFunctionsAreRewritten() {
        Node inner = functionDef("inner", kwOnlyArguments(List.of("z"), Arrays.asList((Node) null)), pass());
        Node module = module(functionDef("outer", arguments(), inner));

        new InlineKwOnlyArgsFixer().apply(config, module);

        assertThat(SourceRenderer.render(module)).isEqualTo("""
                def outer():
                    def inner(**kwargs):
                        z = kwargs["z"]
                        pass""");
    }

    @Test
    void testFunctionWithoutKeywordOnlyArgsUntouched() {
        Node module = module(functionDef("f", arguments("a"), pass()));
        Node before = module.deepCopy();

        new InlineKwOnlyArgsFixer().apply(config, module);

        assertThat(module).isEqualTo(before);
    }

    @Test
    void testNonLiteralDefaultRejected() {
        Node module = module(functionDef("f",
                kwOnlyArguments(List.of("x"), List.of(call(name("make")))),
                pass()));

        assertThatThrownBy(() -> new InlineKwOnlyArgsFixer().apply(config, module))
                .isInstanceOf(StructuralAssumptionException.class)
                .hasMessageContaining("'x'")
                .hasMessageContaining("literal default");
    }
}
