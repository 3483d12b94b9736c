package com.backport.transpiler.fixer;

import org.junit.jupiter.api.Test;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.support.SourceRenderer;

import static com.backport.transpiler.model.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RemoveFunctionDefAnnotationsFixer.
 */
class RemoveFunctionDefAnnotationsFixerTest {

    private final BuildConfig config = BuildConfig.forTarget("2.7");

    @Test
    void testStripsReturnAndParameterAnnotations() {
        Node args = arguments();
        args.getNodes("args").add(arg("a", name("int")));
        args.getNodes("kwonlyargs").add(arg("b", name("str")));
        args.set("vararg", arg("rest", name("tuple")));
        args.set("kwarg", arg("options", name("dict")));
        args.getNodes("kwDefaults").add(null);
        Node function = functionDef("f", args, returnStmt(name("a")));
        function.set("returns", name("int"));
        Node module = module(function);

        new RemoveFunctionDefAnnotationsFixer().apply(config, module);

        assertThat(SourceRenderer.render(module)).isEqualTo("""
                def f(a, *rest, b, **options):
                    return a""");
    }

    @Test
    void testNestedFunctionsAreStripped() {
        Node inner = functionDef("inner", arguments(), pass());
        inner.set("returns", name("None"));
        Node module = module(functionDef("outer", arguments(), inner));

        new RemoveFunctionDefAnnotationsFixer().apply(config, module);

        assertThat(inner.getNode("returns")).isNull();
    }

    @Test
    void testRequiresNoImports() {
        RemoveFunctionDefAnnotationsFixer fixer = new RemoveFunctionDefAnnotationsFixer();

        fixer.apply(config, module(functionDef("f", arguments("a"), pass())));

        assertThat(fixer.getRequiredImports()).isEmpty();
    }
}
