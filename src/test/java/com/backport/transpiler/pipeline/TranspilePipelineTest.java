package com.backport.transpiler.pipeline;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.exception.CheckerViolationException;
import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.fixer.AbstractFixer;
import com.backport.transpiler.fixer.Fixer;
import com.backport.transpiler.fixer.FutureImportFixer;
import com.backport.transpiler.fixer.ItertoolsBuiltinsFixer;
import com.backport.transpiler.fixer.RangeToXrangeFixer;
import com.backport.transpiler.model.ImportDeclaration;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.resolve.FixerResolver;
import com.backport.transpiler.resolve.ResolvedBuild;
import com.backport.transpiler.support.SourceRenderer;
import com.backport.transpiler.version.ApplicabilityWindow;

import static com.backport.transpiler.model.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TranspilePipeline.
 */
class TranspilePipelineTest {

    private final BuildConfig config = BuildConfig.forTarget("2.7");

    @Test
    void testFixersRunInOrderAndImportsAreCollected() {
        Node module = module(assign("a", call(name("list"), call(name("map"), name("f"), call(name("range"), num(3))))));
        List<Fixer> fixers = List.of(
                new ItertoolsBuiltinsFixer(),
                new RangeToXrangeFixer(),
                new FutureImportFixer("division", ApplicabilityWindow.of("2.2", "2.7")));

        TranspileResult result = new TranspilePipeline(config).apply(fixers, module);

        assertThat(SourceRenderer.render(result.getModule())).isEqualTo("a = list(itertools.imap(f, xrange(3)))");
        assertThat(result.getRequiredImports().ordered())
                .containsExactly(ImportDeclaration.future("division"), ImportDeclaration.module("itertools"));
    }

    @Test
    void testRunResolvedBuildForPython27() {
        Node module = module(assign("a", call(name("zip"), name("xs"), call(name("range"), num(3)))));
        ResolvedBuild build = FixerResolver.withDefaults().resolve(config);

        Node rewritten = TranspilePipeline.run(build, module).withImportsPrepended();

        assertThat(SourceRenderer.render(rewritten)).isEqualTo("""
                from __future__ import division
                from __future__ import absolute_import
                from __future__ import print_function
                from __future__ import unicode_literals
                import itertools
                a = itertools.izip(xs, xrange(3))""");
    }

    @Test
    void testCheckerFailureStopsBeforeFixers() {
        Node module = module(assign("range", num(1)), expr(call(name("map"), name("f"), name("xs"))));
        ResolvedBuild build = FixerResolver.withDefaults().resolve(config);

        assertThatThrownBy(() -> TranspilePipeline.run(build, module))
                .isInstanceOf(CheckerViolationException.class);
        assertThat(SourceRenderer.render(module)).isEqualTo("""
                range = 1
                map(f, xs)""");
    }

    @Test
    void testNonModuleRootRejected() {
        TranspilePipeline pipeline = new TranspilePipeline(config);

        assertThatThrownBy(() -> pipeline.apply(List.of(), expr(name("x"))))
                .isInstanceOf(StructuralAssumptionException.class)
                .hasMessageStartingWith("Expected a Module root");
    }

    @Test
    void testFixerReturningNonModuleRejected() {
        Fixer broken = new AbstractFixer("broken", ApplicabilityWindow.of("2.0", "2.7")) {
            @Override
            public Node apply(BuildConfig config, Node module) {
                return pass();
            }
        };

        assertThatThrownBy(() -> new TranspilePipeline(config).apply(List.of(broken), module(pass())))
                .isInstanceOf(StructuralAssumptionException.class);
    }

    @Test
    void testImportsInsertedAfterDocstring() {
        Node module = module(expr(str("Module doc.")), importStmt("itertools"), assign("x", num(1)));
        RequiredImports imports = new RequiredImports();
        imports.add(ImportDeclaration.module("itertools"));
        imports.add(ImportDeclaration.future("print_function"));

        new TranspileResult(module, imports).withImportsPrepended();

        assertThat(SourceRenderer.render(module)).isEqualTo("""
                "Module doc."
                from __future__ import print_function
                import itertools
                x = 1""");
    }

    @Test
    void testNoImportsLeavesModuleUnchanged() {
        Node module = module(assign("x", num(1)));

        TranspileResult result = new TranspilePipeline(config).apply(List.of(), module);

        assertThat(result.getRequiredImports().isEmpty()).isTrue();
        assertThat(SourceRenderer.render(result.withImportsPrepended())).isEqualTo("x = 1");
    }
}
