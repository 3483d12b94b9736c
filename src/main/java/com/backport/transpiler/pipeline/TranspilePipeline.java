package com.backport.transpiler.pipeline;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.backport.transpiler.checker.Checker;
import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.exception.StructuralAssumptionException;
import com.backport.transpiler.fixer.Fixer;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;
import com.backport.transpiler.resolve.ResolvedBuild;

/**
 * Runs resolved fixers over one module, in order. The first failure propagates
 * unchanged and the partially rewritten tree must be discarded by the caller.
 */
public class TranspilePipeline {

    private static final Logger log = LoggerFactory.getLogger(TranspilePipeline.class);

    private final BuildConfig config;

    public TranspilePipeline(BuildConfig config) {
        this.config = config;
    }

    /**
     * Runs the build's checkers, then its fixers.
     */
    public static TranspileResult run(ResolvedBuild build, Node module) {
        TranspilePipeline pipeline = new TranspilePipeline(build.getConfig());
        pipeline.check(build.getCheckers(), module);
        return pipeline.apply(build.getFixers(), module);
    }

    public void check(List<Checker> checkers, Node module) {
        requireModule(module);
        for (Checker checker : checkers) {
            log.debug("Running checker {}", checker.getName());
            checker.check(config, module);
        }
    }

    public TranspileResult apply(List<Fixer> fixers, Node module) {
        requireModule(module);
        Node tree = module;
        RequiredImports imports = new RequiredImports();
        for (Fixer fixer : fixers) {
            log.debug("Applying fixer {}", fixer.getName());
            tree = fixer.apply(config, tree);
            requireModule(tree);
            imports.addAll(fixer.getRequiredImports());
        }
        log.debug("Pipeline finished, {} fixer(s) applied, required imports {}", fixers.size(), imports);
        return new TranspileResult(tree, imports);
    }

    private static void requireModule(Node tree) {
        if (tree == null || !tree.is(NodeKind.MODULE)) {
            throw new StructuralAssumptionException("Expected a Module root, got "
                    + (tree == null ? "null" : tree.getKind().getDisplayName()));
        }
    }
}
