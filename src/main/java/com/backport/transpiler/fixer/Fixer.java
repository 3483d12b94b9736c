package com.backport.transpiler.fixer;

import java.util.Set;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.model.ImportDeclaration;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.version.ApplicabilityWindow;
import com.backport.transpiler.version.Version;

/**
 * A version-gated rewrite rule over a module tree.
 *
 * <p>Instances carry per-source-unit state (imports found to be needed,
 * temporary name counters) and must not be reused across units.
 */
public interface Fixer {

    String getName();

    ApplicabilityWindow getApplicability();

    /**
     * Rewrites the module and returns the resulting root. May mutate {@code module} in place.
     */
    Node apply(BuildConfig config, Node module);

    /**
     * Imports the rewritten module needs; filled in by {@link #apply}.
     */
    Set<ImportDeclaration> getRequiredImports();

    /**
     * Names of checkers whose guarantees this fixer relies on.
     */
    default Set<String> getRequiredCheckers() {
        return Set.of();
    }

    default boolean isRequiredFor(Version version) {
        return getApplicability().isRequiredFor(version);
    }

    default boolean isCompatibleWith(Version version) {
        return getApplicability().isCompatibleWith(version);
    }
}
