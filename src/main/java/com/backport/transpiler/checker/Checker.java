package com.backport.transpiler.checker;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.version.ApplicabilityWindow;
import com.backport.transpiler.version.Version;

/**
 * A read-only rule over a module tree. Checkers reject source that some
 * fixer could not rewrite safely, or syntax no fixer can express for the
 * target.
 */
public interface Checker {

    String getName();

    ApplicabilityWindow getApplicability();

    /**
     * @throws com.backport.transpiler.exception.CheckerViolationException on the first violation
     */
    void check(BuildConfig config, Node module);

    default boolean isRequiredFor(Version version) {
        return getApplicability().isRequiredFor(version);
    }
}
