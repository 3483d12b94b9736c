package com.backport.transpiler.cli.model;

import com.backport.transpiler.config.BuildConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the command. Keeps ResolveCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedResolveOptions {
    BuildConfig buildConfig;
    boolean usingFixerAllowlist;
    boolean usingCheckerAllowlist;
}
