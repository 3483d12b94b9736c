package com.backport.transpiler.fixer;

import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.model.ImportDeclaration;
import com.backport.transpiler.model.Node;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Leaves the tree alone and requires {@code from __future__ import <feature>}.
 * Windows follow the versions in which each feature was optional.
 */
public class FutureImportFixer extends AbstractFixer {

    private final String feature;

    public FutureImportFixer(String feature, ApplicabilityWindow applicability) {
        super(feature + "_future", applicability);
        this.feature = feature;
    }

    public String getFeature() {
        return feature;
    }

    @Override
    public Node apply(BuildConfig config, Node module) {
        requireImport(ImportDeclaration.future(feature));
        return module;
    }
}
