package com.backport.transpiler.fixer;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.backport.transpiler.model.ImportDeclaration;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Base class holding the name, window and import set shared by all fixers.
 */
public abstract class AbstractFixer implements Fixer {

    private final String name;
    private final ApplicabilityWindow applicability;
    private final Set<ImportDeclaration> requiredImports = new LinkedHashSet<>();

    protected AbstractFixer(String name, ApplicabilityWindow applicability) {
        this.name = name;
        this.applicability = applicability;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ApplicabilityWindow getApplicability() {
        return applicability;
    }

    @Override
    public Set<ImportDeclaration> getRequiredImports() {
        return Collections.unmodifiableSet(requiredImports);
    }

    protected void requireImport(ImportDeclaration declaration) {
        requiredImports.add(declaration);
    }

    @Override
    public String toString() {
        return name + " (" + applicability + ")";
    }
}
