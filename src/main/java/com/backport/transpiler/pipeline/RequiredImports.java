package com.backport.transpiler.pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.backport.transpiler.model.ImportDeclaration;

/**
 * Union of the imports requested by the fixers of one run, deduplicated.
 */
public class RequiredImports {

    /**
     * {@code __future__} features in the order they are emitted.
     */
    static final List<String> FUTURE_ORDER = List.of(
            "nested_scopes",
            "generators",
            "division",
            "absolute_import",
            "with_statement",
            "print_function",
            "unicode_literals",
            "generator_stop");

    private final Set<ImportDeclaration> imports = new LinkedHashSet<>();

    public void add(ImportDeclaration declaration) {
        imports.add(declaration);
    }

    public void addAll(Collection<ImportDeclaration> declarations) {
        imports.addAll(declarations);
    }

    public boolean isEmpty() {
        return imports.isEmpty();
    }

    public int size() {
        return imports.size();
    }

    public boolean contains(ImportDeclaration declaration) {
        return imports.contains(declaration);
    }

    /**
     * {@code __future__} imports first (they must precede all other statements),
     * in the fixed feature order; everything else in first-requested order.
     */
    public List<ImportDeclaration> ordered() {
        List<ImportDeclaration> futures = new ArrayList<>();
        List<ImportDeclaration> others = new ArrayList<>();
        for (ImportDeclaration declaration : imports) {
            if (declaration.isFuture()) {
                futures.add(declaration);
            } else {
                others.add(declaration);
            }
        }
        futures.sort(Comparator.comparingInt(RequiredImports::futureRank));

        List<ImportDeclaration> result = new ArrayList<>(futures);
        result.addAll(others);
        return result;
    }

    // unknown features go after the known ones, stable sort keeps their request order
    private static int futureRank(ImportDeclaration declaration) {
        int rank = FUTURE_ORDER.indexOf(declaration.getMemberName());
        return rank < 0 ? FUTURE_ORDER.size() : rank;
    }

    @Override
    public String toString() {
        return ordered().toString();
    }
}
