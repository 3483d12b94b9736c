package com.backport.transpiler.fixer;

import java.util.function.Supplier;

import com.backport.transpiler.version.ApplicabilityWindow;

import lombok.NonNull;
import lombok.Value;

/**
 * Registry entry: a fixer name, its window and a factory creating a fresh
 * instance per source unit.
 */
@Value
public class FixerDefinition {

    @NonNull
    String name;

    @NonNull
    ApplicabilityWindow applicability;

    @NonNull
    Supplier<Fixer> factory;

    public Fixer newInstance() {
        return factory.get();
    }

    /**
     * Definition whose name and window are taken from a prototype instance.
     */
    public static FixerDefinition of(Supplier<Fixer> factory) {
        Fixer prototype = factory.get();
        return new FixerDefinition(prototype.getName(), prototype.getApplicability(), factory);
    }
}
