package com.backport.transpiler.checker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.backport.transpiler.exception.ConfigurationException;
import com.backport.transpiler.version.ApplicabilityWindow;

import lombok.Value;

/**
 * Ordered catalog of checkers, keyed by name.
 */
public class CheckerRegistry {

    @Value
    public static class CheckerDefinition {
        String name;
        ApplicabilityWindow applicability;
        Supplier<Checker> factory;

        public Checker newInstance() {
            return factory.get();
        }
    }

    private final Map<String, CheckerDefinition> definitions = new LinkedHashMap<>();

    public CheckerRegistry register(Supplier<Checker> factory) {
        Checker prototype = factory.get();
        if (definitions.containsKey(prototype.getName())) {
            throw new ConfigurationException("Duplicate checker name: " + prototype.getName());
        }
        definitions.put(prototype.getName(),
                new CheckerDefinition(prototype.getName(), prototype.getApplicability(), factory));
        return this;
    }

    public List<CheckerDefinition> getDefinitions() {
        return List.copyOf(definitions.values());
    }

    public Optional<CheckerDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public List<String> getNames() {
        return new ArrayList<>(definitions.keySet());
    }

    public static CheckerRegistry defaultRegistry() {
        return new CheckerRegistry()
                .register(NoOverriddenBuiltinsChecker::new)
                .register(NoMatMulOperatorChecker::new);
    }
}
