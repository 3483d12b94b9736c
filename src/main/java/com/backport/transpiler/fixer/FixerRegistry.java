package com.backport.transpiler.fixer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.backport.transpiler.exception.ConfigurationException;
import com.backport.transpiler.fixer.unpacking.UnpackingGeneralizationsFixer;
import com.backport.transpiler.version.ApplicabilityWindow;

/**
 * Ordered catalog of fixer definitions. Declaration order is the order in
 * which selected fixers are applied.
 */
public class FixerRegistry {

    private final Map<String, FixerDefinition> definitions = new LinkedHashMap<>();

    public FixerRegistry register(FixerDefinition definition) {
        if (definitions.containsKey(definition.getName())) {
            throw new ConfigurationException("Duplicate fixer name: " + definition.getName());
        }
        definitions.put(definition.getName(), definition);
        return this;
    }

    public FixerRegistry register(Supplier<Fixer> factory) {
        return register(FixerDefinition.of(factory));
    }

    public List<FixerDefinition> getDefinitions() {
        return List.copyOf(definitions.values());
    }

    public Optional<FixerDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public List<String> getNames() {
        return new ArrayList<>(definitions.keySet());
    }

    /**
     * The built-in catalog in application order.
     */
    public static FixerRegistry defaultRegistry() {
        FixerRegistry registry = new FixerRegistry()
                .register(RemoveFunctionDefAnnotationsFixer::new)
                .register(RemoveAnnAssignFixer::new)
                .register(FStringToStrFormatFixer::new)
                .register(InlineKwOnlyArgsFixer::new)
                .register(UnpackingGeneralizationsFixer::new)
                .register(ShortToLongFormSuperFixer::new)
                .register(NewStyleClassesFixer::new)
                .register(ItertoolsBuiltinsFixer::new)
                .register(RangeToXrangeFixer::new);

        future(registry, "generator_stop", "3.5", "3.6");
        future(registry, "unicode_literals", "2.6", "2.7");
        future(registry, "print_function", "2.6", "2.7");
        future(registry, "with_statement", "2.5", "2.5");
        future(registry, "absolute_import", "2.5", "2.7");
        future(registry, "division", "2.2", "2.7");
        future(registry, "generators", "2.2", "2.2");
        future(registry, "nested_scopes", "2.1", "2.1");
        return registry;
    }

    private static void future(FixerRegistry registry, String feature, String applySince, String applyUntil) {
        ApplicabilityWindow window = ApplicabilityWindow.of(applySince, applyUntil);
        registry.register(() -> new FutureImportFixer(feature, window));
    }
}
