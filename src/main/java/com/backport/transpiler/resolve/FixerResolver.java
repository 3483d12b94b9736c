package com.backport.transpiler.resolve;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.backport.transpiler.checker.Checker;
import com.backport.transpiler.checker.CheckerRegistry;
import com.backport.transpiler.checker.CheckerRegistry.CheckerDefinition;
import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.exception.ConfigurationException;
import com.backport.transpiler.exception.IncompatibleFixerSelectionException;
import com.backport.transpiler.fixer.Fixer;
import com.backport.transpiler.fixer.FixerDefinition;
import com.backport.transpiler.fixer.FixerRegistry;
import com.backport.transpiler.version.Version;

/**
 * Selects the fixers and checkers for a build configuration.
 *
 * <p>Without an allowlist every fixer whose apply window contains the target is
 * selected; with one, exactly the named fixers are. Either way the result keeps
 * registry order and every call returns new instances. Nothing is resolved
 * lazily: all configuration errors surface here, before any tree is touched.
 */
public class FixerResolver {

    private static final Logger log = LoggerFactory.getLogger(FixerResolver.class);

    private final FixerRegistry fixerRegistry;
    private final CheckerRegistry checkerRegistry;

    public FixerResolver(FixerRegistry fixerRegistry, CheckerRegistry checkerRegistry) {
        this.fixerRegistry = fixerRegistry;
        this.checkerRegistry = checkerRegistry;
    }

    public static FixerResolver withDefaults() {
        return new FixerResolver(FixerRegistry.defaultRegistry(), CheckerRegistry.defaultRegistry());
    }

    public ResolvedBuild resolve(BuildConfig config) {
        Version target = config.getTargetVersion();
        checkKnownNames(config);

        List<FixerDefinition> selected = selectFixers(config);
        List<String> incompatible = selected.stream()
                .filter(definition -> !definition.getApplicability().isCompatibleWith(target))
                .map(FixerDefinition::getName)
                .toList();
        if (!incompatible.isEmpty()) {
            throw new IncompatibleFixerSelectionException(target.toString(), incompatible);
        }

        List<Fixer> fixers = new ArrayList<>(selected.size());
        for (FixerDefinition definition : selected) {
            fixers.add(definition.newInstance());
        }

        List<Checker> checkers = resolveCheckers(config, fixers);

        log.debug("Resolved {} fixer(s) and {} checker(s) for target {}: {} / {}",
                fixers.size(), checkers.size(), target,
                fixers.stream().map(Fixer::getName).toList(),
                checkers.stream().map(Checker::getName).toList());
        return new ResolvedBuild(config, List.copyOf(fixers), List.copyOf(checkers));
    }

    private void checkKnownNames(BuildConfig config) {
        List<String> errors = new ArrayList<>();
        List<String> unknownFixers = config.getFixerAllowlist().stream()
                .filter(name -> !fixerRegistry.contains(name))
                .toList();
        if (!unknownFixers.isEmpty()) {
            errors.add("Unknown fixer(s): " + String.join(", ", unknownFixers));
        }
        List<String> unknownCheckers = config.getCheckerAllowlist().stream()
                .filter(name -> !checkerRegistry.contains(name))
                .toList();
        if (!unknownCheckers.isEmpty()) {
            errors.add("Unknown checker(s): " + String.join(", ", unknownCheckers));
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException(String.join("; ", errors));
        }
    }

    private List<FixerDefinition> selectFixers(BuildConfig config) {
        Version target = config.getTargetVersion();
        List<FixerDefinition> selected = new ArrayList<>();
        for (FixerDefinition definition : fixerRegistry.getDefinitions()) {
            boolean keep = config.hasFixerAllowlist()
                    ? config.getFixerAllowlist().contains(definition.getName())
                    : definition.getApplicability().isRequiredFor(target);
            if (keep) {
                selected.add(definition);
            } else {
                log.trace("Skipping fixer {} for target {}", definition.getName(), target);
            }
        }
        return selected;
    }

    /**
     * Checkers named in the allowlist (or required for the target), plus the
     * checkers selected fixers rely on. A dependency on a checker that cannot
     * run for the target is a configuration error while checking is active.
     */
    private List<Checker> resolveCheckers(BuildConfig config, List<Fixer> fixers) {
        Version target = config.getTargetVersion();
        Set<String> names = new LinkedHashSet<>();
        for (CheckerDefinition definition : checkerRegistry.getDefinitions()) {
            boolean keep = config.hasCheckerAllowlist()
                    ? config.getCheckerAllowlist().contains(definition.getName())
                    : definition.getApplicability().isRequiredFor(target);
            if (keep) {
                names.add(definition.getName());
            }
        }

        if (!names.isEmpty()) {
            List<String> errors = new ArrayList<>();
            for (Fixer fixer : fixers) {
                for (String required : fixer.getRequiredCheckers()) {
                    CheckerDefinition definition = checkerRegistry.find(required)
                            .orElseThrow(() -> new ConfigurationException("Fixer " + fixer.getName()
                                    + " depends on unknown checker " + required));
                    if (definition.getApplicability().isRequiredFor(target)) {
                        names.add(required);
                    } else if (!names.contains(required)) {
                        errors.add("Fixer " + fixer.getName() + " depends on checker " + required
                                + " which does not apply to target " + target + " ("
                                + definition.getApplicability() + ")");
                    }
                }
            }
            if (!errors.isEmpty()) {
                throw new ConfigurationException(String.join("; ", errors));
            }
        }

        List<Checker> checkers = new ArrayList<>();
        for (CheckerDefinition definition : checkerRegistry.getDefinitions()) {
            if (names.contains(definition.getName())) {
                checkers.add(definition.newInstance());
            }
        }
        return checkers;
    }
}
