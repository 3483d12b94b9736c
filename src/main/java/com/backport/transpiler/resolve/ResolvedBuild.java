package com.backport.transpiler.resolve;

import java.util.List;

import com.backport.transpiler.checker.Checker;
import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.fixer.Fixer;

import lombok.Value;

/**
 * Fresh fixer and checker instances selected for one source unit, in
 * application order.
 */
@Value
public class ResolvedBuild {

    BuildConfig config;
    List<Fixer> fixers;
    List<Checker> checkers;

    public List<String> getFixerNames() {
        return fixers.stream().map(Fixer::getName).toList();
    }

    public List<String> getCheckerNames() {
        return checkers.stream().map(Checker::getName).toList();
    }
}
