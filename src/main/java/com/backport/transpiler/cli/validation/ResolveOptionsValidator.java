package com.backport.transpiler.cli.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.backport.transpiler.cli.exception.OptionsValidationException;
import com.backport.transpiler.cli.model.ResolveOptions;
import com.backport.transpiler.cli.model.ValidatedResolveOptions;
import com.backport.transpiler.config.BuildConfig;
import com.backport.transpiler.config.BuildConfigParser;
import com.backport.transpiler.exception.ConfigurationException;
import com.backport.transpiler.version.Version;

public class ResolveOptionsValidator {

	public ValidatedResolveOptions validate(ResolveOptions o) {
		List<String> errors = new ArrayList<>();

		Version targetVersion = null;
		if (isBlank(o.getTargetVersion())) {
			errors.add("Target version is required (--target-version / -t).");
		} else {
			try {
				targetVersion = Version.parse(o.getTargetVersion().trim());
			} catch (ConfigurationException e) {
				errors.add(e.getMessage());
			}
		}

		Set<String> fixers = BuildConfigParser.parseNames(o.getFixers());
		Set<String> checkers = BuildConfigParser.parseNames(o.getCheckers());

		if (o.getFixers() != null && fixers.isEmpty()) {
			errors.add("--fixers was given but names no fixer.");
		}
		if (o.getCheckers() != null && checkers.isEmpty()) {
			errors.add("--checkers was given but names no checker.");
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		BuildConfig config = BuildConfig.builder()
				.targetVersion(targetVersion)
				.force(o.isForce())
				.fixerAllowlist(fixers)
				.checkerAllowlist(checkers)
				.build();

		return new ValidatedResolveOptions(config, !fixers.isEmpty(), !checkers.isEmpty());
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
