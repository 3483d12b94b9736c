package com.backport.transpiler.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "resolve" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ResolveOptions {

	@Option(names = { "--target-version", "-t" }, defaultValue = "2.7", description = "Version the output must run on (default: 2.7)")
	private String targetVersion;

	@Option(names = { "--fixers" }, description = "Comma-separated fixer names to run instead of all fixers required for the target")
	private String fixers;

	@Option(names = { "--checkers" }, description = "Comma-separated checker names to run instead of all checkers required for the target")
	private String checkers;

	@Option(names = { "--force", "-f" }, negatable = true, defaultValue = "true", description = "Ignore cached results of earlier runs (default: true)")
	private boolean force;
}
