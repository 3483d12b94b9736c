package com.backport.transpiler;

import com.backport.transpiler.cli.ResolveCommand;

import picocli.CommandLine;

/**
 * Main entry point for the syntax backport tool.
 * Lists the fixers and checkers a build would run for a target version.
 */
public class TranspilerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ResolveCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
