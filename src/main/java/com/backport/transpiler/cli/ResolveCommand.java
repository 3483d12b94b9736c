package com.backport.transpiler.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.backport.transpiler.cli.exception.OptionsValidationException;
import com.backport.transpiler.cli.model.ResolveOptions;
import com.backport.transpiler.cli.model.ValidatedResolveOptions;
import com.backport.transpiler.cli.output.ResolveResultsPrinter;
import com.backport.transpiler.cli.validation.ResolveOptionsValidator;
import com.backport.transpiler.exception.TranspileException;
import com.backport.transpiler.resolve.FixerResolver;
import com.backport.transpiler.resolve.ResolvedBuild;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command printing the fixers and checkers a build runs for a target version.
 */
@Command(
        name = "resolve",
        mixinStandardHelpOptions = true,
        version = "syntax-backport 1.0.0",
        description = "Resolves the ordered fixer and checker pipeline for a target version."
)
public class ResolveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ResolveCommand.class);

    @Mixin
    private ResolveOptions options = new ResolveOptions();

    private final ResolveOptionsValidator validator;
    private final ResolveResultsPrinter printer;
    private final FixerResolver resolver;

    public ResolveCommand() {
        this(new ResolveOptionsValidator(), new ResolveResultsPrinter(), FixerResolver.withDefaults());
    }

    ResolveCommand(ResolveOptionsValidator validator, ResolveResultsPrinter printer, FixerResolver resolver) {
        this.validator = validator;
        this.printer = printer;
        this.resolver = resolver;
    }

    @Override
    public Integer call() {
        try {
            ValidatedResolveOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            ResolvedBuild build = resolver.resolve(validated.getBuildConfig());
            printer.printSuccess(validated, build);
            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        } catch (TranspileException e) {
            printer.printFailure(e);
            return 1;
        } catch (Exception e) {
            log.error("Resolution failed with exception", e);
            return 1;
        }
    }
}
