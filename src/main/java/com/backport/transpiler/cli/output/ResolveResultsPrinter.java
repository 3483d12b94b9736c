package com.backport.transpiler.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.backport.transpiler.checker.Checker;
import com.backport.transpiler.cli.exception.OptionsValidationException;
import com.backport.transpiler.cli.model.ResolveOptions;
import com.backport.transpiler.cli.model.ValidatedResolveOptions;
import com.backport.transpiler.exception.TranspileException;
import com.backport.transpiler.fixer.Fixer;
import com.backport.transpiler.resolve.ResolvedBuild;

/**
 * Responsible only for printing CLI output for the "resolve" command.
 * No validation, no execution.
 */
public class ResolveResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ResolveResultsPrinter.class);

    public void printBanner(ResolveOptions o, ValidatedResolveOptions v) {
        log.info("=================================================");
        log.info("Syntax Backport");
        log.info("=================================================");
        log.info("Target Version: {}", v.getBuildConfig().getTargetVersion());
        log.info("Fixers: {}", v.isUsingFixerAllowlist() ? o.getFixers() : "all required for target");
        log.info("Checkers: {}", v.isUsingCheckerAllowlist() ? o.getCheckers() : "all required for target");
        log.info("Force: {}", v.getBuildConfig().isForce());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedResolveOptions v, ResolvedBuild build) {
        log.info("");
        log.info("=================================================");
        log.info("RESOLUTION SUCCESSFUL");
        log.info("=================================================");

        log.info("Checkers ({}):", build.getCheckers().size());
        for (Checker checker : build.getCheckers()) {
            log.info("  {} [{}]", checker.getName(), checker.getApplicability());
        }

        log.info("");
        log.info("Fixers ({}), in application order:", build.getFixers().size());
        int position = 1;
        for (Fixer fixer : build.getFixers()) {
            log.info("  {}. {} [{}]", position++, fixer.getName(), fixer.getApplicability());
        }
        if (build.getFixers().isEmpty()) {
            log.info("  none, target {} needs no rewriting", v.getBuildConfig().getTargetVersion());
        }
        log.info("=================================================");
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        for (String error : e.getErrors()) {
            log.error("  {}", error);
        }
    }

    public void printFailure(TranspileException e) {
        log.error("Resolution failed: {}", e.getMessage());
    }
}
