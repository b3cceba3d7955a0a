package com.resource.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resource.generator.cli.model.GenerateOptions;
import com.resource.generator.cli.model.ValidatedGenerateOptions;
import com.resource.generator.codegen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the accessor generator.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Resource Accessor Generator");
        log.info("=================================================");
        log.info("Schema: {}", o.getSchema());
        log.info("Package: {}", o.getTargetPackage() != null ? o.getTargetPackage() : "(schema package)");
        log.info("Suffix: {}", v.getSuffixOption());
        log.info("Selector: {}", v.getSelector());
        log.info("Output File: {}", v.getFacadePath());
        if (o.isDryRun()) {
            log.info("Dry Run: nothing will be written");
        }
        log.info("=================================================");
    }

    public void printSuccess(GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info(result.isWritten() ? "GENERATION SUCCESSFUL" : "DRY RUN COMPLETE");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Suffix: {}", result.getSuffix().isEmpty() ? "(none)" : result.getSuffix());
        log.info("Accessors: {}", result.getAccessorCount());
        for (String description : result.getDescriptions()) {
            log.info("  {}", description);
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
