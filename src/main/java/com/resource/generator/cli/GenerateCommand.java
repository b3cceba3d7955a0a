package com.resource.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resource.generator.cli.exception.OptionsValidationException;
import com.resource.generator.cli.model.GenerateOptions;
import com.resource.generator.cli.model.ValidatedGenerateOptions;
import com.resource.generator.cli.output.GenerateResultsPrinter;
import com.resource.generator.cli.validation.GenerateOptionsValidator;
import com.resource.generator.codegen.AccessorSourceGenerator;
import com.resource.generator.codegen.GeneratorConfig;
import com.resource.generator.codegen.GeneratorResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that generates a CRUD accessor facade for one schema.
 */
@Command(
        name = "accessor-gen",
        mixinStandardHelpOptions = true,
        version = "accessor-gen 1.0.0",
        description = "Generates conventionally named CRUD accessors (all, get, get_by, create, update, delete, change) for a schema."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options = new GenerateOptions();

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();
    private final AccessorSourceGenerator generator;

    public GenerateCommand() {
        this(new AccessorSourceGenerator());
    }

    public GenerateCommand(AccessorSourceGenerator generator) {
        this.generator = generator;
    }

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            GeneratorConfig config = GeneratorConfig.builder()
                    .schemaClassName(options.getSchema().trim())
                    .targetPackage(options.getTargetPackage() == null ? null : options.getTargetPackage().trim())
                    .suffixOption(validated.getSuffixOption())
                    .selector(validated.getSelector())
                    .outputDir(validated.getNormalizedOutputDir())
                    .force(options.isForce())
                    .dryRun(options.isDryRun())
                    .build();

            GeneratorResult result = generator.generate(config);
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(result);
            return 0;

        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }
}
