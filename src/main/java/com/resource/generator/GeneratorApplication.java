package com.resource.generator;

import com.resource.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Resource Accessor Generator.
 * This CLI tool resolves the CRUD accessors of a schema and writes a typed Java
 * facade that forwards them to a storage repository.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
