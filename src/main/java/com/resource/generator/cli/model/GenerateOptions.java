package com.resource.generator.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the accessor generator. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--schema", "-s" }, description = "Fully-qualified schema class name, e.g. com.example.blog.BlogPost")
	private String schema;

	@Option(names = { "--package", "-p" }, description = "Package of the generated facade (defaults to the schema's package)")
	private String targetPackage;

	@Option(names = { "--no-suffix" }, description = "Use bare operation names (create, get_by!) instead of suffixed ones")
	private boolean noSuffix;

	@Option(names = { "--selector" }, description = "Operations to expose: all, read, read_write, only:<ids> or except:<ids>")
	private String selector;

	@Option(names = { "--only" }, description = "Comma-separated operation ids to expose, e.g. create,create!,get")
	private String only;

	@Option(names = { "--except" }, description = "Comma-separated operation ids to leave out, e.g. delete,delete!")
	private String except;

	@Option(names = { "--output-dir", "-o" }, description = "Source root the facade is written below (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing facade")
	private boolean force;

	@Option(names = { "--dry-run" }, description = "Log the resolved accessors without writing anything")
	private boolean dryRun;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
