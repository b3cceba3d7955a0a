package com.resource.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.resource.generator.cli.exception.OptionsValidationException;
import com.resource.generator.cli.model.GenerateOptions;
import com.resource.generator.cli.model.ValidatedGenerateOptions;
import com.resource.generator.codegen.GeneratorConfig;
import com.resource.generator.codegen.util.NamingUtil;
import com.resource.generator.model.Selector;
import com.resource.generator.model.SuffixOption;
import com.resource.generator.option.InvalidSelectorException;
import com.resource.generator.option.SelectorParser;

public class GenerateOptionsValidator {

	private final SelectorParser selectorParser = new SelectorParser();

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (isBlank(o.getSchema())) {
			errors.add("Schema class name is required (--schema / -s).");
		} else if (!NamingUtil.isQualifiedName(o.getSchema().trim())) {
			errors.add("Schema must be a Java class name such as com.example.User. Got: " + o.getSchema());
		}

		if (!isBlank(o.getTargetPackage()) && !NamingUtil.isQualifiedName(o.getTargetPackage().trim())) {
			errors.add("Package must be a dotted Java package name. Got: " + o.getTargetPackage());
		}

		Selector selector = resolveSelector(o, errors);
		SuffixOption suffixOption = o.isNoSuffix() ? SuffixOption.DISABLED : SuffixOption.ENABLED;

		// Normalize output dir and compute the facade location
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		Path facadePath = null;
		if (errors.isEmpty()) {
			GeneratorConfig probe = GeneratorConfig.builder()
					.schemaClassName(o.getSchema().trim())
					.targetPackage(isBlank(o.getTargetPackage()) ? null : o.getTargetPackage().trim())
					.build();
			facadePath = normalizedOutputDir.resolve(probe.getFacadeRelativePath()).normalize();

			if (Files.exists(facadePath) && !o.isForce() && !o.isDryRun()) {
				errors.add("Output file already exists: " + facadePath + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(selector, suffixOption, normalizedOutputDir, facadePath);
	}

	private Selector resolveSelector(GenerateOptions o, List<String> errors) {
		int given = (isBlank(o.getSelector()) ? 0 : 1) + (isBlank(o.getOnly()) ? 0 : 1)
				+ (isBlank(o.getExcept()) ? 0 : 1);
		if (given > 1) {
			errors.add("Use only one of --selector, --only and --except.");
			return null;
		}

		try {
			if (!isBlank(o.getOnly())) {
				return Selector.only(selectorParser.parseIds(o.getOnly()));
			}
			if (!isBlank(o.getExcept())) {
				return Selector.except(selectorParser.parseIds(o.getExcept()));
			}
			return selectorParser.parse(o.getSelector());
		} catch (InvalidSelectorException e) {
			errors.add(e.getMessage());
			return null;
		}
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
