package com.resource.generator.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.resource.generator.cli.exception.OptionsValidationException;
import com.resource.generator.cli.model.GenerateOptions;
import com.resource.generator.cli.model.ValidatedGenerateOptions;
import com.resource.generator.cli.validation.GenerateOptionsValidator;
import com.resource.generator.model.Selector;
import com.resource.generator.model.SuffixOption;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GenerateOptionsValidator.
 */
class GenerateOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();

    @Test
    void testValidOptions() {
        ValidatedGenerateOptions validated = validator.validate(parse(
                "--schema", "com.example.User", "--selector", "read", "--no-suffix", "-o", tempDir.toString()));

        assertThat(validated.getSelector()).isEqualTo(Selector.read());
        assertThat(validated.getSuffixOption()).isEqualTo(SuffixOption.DISABLED);
        assertThat(validated.getFacadePath()).isEqualTo(tempDir.resolve("com/example/UserAccessors.java"));
    }

    @Test
    void testOnlyAndExceptOptions() {
        assertThat(validator.validate(parse("-s", "com.example.User", "--only", "create,create!",
                "-o", tempDir.toString())).getSelector())
                .isEqualTo(Selector.only("create", "create!"));
        assertThat(validator.validate(parse("-s", "com.example.User", "--except", "delete!",
                "-o", tempDir.toString())).getSelector())
                .isEqualTo(Selector.except("delete!"));
    }

    @Test
    void testDefaultsToAllSelector() {
        assertThat(validator.validate(parse("-s", "com.example.User", "-o", tempDir.toString())).getSelector())
                .isEqualTo(Selector.all());
    }

    @Test
    void testCollectsEveryError() {
        assertThatThrownBy(() -> validator.validate(parse(
                "--schema", "com.example.", "--package", "not a package", "--only", "get", "--except", "delete")))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .hasSize(3)
                        .anyMatch(error -> error.contains("Schema must be"))
                        .anyMatch(error -> error.contains("Package must be"))
                        .anyMatch(error -> error.contains("only one of")));
    }

    @Test
    void testMissingSchema() {
        assertThatThrownBy(() -> validator.validate(parse("--selector", "read")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--schema");
    }

    @Test
    void testUnrecognizedSelector() {
        assertThatThrownBy(() -> validator.validate(parse("-s", "com.example.User", "--selector", "write")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Unrecognized selector 'write'");
    }

    @Test
    void testExistingFacadeNeedsForce() throws IOException {
        Path facade = tempDir.resolve("com/example/UserAccessors.java");
        Files.createDirectories(facade.getParent());
        Files.writeString(facade, "");

        assertThatThrownBy(() -> validator.validate(parse("-s", "com.example.User", "-o", tempDir.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--force");
        assertThat(validator.validate(parse("-s", "com.example.User", "-o", tempDir.toString(), "-f")))
                .isNotNull();
        assertThat(validator.validate(parse("-s", "com.example.User", "-o", tempDir.toString(), "--dry-run")))
                .isNotNull();
    }

    private static GenerateOptions parse(String... args) {
        GenerateOptions options = new GenerateOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
