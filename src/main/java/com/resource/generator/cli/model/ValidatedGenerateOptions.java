package com.resource.generator.cli.model;

import java.nio.file.Path;

import com.resource.generator.model.Selector;
import com.resource.generator.model.SuffixOption;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Selector selector;
    SuffixOption suffixOption;
    Path normalizedOutputDir;
    Path facadePath;
}
