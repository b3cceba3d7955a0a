package com.resource.generator.codegen;

import java.nio.file.Path;

import com.resource.generator.codegen.util.NamingUtil;
import com.resource.generator.model.Selector;
import com.resource.generator.model.SuffixOption;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for generating one schema's accessor facade.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Fully-qualified schema class name, e.g. com.example.blog.BlogPost.
     */
    private String schemaClassName;

    /**
     * Package of the generated facade. Defaults to the schema's package.
     */
    private String targetPackage;

    @Builder.Default
    private SuffixOption suffixOption = SuffixOption.ENABLED;

    @Builder.Default
    private Selector selector = Selector.all();

    /**
     * Root source directory the facade is written below.
     */
    private Path outputDir;

    private boolean force;

    /**
     * Resolve and render only; nothing is written.
     */
    private boolean dryRun;

    public String getSchemaSimpleName() {
        return NamingUtil.simpleName(schemaClassName);
    }

    public String getEffectivePackage() {
        if (targetPackage != null && !targetPackage.isBlank()) {
            return targetPackage;
        }
        return NamingUtil.packageName(schemaClassName);
    }

    public String getFacadeClassName() {
        return getSchemaSimpleName() + "Accessors";
    }

    /**
     * Facade location relative to the output directory.
     */
    public Path getFacadeRelativePath() {
        String pkg = getEffectivePackage();
        Path dir = pkg.isEmpty() ? Path.of("") : Path.of(pkg.replace('.', '/'));
        return dir.resolve(getFacadeClassName() + ".java");
    }
}
