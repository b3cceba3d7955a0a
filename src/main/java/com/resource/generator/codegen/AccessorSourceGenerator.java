package com.resource.generator.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resource.generator.binding.Changeset;
import com.resource.generator.binding.ResourceAccessor;
import com.resource.generator.binding.ResourceModule;
import com.resource.generator.binding.WriteResult;
import com.resource.generator.codegen.model.FacadeMethod;
import com.resource.generator.codegen.model.output.GeneratedFile;
import com.resource.generator.codegen.util.FileWriteUtil;
import com.resource.generator.codegen.util.ImportManager;
import com.resource.generator.codegen.util.NamingUtil;
import com.resource.generator.model.OperationId;
import com.resource.generator.model.ResolvedEntry;
import com.resource.generator.naming.SuffixResolver;
import com.resource.generator.option.OptionResolver;
import com.resource.generator.option.UnknownOperationException;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a typed Java facade exposing one schema's resolved accessors.
 */
public class AccessorSourceGenerator {

    private static final Logger log = LoggerFactory.getLogger(AccessorSourceGenerator.class);

    private static final String TEMPLATE = "accessor-facade.ftl";
    private static final String OPTIONS = "Map<String, Object> options";

    private final OptionResolver resolver;
    private final Configuration freemarkerConfig;

    public AccessorSourceGenerator() {
        this(new OptionResolver());
    }

    public AccessorSourceGenerator(OptionResolver resolver) {
        this.resolver = resolver;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Resolve, render and (unless dry-running) write the facade.
     */
    public GeneratorResult generate(GeneratorConfig config) {
        String schema = config.getSchemaClassName();
        log.info("Resolving accessors for {} (selector: {}, suffix: {})",
                schema, config.getSelector(), config.getSuffixOption());

        String suffix = SuffixResolver.computeSuffix(schema, config.getSuffixOption());
        Map<OperationId, ResolvedEntry> entries = resolver.resolve(suffix, config.getSelector());
        if (entries.isEmpty()) {
            return GeneratorResult.failure("Selector " + config.getSelector() + " leaves no accessors for " + schema);
        }

        GeneratedFile file;
        try {
            file = render(config, suffix, entries);
        } catch (IOException | TemplateException e) {
            log.error("Failed to render accessor facade for {}", schema, e);
            return GeneratorResult.failure("Failed to render " + TEMPLATE + ": " + e.getMessage());
        }

        Path target = config.getOutputDir() == null
                ? file.getPath()
                : config.getOutputDir().resolve(file.getPath());

        GeneratorResult.GeneratorResultBuilder result = GeneratorResult.builder()
                .success(true)
                .outputPath(target)
                .suffix(suffix)
                .accessorCount(entries.size())
                .source(file.getContents());
        entries.values().forEach(entry -> result.description(entry.getDescription()));

        if (config.isDryRun()) {
            log.info("Dry run: {} not written", target);
            return result.written(false).build();
        }

        if (Files.exists(target) && !config.isForce()) {
            return GeneratorResult.failure("Output file already exists: " + target + ". Use --force to overwrite.");
        }

        try {
            FileWriteUtil.write(config.getOutputDir() == null ? Path.of("") : config.getOutputDir(), file);
        } catch (IOException e) {
            log.error("Failed to write {}", target, e);
            return GeneratorResult.failure("Failed to write " + target + ": " + e.getMessage());
        }

        log.info("Wrote {} accessors to {}", entries.size(), target);
        return result.written(true).build();
    }

    /**
     * Renders the facade source without touching the file system.
     */
    public GeneratedFile render(GeneratorConfig config, String suffix, Map<OperationId, ResolvedEntry> entries)
            throws IOException, TemplateException {
        String packageName = config.getEffectivePackage();
        String schemaType = config.getSchemaSimpleName();

        ImportManager imports = new ImportManager(packageName)
                .add(config.getSchemaClassName())
                .add(Map.class)
                .add(ResourceAccessor.class)
                .add(ResourceModule.class);

        List<FacadeMethod> methods = new ArrayList<>();
        entries.forEach((id, entry) -> methods.add(toFacadeMethod(id, entry, schemaType, imports)));

        Map<String, Object> model = new HashMap<>();
        model.put("packageName", packageName);
        model.put("imports", imports.getImports());
        model.put("schemaSimpleName", schemaType);
        model.put("className", config.getFacadeClassName());
        model.put("suffix", suffix);
        model.put("selector", config.getSelector().toString());
        model.put("methods", methods);

        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        StringWriter out = new StringWriter();
        template.process(model, out);

        return GeneratedFile.builder()
                .path(config.getFacadeRelativePath())
                .contents(out.toString())
                .build();
    }

    FacadeMethod toFacadeMethod(OperationId id, ResolvedEntry entry, String schemaType, ImportManager imports) {
        boolean strict = id.isStrict();
        String single = strict ? schemaType : "Optional<" + schemaType + ">";
        String written = strict ? schemaType : "WriteResult<" + schemaType + ">";
        String target = strict ? id.root() + "OrThrow" : id.root();

        FacadeMethod.FacadeMethodBuilder method = FacadeMethod.builder()
                .javaName(NamingUtil.toJavaMethodName(entry.getName()))
                .accessorName(entry.getName())
                .description(entry.getDescription())
                .strict(strict);

        switch (id.root()) {
            case "all" -> {
                imports.add(List.class);
                method.returnType("List<" + schemaType + ">")
                        .parameters(OPTIONS)
                        .delegateCall("accessor.all(options)");
            }
            case "get" -> {
                if (!strict) {
                    imports.add(Optional.class);
                }
                method.returnType(single)
                        .parameters("Object id, " + OPTIONS)
                        .delegateCall("accessor." + target + "(id, options)");
            }
            case "get_by" -> {
                if (!strict) {
                    imports.add(Optional.class);
                }
                method.returnType(single)
                        .parameters("Map<String, Object> clauses, " + OPTIONS)
                        .delegateCall("accessor." + (strict ? "getByOrThrow" : "getBy") + "(clauses, options)");
            }
            case "create" -> {
                addWriteResult(strict, imports);
                method.returnType(written)
                        .parameters("Map<String, Object> attributes")
                        .delegateCall("accessor." + target + "(attributes)");
            }
            case "update" -> {
                addWriteResult(strict, imports);
                method.returnType(written)
                        .parameters(schemaType + " resource, Map<String, Object> attributes")
                        .delegateCall("accessor." + target + "(resource, attributes)");
            }
            case "delete" -> {
                addWriteResult(strict, imports);
                method.returnType(written)
                        .parameters(schemaType + " resource")
                        .delegateCall("accessor." + target + "(resource)");
            }
            case "change" -> {
                imports.add(Changeset.class);
                method.returnType("Changeset<" + schemaType + ">")
                        .parameters(schemaType + " resource")
                        .delegateCall("accessor.change(resource)");
            }
            default -> throw new UnknownOperationException(id);
        }
        return method.build();
    }

    private static void addWriteResult(boolean strict, ImportManager imports) {
        if (!strict) {
            imports.add(WriteResult.class);
        }
    }
}
