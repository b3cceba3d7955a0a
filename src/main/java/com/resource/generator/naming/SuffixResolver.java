package com.resource.generator.naming;

import com.resource.generator.codegen.util.NamingUtil;
import com.resource.generator.model.SuffixOption;

import lombok.experimental.UtilityClass;

/**
 * Computes the suffix carried by a schema's generated accessor names.
 */
@UtilityClass
public class SuffixResolver {

    /**
     * Returns {@code ""} when suffixing is disabled, otherwise the snake form of
     * the schema's simple name ({@code com.example.BlogPost} -> {@code blog_post}).
     */
    public static String computeSuffix(String schemaIdentifier, SuffixOption option) {
        if (option == SuffixOption.DISABLED) {
            return "";
        }
        if (schemaIdentifier == null || schemaIdentifier.isBlank()) {
            throw new IllegalArgumentException("Schema identifier is required to compute a suffix");
        }
        return toSuffix(NamingUtil.simpleName(schemaIdentifier), schemaIdentifier);
    }

    public static String computeSuffix(Class<?> schema, SuffixOption option) {
        if (option == SuffixOption.DISABLED) {
            return "";
        }
        if (schema == null) {
            throw new IllegalArgumentException("Schema class is required to compute a suffix");
        }
        return toSuffix(schema.getSimpleName(), schema.getName());
    }

    private static String toSuffix(String simpleName, String schema) {
        if (simpleName == null || simpleName.isBlank()) {
            throw new IllegalArgumentException("Schema " + schema + " has no simple name to derive a suffix from");
        }
        return NamingUtil.toSnakeCase(simpleName);
    }
}
