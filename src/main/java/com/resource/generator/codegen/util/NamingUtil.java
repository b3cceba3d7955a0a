package com.resource.generator.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Utility for converting between schema, accessor and Java naming conventions.
 */
public class NamingUtil {

    private static final Pattern JAVA_IDENTIFIER = Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*$");
    private static final String STRICT_METHOD_SUFFIX = "OrThrow";

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts PascalCase or camelCase to lower snake_case.
     * Acronyms stay together: HTTPRequest -> http_request.
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        String result = name.replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2");
        result = result.replaceAll("([a-z\\d])([A-Z])", "$1_$2");
        result = result.replaceAll("[-\\s.]+", "_");
        return result.toLowerCase(Locale.ROOT);
    }

    /**
     * Converts an accessor name to a Java method name.
     * The strict bang becomes an OrThrow suffix: get_user_by! -> getUserByOrThrow.
     */
    public static String toJavaMethodName(String accessorName) {
        if (accessorName == null || accessorName.isEmpty()) {
            return accessorName;
        }
        boolean strict = accessorName.endsWith("!");
        String base = strict ? accessorName.substring(0, accessorName.length() - 1) : accessorName;
        String camel = toCamelCase(base);
        return strict ? camel + STRICT_METHOD_SUFFIX : camel;
    }

    /**
     * Converts snake_name to camelCase.
     */
    public static String toCamelCase(String name) {
        String pascal = toPascalCase(name);
        if (pascal == null || pascal.isEmpty()) {
            return pascal;
        }
        return pascal.substring(0, 1).toLowerCase(Locale.ROOT) + pascal.substring(1);
    }

    /**
     * Converts snake_name or kebab-name to PascalCase.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder();
        Arrays.stream(name.split("[-_]"))
                .filter(part -> !part.isEmpty())
                .forEach(part -> sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1)));
        return sb.toString();
    }

    /**
     * Last segment of a qualified class name, nested classes included: a.b.Outer$Inner -> Inner.
     */
    public static String simpleName(String qualifiedName) {
        int cut = Math.max(qualifiedName.lastIndexOf('.'), qualifiedName.lastIndexOf('$'));
        return qualifiedName.substring(cut + 1);
    }

    /**
     * Package of a qualified class name, or "" for the default package.
     */
    public static String packageName(String qualifiedName) {
        int cut = qualifiedName.lastIndexOf('.');
        return cut < 0 ? "" : qualifiedName.substring(0, cut);
    }

    public static boolean isJavaIdentifier(String name) {
        return name != null && JAVA_IDENTIFIER.matcher(name).matches();
    }

    /**
     * True for dotted names whose every segment is a Java identifier.
     */
    public static boolean isQualifiedName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        return Arrays.stream(name.split("\\.", -1)).allMatch(NamingUtil::isJavaIdentifier);
    }
}
