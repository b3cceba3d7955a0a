package com.resource.generator.codegen.util;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the imports of one generated class, sorted and de-duplicated.
 */
public class ImportManager {

    private final Set<String> imports = new TreeSet<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage == null ? "" : currentPackage;
    }

    /**
     * Adds an import unless the type lives in java.lang, in the default package
     * or in the class's own package.
     */
    public ImportManager add(String qualifiedName) {
        if (qualifiedName == null || qualifiedName.isEmpty()) {
            return this;
        }
        String packageName = NamingUtil.packageName(qualifiedName);
        if (packageName.isEmpty() || packageName.equals("java.lang") || packageName.equals(currentPackage)) {
            return this;
        }
        imports.add(qualifiedName);
        return this;
    }

    public ImportManager add(Class<?> type) {
        return add(type.getName());
    }

    public List<String> getImports() {
        return List.copyOf(imports);
    }
}
