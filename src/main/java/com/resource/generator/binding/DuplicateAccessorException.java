package com.resource.generator.binding;

import java.util.List;

/**
 * Two resources in one module resolved to the same accessor name.
 */
public class DuplicateAccessorException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> names;

    public DuplicateAccessorException(String schema, List<String> names) {
        super("Accessors for " + schema + " clash with already registered names: " + names
                + ". Register the schema with a suffix or a narrower selector.");
        this.names = List.copyOf(names);
    }

    public List<String> getNames() {
        return names;
    }
}
