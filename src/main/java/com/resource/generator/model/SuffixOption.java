package com.resource.generator.model;

/**
 * Whether generated names carry the schema-derived suffix.
 */
public enum SuffixOption {
    ENABLED,
    DISABLED
}
