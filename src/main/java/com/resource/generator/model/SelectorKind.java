package com.resource.generator.model;

/**
 * Shapes a {@link Selector} can take.
 */
public enum SelectorKind {
    /**
     * No filtering.
     */
    ALL,

    /**
     * Read-only preset: list, get and get-by with their strict variants.
     */
    READ,

    /**
     * The read preset plus change, create and update with their strict variants.
     */
    READ_WRITE,

    /**
     * Keep only the listed ids.
     */
    ONLY,

    /**
     * Keep everything except the listed ids.
     */
    EXCEPT
}
