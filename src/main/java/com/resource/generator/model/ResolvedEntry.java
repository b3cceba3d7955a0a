package com.resource.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Generated accessor name plus its {@code name/arity} description.
 */
@Value
public class ResolvedEntry {

    @NonNull
    String name;

    @NonNull
    String description;
}
