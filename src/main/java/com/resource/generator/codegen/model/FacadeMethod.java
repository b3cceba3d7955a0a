package com.resource.generator.codegen.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One method of a generated accessor facade, pre-rendered for the template.
 */
@Value
@Builder
public class FacadeMethod {

    @NonNull
    String javaName;

    @NonNull
    String accessorName;

    @NonNull
    String description;

    @NonNull
    String returnType;

    @NonNull
    String parameters;

    @NonNull
    String delegateCall;

    boolean strict;
}
