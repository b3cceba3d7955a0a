package com.resource.generator.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * One catalog entry: an operation id and its declared arity.
 *
 * The arity excludes the repository argument used by the storage layer.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationSpec {

    @NonNull
    OperationId id;

    int arity;

    public static OperationSpec of(String id, int arity) {
        if (arity < 0) {
            throw new IllegalArgumentException("Arity must be >= 0 for " + id + ". Got: " + arity);
        }
        return new OperationSpec(OperationId.of(id), arity);
    }
}
