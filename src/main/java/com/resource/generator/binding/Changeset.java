package com.resource.generator.binding;

import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Pending changes to a resource, together with any validation errors the store
 * attached to them.
 */
@Value
@Builder(toBuilder = true)
public class Changeset<T> {

    T data;

    @Singular
    Map<String, Object> changes;

    @Singular
    Map<String, String> errors;

    public static <T> Changeset<T> of(T data) {
        return Changeset.<T>builder().data(data).build();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
