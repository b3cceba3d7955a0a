package com.resource.generator.binding;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a store write: the persisted value, or the rejected changeset.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WriteResult<T> {

    boolean ok;
    T value;
    Changeset<T> changeset;

    public static <T> WriteResult<T> ok(T value) {
        return new WriteResult<>(true, value, null);
    }

    public static <T> WriteResult<T> error(Changeset<T> changeset) {
        if (changeset == null) {
            throw new IllegalArgumentException("An error result needs the rejected changeset");
        }
        return new WriteResult<>(false, null, changeset);
    }

    public Optional<T> toOptional() {
        return ok ? Optional.ofNullable(value) : Optional.empty();
    }
}
