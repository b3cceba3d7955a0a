package com.resource.generator.binding;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage primitives for one schema, implemented by the host application.
 *
 * Generated accessors only forward to these methods; strict variants are
 * layered on top by {@link ResourceAccessor}.
 */
public interface ResourceStore<T> {

    List<T> all(Map<String, Object> options);

    Optional<T> get(Object id, Map<String, Object> options);

    Optional<T> getBy(Map<String, Object> clauses, Map<String, Object> options);

    WriteResult<T> insert(Map<String, Object> attributes);

    WriteResult<T> update(T resource, Map<String, Object> attributes);

    WriteResult<T> delete(T resource);

    Changeset<T> change(T resource);
}
