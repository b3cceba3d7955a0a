package com.resource.generator.binding;

import java.util.HashMap;
import java.util.Map;

/**
 * Repository fixture handing out pre-registered stores per schema.
 */
class InMemoryRepository implements ResourceRepository {

    private final Map<Class<?>, ResourceStore<?>> stores = new HashMap<>();

    <T> InMemoryRepository with(Class<T> schema, ResourceStore<T> store) {
        stores.put(schema, store);
        return this;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> ResourceStore<T> storeFor(Class<T> schema) {
        return (ResourceStore<T>) stores.get(schema);
    }
}
