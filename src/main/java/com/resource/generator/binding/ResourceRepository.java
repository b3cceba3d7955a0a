package com.resource.generator.binding;

/**
 * A storage backend shared by every resource registered in one {@link ResourceModule}.
 */
public interface ResourceRepository {

    <T> ResourceStore<T> storeFor(Class<T> schema);
}
