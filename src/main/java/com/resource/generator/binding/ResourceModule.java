package com.resource.generator.binding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resource.generator.option.OptionResolver;

/**
 * Host module grouping several resources that share one repository.
 *
 * Accessor names must be unique across the module; registering a schema whose
 * names clash with an earlier one fails with {@link DuplicateAccessorException}.
 * Schemas are listed by simple name, so two schemas sharing one are rejected.
 * A built module is immutable.
 */
public class ResourceModule {

    private static final Logger log = LoggerFactory.getLogger(ResourceModule.class);

    private final Map<Class<?>, ResourceAccessor<?>> accessors;
    private final Map<String, ResourceAccessor<?>> accessorsByName;

    private ResourceModule(Map<Class<?>, ResourceAccessor<?>> accessors,
                           Map<String, ResourceAccessor<?>> accessorsByName) {
        this.accessors = Collections.unmodifiableMap(accessors);
        this.accessorsByName = Collections.unmodifiableMap(accessorsByName);
    }

    public static Builder builder(ResourceRepository repository) {
        return new Builder(repository, new OptionResolver());
    }

    public static Builder builder(ResourceRepository repository, OptionResolver resolver) {
        return new Builder(repository, resolver);
    }

    @SuppressWarnings("unchecked")
    public <T> ResourceAccessor<T> accessor(Class<T> schema) {
        ResourceAccessor<?> accessor = accessors.get(schema);
        if (accessor == null) {
            throw new IllegalArgumentException(schema.getName() + " is not registered in this module");
        }
        return (ResourceAccessor<T>) accessor;
    }

    /**
     * Calls the accessor with the given generated name on whichever resource owns it.
     */
    public Object invoke(String name, Object... args) {
        ResourceAccessor<?> accessor = accessorsByName.get(name);
        if (accessor == null) {
            throw new IllegalArgumentException("No accessor named " + name + " in this module");
        }
        return accessor.invoke(name, args);
    }

    /**
     * Description strings of one registered schema, e.g. {@code [all_users/1, get_user/2]}.
     */
    public List<String> describe(Class<?> schema) {
        return accessor(schema).descriptions();
    }

    /**
     * Description strings of every registered schema, keyed by simple name, in registration order.
     */
    public Map<String, List<String>> resources() {
        Map<String, List<String>> listing = new LinkedHashMap<>();
        accessors.forEach((schema, accessor) -> listing.put(schema.getSimpleName(), accessor.descriptions()));
        return Collections.unmodifiableMap(listing);
    }

    public List<String> names() {
        return List.copyOf(accessorsByName.keySet());
    }

    public static class Builder {

        private final ResourceRepository repository;
        private final OptionResolver resolver;
        private final Map<Class<?>, ResourceAccessor<?>> accessors = new LinkedHashMap<>();
        private final Map<String, ResourceAccessor<?>> accessorsByName = new LinkedHashMap<>();

        private Builder(ResourceRepository repository, OptionResolver resolver) {
            if (repository == null) {
                throw new IllegalArgumentException("A repository is required");
            }
            if (resolver == null) {
                throw new IllegalArgumentException("An option resolver is required");
            }
            this.repository = repository;
            this.resolver = resolver;
        }

        public Builder resource(Class<?> schema) {
            return resource(schema, ResourceOptions.defaults());
        }

        public Builder resource(Class<?> schema, ResourceOptions options) {
            if (accessors.containsKey(schema)) {
                throw new IllegalArgumentException(schema.getName() + " is already registered");
            }
            for (Class<?> registered : accessors.keySet()) {
                if (registered.getSimpleName().equals(schema.getSimpleName())) {
                    throw new IllegalArgumentException(schema.getName() + " has the same simple name as "
                            + registered.getName() + ", which is already registered");
                }
            }
            ResourceAccessor<?> accessor = bind(schema, options);

            List<String> clashes = new ArrayList<>();
            for (String name : accessor.names()) {
                if (accessorsByName.containsKey(name)) {
                    clashes.add(name);
                }
            }
            if (!clashes.isEmpty()) {
                throw new DuplicateAccessorException(schema.getSimpleName(), clashes);
            }

            accessors.put(schema, accessor);
            accessor.names().forEach(name -> accessorsByName.put(name, accessor));
            log.info("Registered {} with {} accessors (selector: {})",
                    schema.getSimpleName(), accessor.names().size(), options.getSelector());
            return this;
        }

        public ResourceModule build() {
            return new ResourceModule(new LinkedHashMap<>(accessors), new LinkedHashMap<>(accessorsByName));
        }

        private <T> ResourceAccessor<T> bind(Class<T> schema, ResourceOptions options) {
            return ResourceAccessor.bind(schema, options, repository.storeFor(schema), resolver);
        }
    }
}
