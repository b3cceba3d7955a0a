package com.resource.generator.binding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resource.generator.model.OperationId;
import com.resource.generator.model.OperationSpec;
import com.resource.generator.model.ResolvedEntry;
import com.resource.generator.naming.SuffixResolver;
import com.resource.generator.option.OptionResolver;
import com.resource.generator.option.UnknownOperationException;

/**
 * The accessors resolved for one schema, bound to that schema's store.
 *
 * Non-strict operations return {@link Optional} or {@link WriteResult}; their
 * strict counterparts unwrap the value or throw. Calling an operation the
 * selector filtered out fails with {@link UnsupportedOperationException}.
 */
public class ResourceAccessor<T> {

    private static final Logger log = LoggerFactory.getLogger(ResourceAccessor.class);

    private final Class<T> schema;
    private final String suffix;
    private final ResourceStore<T> store;
    private final OptionResolver resolver;
    private final Map<OperationId, ResolvedEntry> entries;
    private final Map<String, OperationId> operationsByName;

    private ResourceAccessor(Class<T> schema, String suffix, ResourceStore<T> store, OptionResolver resolver,
                             Map<OperationId, ResolvedEntry> entries) {
        this.schema = schema;
        this.suffix = suffix;
        this.store = store;
        this.resolver = resolver;
        this.entries = entries;

        Map<String, OperationId> byName = new LinkedHashMap<>();
        entries.forEach((id, entry) -> byName.put(entry.getName(), id));
        this.operationsByName = Collections.unmodifiableMap(byName);
    }

    public static <T> ResourceAccessor<T> bind(Class<T> schema, ResourceOptions options, ResourceStore<T> store,
                                               OptionResolver resolver) {
        if (store == null) {
            throw new IllegalArgumentException("No store available for " + schema.getName());
        }
        String suffix = SuffixResolver.computeSuffix(schema, options.getSuffixOption());
        Map<OperationId, ResolvedEntry> entries = resolver.resolve(suffix, options.getSelector());
        log.debug("Bound {} accessors for {}: {}", entries.size(), schema.getSimpleName(), entries.keySet());
        return new ResourceAccessor<>(schema, suffix, store, resolver, entries);
    }

    public Class<T> getSchema() {
        return schema;
    }

    public String getSuffix() {
        return suffix;
    }

    public Map<OperationId, ResolvedEntry> getEntries() {
        return entries;
    }

    /**
     * Generated names, in catalog order.
     */
    public List<String> names() {
        return List.copyOf(operationsByName.keySet());
    }

    /**
     * {@code name/arity} descriptions, in catalog order.
     */
    public List<String> descriptions() {
        return entries.values().stream()
                .map(ResolvedEntry::getDescription)
                .toList();
    }

    public boolean hasAccessor(String name) {
        return operationsByName.containsKey(name);
    }

    // ---- list / read ----

    public List<T> all(Map<String, Object> options) {
        require("all");
        return store.all(options);
    }

    public Optional<T> get(Object id, Map<String, Object> options) {
        require("get");
        return store.get(id, options);
    }

    public T getOrThrow(Object id, Map<String, Object> options) {
        String name = require("get!");
        return store.get(id, options)
                .orElseThrow(() -> new ResourceNotFoundException(
                        name + ": no " + schema.getSimpleName() + " with id " + id));
    }

    public Optional<T> getBy(Map<String, Object> clauses, Map<String, Object> options) {
        require("get_by");
        return store.getBy(clauses, options);
    }

    public T getByOrThrow(Map<String, Object> clauses, Map<String, Object> options) {
        String name = require("get_by!");
        return store.getBy(clauses, options)
                .orElseThrow(() -> new ResourceNotFoundException(
                        name + ": no " + schema.getSimpleName() + " matching " + clauses));
    }

    // ---- write ----

    public WriteResult<T> create(Map<String, Object> attributes) {
        require("create");
        return store.insert(attributes);
    }

    public T createOrThrow(Map<String, Object> attributes) {
        String name = require("create!");
        return unwrap(name, store.insert(attributes));
    }

    public WriteResult<T> update(T resource, Map<String, Object> attributes) {
        require("update");
        return store.update(resource, attributes);
    }

    public T updateOrThrow(T resource, Map<String, Object> attributes) {
        String name = require("update!");
        return unwrap(name, store.update(resource, attributes));
    }

    public WriteResult<T> delete(T resource) {
        require("delete");
        return store.delete(resource);
    }

    public T deleteOrThrow(T resource) {
        String name = require("delete!");
        return unwrap(name, store.delete(resource));
    }

    public Changeset<T> change(T resource) {
        require("change");
        return store.change(resource);
    }

    // ---- dynamic dispatch ----

    /**
     * Calls an accessor by its generated name, e.g. {@code invoke("create_user!", attrs)}.
     */
    public Object invoke(String name, Object... args) {
        OperationId id = operationsByName.get(name);
        if (id == null) {
            throw new IllegalArgumentException(schema.getSimpleName() + " has no accessor named " + name);
        }
        OperationSpec spec = resolver.getCatalog().find(id)
                .orElseThrow(() -> new UnknownOperationException(id));
        Object[] actual = args == null ? new Object[0] : args;
        if (actual.length != spec.getArity()) {
            throw new AccessorArityException(entries.get(id).getDescription(), actual.length);
        }

        return switch (id.getValue()) {
            case "all" -> all(map(actual[0]));
            case "get" -> get(actual[0], map(actual[1]));
            case "get!" -> getOrThrow(actual[0], map(actual[1]));
            case "get_by" -> getBy(map(actual[0]), map(actual[1]));
            case "get_by!" -> getByOrThrow(map(actual[0]), map(actual[1]));
            case "create" -> create(map(actual[0]));
            case "create!" -> createOrThrow(map(actual[0]));
            case "update" -> update(schema.cast(actual[0]), map(actual[1]));
            case "update!" -> updateOrThrow(schema.cast(actual[0]), map(actual[1]));
            case "delete" -> delete(schema.cast(actual[0]));
            case "delete!" -> deleteOrThrow(schema.cast(actual[0]));
            case "change" -> change(schema.cast(actual[0]));
            default -> throw new UnknownOperationException(id);
        };
    }

    private String require(String operation) {
        OperationId id = OperationId.of(operation);
        ResolvedEntry entry = entries.get(id);
        if (entry == null) {
            String name = resolver.derive(id, suffix).getName();
            throw new UnsupportedOperationException(name + " is not exposed for " + schema.getSimpleName());
        }
        return entry.getName();
    }

    private T unwrap(String name, WriteResult<T> result) {
        if (result.isOk()) {
            return result.getValue();
        }
        throw new InvalidChangesetException(name, result.getChangeset());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object arg) {
        if (arg == null) {
            return Map.of();
        }
        if (!(arg instanceof Map)) {
            throw new IllegalArgumentException("Expected a map argument but got " + arg.getClass().getName());
        }
        return (Map<String, Object>) arg;
    }
}
