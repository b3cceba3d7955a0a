package com.resource.generator.binding;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Map-backed {@link ResourceStore} that rejects blank required fields.
 */
class InMemoryStore<T extends TestEntity> implements ResourceStore<T> {

    private final Supplier<T> factory;
    private final List<String> requiredFields;
    private final Map<Long, T> rows = new LinkedHashMap<>();
    private long nextId = 1;

    InMemoryStore(Supplier<T> factory, String... requiredFields) {
        this.factory = factory;
        this.requiredFields = List.of(requiredFields);
    }

    @Override
    public List<T> all(Map<String, Object> options) {
        return List.copyOf(rows.values());
    }

    @Override
    public Optional<T> get(Object id, Map<String, Object> options) {
        if (!(id instanceof Number)) {
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(((Number) id).longValue()));
    }

    @Override
    public Optional<T> getBy(Map<String, Object> clauses, Map<String, Object> options) {
        return rows.values().stream()
                .filter(row -> clauses.entrySet().stream()
                        .allMatch(clause -> Objects.equals(row.get(clause.getKey()), clause.getValue())))
                .findFirst();
    }

    @Override
    public WriteResult<T> insert(Map<String, Object> attributes) {
        T row = factory.get();
        Changeset<T> changeset = validate(row, attributes);
        if (!changeset.isValid()) {
            return WriteResult.error(changeset);
        }
        row.putAll(attributes);
        row.setId(nextId++);
        rows.put(row.getId(), row);
        return WriteResult.ok(row);
    }

    @Override
    public WriteResult<T> update(T resource, Map<String, Object> attributes) {
        Changeset<T> changeset = validate(resource, attributes);
        if (!changeset.isValid()) {
            return WriteResult.error(changeset);
        }
        resource.putAll(attributes);
        return WriteResult.ok(resource);
    }

    @Override
    public WriteResult<T> delete(T resource) {
        if (resource.getId() == null || rows.remove(resource.getId()) == null) {
            return WriteResult.error(Changeset.<T>builder()
                    .data(resource)
                    .error("id", "does not exist")
                    .build());
        }
        return WriteResult.ok(resource);
    }

    @Override
    public Changeset<T> change(T resource) {
        return Changeset.of(resource);
    }

    int size() {
        return rows.size();
    }

    private Changeset<T> validate(T row, Map<String, Object> attributes) {
        Map<String, Object> merged = new HashMap<>();
        for (String field : requiredFields) {
            merged.put(field, row.get(field));
        }
        merged.putAll(attributes);

        Changeset.ChangesetBuilder<T> changeset = Changeset.<T>builder()
                .data(row)
                .changes(attributes);
        for (String field : requiredFields) {
            Object value = merged.get(field);
            if (value == null || value.toString().isBlank()) {
                changeset.error(field, "can't be blank");
            }
        }
        return changeset.build();
    }
}
