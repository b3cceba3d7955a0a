package com.resource.generator.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Ordered, immutable universe of supported accessor operations.
 *
 * Order follows the literal table and has no effect on resolved names.
 */
@ToString
@EqualsAndHashCode
public final class OperationCatalog {

    private static final OperationCatalog STANDARD = OperationCatalog.of(
            OperationSpec.of("update!", 2),
            OperationSpec.of("update", 2),
            OperationSpec.of("get_by!", 2),
            OperationSpec.of("get_by", 2),
            OperationSpec.of("get!", 2),
            OperationSpec.of("get", 2),
            OperationSpec.of("delete!", 1),
            OperationSpec.of("delete", 1),
            OperationSpec.of("create!", 1),
            OperationSpec.of("create", 1),
            OperationSpec.of("change", 1),
            OperationSpec.of("all", 1));

    private final List<OperationSpec> operations;

    private OperationCatalog(List<OperationSpec> operations) {
        this.operations = List.copyOf(operations);
    }

    /**
     * The catalog shipped with the generator.
     */
    public static OperationCatalog standard() {
        return STANDARD;
    }

    public static OperationCatalog of(OperationSpec... operations) {
        return of(Arrays.asList(operations));
    }

    public static OperationCatalog of(List<OperationSpec> operations) {
        Set<OperationId> seen = new LinkedHashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (OperationSpec spec : operations) {
            if (spec == null) {
                throw new IllegalArgumentException("Catalog entries must not be null");
            }
            if (!seen.add(spec.getId())) {
                duplicates.add(spec.getId().getValue());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new IllegalArgumentException("Duplicate operation ids in catalog: " + duplicates);
        }
        return new OperationCatalog(operations);
    }

    public List<OperationSpec> getOperations() {
        return operations;
    }

    public Set<OperationId> ids() {
        Set<OperationId> ids = new LinkedHashSet<>();
        operations.forEach(spec -> ids.add(spec.getId()));
        return ids;
    }

    public Optional<OperationSpec> find(OperationId id) {
        return operations.stream()
                .filter(spec -> spec.getId().equals(id))
                .findFirst();
    }

    public boolean contains(OperationId id) {
        return find(id).isPresent();
    }

    public int size() {
        return operations.size();
    }
}
