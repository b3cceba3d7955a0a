package com.resource.generator.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Which catalog operations a resource exposes.
 *
 * Ids are matched exactly: selecting {@code create} does not pull in
 * {@code create!}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Selector {

    private static final Selector ALL = new Selector(SelectorKind.ALL, Set.of());
    private static final Selector READ = new Selector(SelectorKind.READ, Set.of());
    private static final Selector READ_WRITE = new Selector(SelectorKind.READ_WRITE, Set.of());

    @NonNull
    SelectorKind kind;

    /**
     * Target ids; empty unless the kind is ONLY or EXCEPT.
     */
    @NonNull
    Set<OperationId> ids;

    public static Selector all() {
        return ALL;
    }

    public static Selector read() {
        return READ;
    }

    public static Selector readWrite() {
        return READ_WRITE;
    }

    public static Selector only(String... ids) {
        return only(toIds(Arrays.asList(ids)));
    }

    public static Selector only(Collection<OperationId> ids) {
        return new Selector(SelectorKind.ONLY, copy(ids));
    }

    public static Selector except(String... ids) {
        return except(toIds(Arrays.asList(ids)));
    }

    public static Selector except(Collection<OperationId> ids) {
        return new Selector(SelectorKind.EXCEPT, copy(ids));
    }

    private static Set<OperationId> toIds(Collection<String> raw) {
        return raw.stream()
                .map(OperationId::of)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Set<OperationId> copy(Collection<OperationId> ids) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ALL -> "all";
            case READ -> "read";
            case READ_WRITE -> "read_write";
            case ONLY, EXCEPT -> kind.name().toLowerCase() + ":" + ids.stream()
                    .map(OperationId::getValue)
                    .collect(Collectors.joining(","));
        };
    }
}
