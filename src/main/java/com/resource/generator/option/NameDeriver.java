package com.resource.generator.option;

import com.resource.generator.model.AccessorName;
import com.resource.generator.model.OperationId;
import com.resource.generator.model.ResolvedEntry;
import com.resource.generator.naming.Pluralizer;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Derives the generated name and description of one operation.
 *
 * Rules, first match wins:
 * <ol>
 * <li>empty suffix: the bare operation id</li>
 * <li>{@code all}: {@code all_} plus the pluralized suffix</li>
 * <li>{@code get_by}/{@code get_by!}: suffix infixed, {@code get_<suffix>_by}</li>
 * <li>anything else: suffix appended before the bang, {@code create_user!}</li>
 * </ol>
 */
@RequiredArgsConstructor
public class NameDeriver {

    private static final String LIST_ALL = "all";
    private static final String GET_BY = "get_by";

    @NonNull
    private final Pluralizer pluralizer;

    public ResolvedEntry derive(OperationId id, int arity, String suffix) {
        String name = toAccessorName(id, suffix).render();
        return new ResolvedEntry(name, name + "/" + arity);
    }

    AccessorName toAccessorName(OperationId id, String suffix) {
        String root = id.root();

        if (suffix == null || suffix.isEmpty()) {
            return AccessorName.builder()
                    .verb(root)
                    .strict(id.isStrict())
                    .build();
        }

        if (LIST_ALL.equals(root)) {
            return AccessorName.builder()
                    .verb(root)
                    .subject(pluralizer.pluralize(suffix))
                    .strict(id.isStrict())
                    .build();
        }

        if (GET_BY.equals(root)) {
            return AccessorName.builder()
                    .verb("get")
                    .subject(suffix)
                    .qualifier("by")
                    .strict(id.isStrict())
                    .build();
        }

        return AccessorName.builder()
                .verb(root)
                .subject(suffix)
                .strict(id.isStrict())
                .build();
    }
}
