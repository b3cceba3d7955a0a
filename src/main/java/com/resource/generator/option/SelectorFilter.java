package com.resource.generator.option;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import com.resource.generator.model.OperationCatalog;
import com.resource.generator.model.OperationId;
import com.resource.generator.model.OperationSpec;
import com.resource.generator.model.Selector;

/**
 * Narrows a catalog to the entries a selector keeps, preserving catalog order.
 *
 * Matching is exact membership on operation ids and happens before any
 * suffixing.
 */
public class SelectorFilter {

    static final Set<OperationId> READ_IDS = ids("all", "get", "get!", "get_by", "get_by!");

    static final Set<OperationId> READ_WRITE_IDS = ids("all", "get", "get!", "get_by", "get_by!",
            "change", "create", "create!", "update", "update!");

    public List<OperationSpec> filter(OperationCatalog catalog, Selector selector) {
        Selector expanded = expand(selector);
        Predicate<OperationSpec> keep = switch (expanded.getKind()) {
            case ALL -> spec -> true;
            case ONLY -> spec -> expanded.getIds().contains(spec.getId());
            case EXCEPT -> spec -> !expanded.getIds().contains(spec.getId());
            default -> throw new InvalidSelectorException("Unrecognized selector: " + selector);
        };
        return catalog.getOperations().stream()
                .filter(keep)
                .toList();
    }

    /**
     * Rewrites the READ and READ_WRITE presets into their ONLY form.
     */
    public Selector expand(Selector selector) {
        if (selector == null) {
            throw new InvalidSelectorException("Selector must not be null; use Selector.all() for no filtering");
        }
        return switch (selector.getKind()) {
            case READ -> Selector.only(READ_IDS);
            case READ_WRITE -> Selector.only(READ_WRITE_IDS);
            case ALL, ONLY, EXCEPT -> selector;
        };
    }

    private static Set<OperationId> ids(String... raw) {
        return Selector.only(raw).getIds();
    }
}
