package com.resource.generator.option;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resource.generator.model.OperationCatalog;
import com.resource.generator.model.OperationId;
import com.resource.generator.model.OperationSpec;
import com.resource.generator.model.ResolvedEntry;
import com.resource.generator.model.Selector;
import com.resource.generator.naming.EnglishPluralizer;
import com.resource.generator.naming.Pluralizer;

import lombok.Getter;
import lombok.NonNull;

/**
 * Resolves which accessors a resource gets and what they are called.
 *
 * Pure: the same suffix and selector always produce an equal map. The returned
 * map is unmodifiable and iterates in catalog order.
 */
public class OptionResolver {

    private static final Logger log = LoggerFactory.getLogger(OptionResolver.class);

    private static final Pattern SUFFIX_PATTERN = Pattern.compile("^[a-z0-9_]*$");

    @Getter
    private final OperationCatalog catalog;
    private final SelectorFilter selectorFilter;
    private final NameDeriver nameDeriver;

    public OptionResolver() {
        this(OperationCatalog.standard(), new EnglishPluralizer());
    }

    public OptionResolver(@NonNull OperationCatalog catalog, @NonNull Pluralizer pluralizer) {
        this.catalog = catalog;
        this.selectorFilter = new SelectorFilter();
        this.nameDeriver = new NameDeriver(pluralizer);
    }

    public Map<OperationId, ResolvedEntry> resolve(String suffix, Selector selector) {
        String effectiveSuffix = checkSuffix(suffix);
        List<OperationSpec> kept = selectorFilter.filter(catalog, selector);

        Map<OperationId, ResolvedEntry> resolved = new LinkedHashMap<>();
        for (OperationSpec spec : kept) {
            resolved.put(spec.getId(), nameDeriver.derive(spec.getId(), spec.getArity(), effectiveSuffix));
        }

        log.debug("Resolved {} of {} operations for suffix '{}' and selector {}",
                resolved.size(), catalog.size(), effectiveSuffix, selector);
        return Collections.unmodifiableMap(resolved);
    }

    /**
     * Derives a single entry, looking the arity up in this resolver's catalog.
     */
    public ResolvedEntry derive(OperationId id, String suffix) {
        OperationSpec spec = catalog.find(id)
                .orElseThrow(() -> new UnknownOperationException(id));
        return nameDeriver.derive(spec.getId(), spec.getArity(), checkSuffix(suffix));
    }

    /**
     * A suffix is lowercase snake case or empty, so every derived name stays a valid identifier.
     */
    private static String checkSuffix(String suffix) {
        if (suffix == null) {
            return "";
        }
        if (!SUFFIX_PATTERN.matcher(suffix).matches()) {
            throw new IllegalArgumentException("Invalid suffix '" + suffix
                    + "'. Expected lowercase letters, digits and underscores.");
        }
        return suffix;
    }
}
