package com.resource.generator.naming;

import org.atteo.evo.inflector.English;

/**
 * {@link Pluralizer} backed by Evo Inflector.
 *
 * Irregular and uncountable nouns are whatever the inflector says they are.
 */
public class EnglishPluralizer implements Pluralizer {

    @Override
    public String pluralize(String singular) {
        if (singular == null || singular.isEmpty()) {
            return singular;
        }
        return English.plural(singular);
    }
}
