package com.resource.generator.naming;

/**
 * Turns a singular English noun into its plural.
 */
@FunctionalInterface
public interface Pluralizer {

    String pluralize(String singular);
}
