package com.resource.generator.model;

import java.util.StringJoiner;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Structured form of a generated accessor name.
 *
 * Rendered as {@code verb[_subject][_qualifier][!]}, e.g. {@code get_user_by!}.
 * The bang always ends the rendered name.
 */
@Value
@Builder
public class AccessorName {

    @NonNull
    String verb;

    String subject;

    String qualifier;

    boolean strict;

    public String render() {
        StringJoiner joiner = new StringJoiner("_");
        joiner.add(verb);
        if (subject != null && !subject.isEmpty()) {
            joiner.add(subject);
        }
        if (qualifier != null && !qualifier.isEmpty()) {
            joiner.add(qualifier);
        }
        return strict ? joiner + "!" : joiner.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
