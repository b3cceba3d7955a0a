package com.resource.generator.model;

import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Symbolic id of a catalog operation, e.g. {@code create} or {@code get_by!}.
 *
 * A trailing {@code !} marks the strict variant, which fails loudly instead of
 * returning an empty or error result.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationId {

    private static final Pattern SHAPE = Pattern.compile("^[a-z][a-z0-9_]*!?$");
    private static final String BANG = "!";

    @NonNull
    String value;

    public static OperationId of(String value) {
        if (value == null || !SHAPE.matcher(value).matches()) {
            throw new IllegalArgumentException("Not a valid operation id: " + value);
        }
        return new OperationId(value);
    }

    public static boolean isValid(String value) {
        return value != null && SHAPE.matcher(value).matches();
    }

    public boolean isStrict() {
        return value.endsWith(BANG);
    }

    /**
     * The id without its trailing bang.
     */
    public String root() {
        return isStrict() ? value.substring(0, value.length() - 1) : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
