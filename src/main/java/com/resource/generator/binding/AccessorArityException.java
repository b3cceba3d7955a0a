package com.resource.generator.binding;

/**
 * A dynamic accessor call passed the wrong number of arguments.
 */
public class AccessorArityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AccessorArityException(String description, int actual) {
        super("Expected " + description + " but got " + actual + " argument(s)");
    }
}
