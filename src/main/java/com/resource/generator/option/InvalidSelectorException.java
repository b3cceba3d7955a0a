package com.resource.generator.option;

/**
 * Raised when a selector is missing, of an unknown shape, or cannot be parsed.
 */
public class InvalidSelectorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvalidSelectorException(String message) {
        super(message);
    }

    public InvalidSelectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
