package com.resource.generator.binding;

/**
 * A strict write was rejected by the store.
 */
public class InvalidChangesetException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient Changeset<?> changeset;

    public InvalidChangesetException(String accessorName, Changeset<?> changeset) {
        super(accessorName + " rejected: " + changeset.getErrors());
        this.changeset = changeset;
    }

    public Changeset<?> getChangeset() {
        return changeset;
    }
}
