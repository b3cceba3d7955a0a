package com.resource.generator.option;

import com.resource.generator.model.OperationId;

/**
 * An operation id outside the catalog reached derivation or binding.
 *
 * This is a programming error on the caller's side, not a runtime condition.
 */
public class UnknownOperationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final transient OperationId operationId;

    public UnknownOperationException(OperationId operationId) {
        super("Operation is not part of the catalog: " + operationId);
        this.operationId = operationId;
    }

    public OperationId getOperationId() {
        return operationId;
    }
}
