package com.capacityengine.common.exception;

/**
 * Thrown when a dispatched operation name has no registered handler.
 */
public class OperationNotFoundException extends CapacityEngineException {

    public OperationNotFoundException(String operation) {
        super(ErrorCode.NOT_FOUND, "Unknown operation: " + operation);
    }
}
