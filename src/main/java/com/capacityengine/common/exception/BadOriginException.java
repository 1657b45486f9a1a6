package com.capacityengine.common.exception;

/**
 * Thrown when the caller lacks the identity or privilege an operation requires.
 */
public class BadOriginException extends CapacityEngineException {

    public BadOriginException(String message) {
        super(ErrorCode.BAD_ORIGIN, message);
    }
}
