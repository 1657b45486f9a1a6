package com.capacityengine.common.exception;

/**
 * Thrown when an amount is zero, negative or converts to an out-of-range value.
 */
public class InvalidAmountException extends CapacityEngineException {

    public InvalidAmountException(String message) {
        super(ErrorCode.INVALID_AMOUNT, message);
    }
}
