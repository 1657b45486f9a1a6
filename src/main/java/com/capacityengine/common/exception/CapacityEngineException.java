package com.capacityengine.common.exception;

/**
 * Base exception for all capacity engine exceptions.
 */
public class CapacityEngineException extends RuntimeException {

    private final ErrorCode code;

    public CapacityEngineException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CapacityEngineException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Fatal errors abort the operation and are never turned into a soft rejection.
     */
    public boolean isFatal() {
        return false;
    }
}
