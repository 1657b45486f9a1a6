package com.capacityengine.common.exception;

/**
 * Thrown when a subscription's free quota does not cover an operation's cost.
 */
public class QuotaExhaustedException extends CapacityEngineException {

    public QuotaExhaustedException(String owner, int localId, long required, long available) {
        super(ErrorCode.QUOTA_EXHAUSTED,
            String.format("Quota exhausted for subscription owner=%s, id=%d. Required: %d, Available: %d",
                owner, localId, required, available));
    }
}
