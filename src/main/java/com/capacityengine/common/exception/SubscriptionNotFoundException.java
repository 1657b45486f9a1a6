package com.capacityengine.common.exception;

/**
 * Thrown when no subscription exists for an owner and local id.
 */
public class SubscriptionNotFoundException extends CapacityEngineException {

    public SubscriptionNotFoundException(String owner, int localId) {
        super(ErrorCode.NOT_FOUND, String.format("Subscription not found: owner=%s, id=%d", owner, localId));
    }
}
