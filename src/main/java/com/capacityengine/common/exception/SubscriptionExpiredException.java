package com.capacityengine.common.exception;

import java.time.Instant;

/**
 * Thrown when a daily subscription is used at or after its expiration time.
 */
public class SubscriptionExpiredException extends CapacityEngineException {

    public SubscriptionExpiredException(String owner, int localId, Instant expiredAt) {
        super(ErrorCode.SUBSCRIPTION_EXPIRED,
            String.format("Subscription owner=%s, id=%d expired at %s", owner, localId, expiredAt));
    }
}
