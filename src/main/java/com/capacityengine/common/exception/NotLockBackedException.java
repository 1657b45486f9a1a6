package com.capacityengine.common.exception;

/**
 * Thrown when a subscription was not created by locking assets.
 */
public class NotLockBackedException extends CapacityEngineException {

    public NotLockBackedException(String owner, int localId) {
        super(ErrorCode.NOT_LOCK_BACKED, String.format("Subscription is not backed by locked assets: owner=%s, id=%d", owner, localId));
    }
}
