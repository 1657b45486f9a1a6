package com.capacityengine.delegation;

/**
 * What a delegate may do with someone else's subscription.
 */
public enum Capability {
    /**
     * Run operations fee-exempt against the subscription's quota.
     */
    USE_SUBSCRIPTION,
    BID,
    CLAIM,
    LOCK,
    UNLOCK
}
