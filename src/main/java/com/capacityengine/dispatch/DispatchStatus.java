package com.capacityengine.dispatch;

public enum DispatchStatus {
    /**
     * Ran against a subscription's quota.
     */
    EXEMPT,
    /**
     * Ran paying the normal fee.
     */
    CHARGED,
    /**
     * Not run: the exemption was refused.
     */
    REJECTED
}
