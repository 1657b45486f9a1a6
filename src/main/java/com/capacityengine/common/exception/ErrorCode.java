package com.capacityengine.common.exception;

/**
 * Stable error codes reported to API clients.
 */
public enum ErrorCode {
    NOT_FOUND,
    BAD_ORIGIN,
    BIDDING_CLOSED,
    BIDDING_OPEN,
    BID_TOO_LOW,
    ALREADY_CLAIMED,
    SUBSCRIPTION_EXPIRED,
    QUOTA_EXHAUSTED,
    INVALID_AMOUNT,
    NOT_LOCK_BACKED,
    CLOCK_REGRESSION,
    INSUFFICIENT_BALANCE
}
