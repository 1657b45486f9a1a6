package com.capacityengine.subscription;

public enum SubscriptionKind {
    /**
     * Fixed rate forever; the mode parameter is the rate in micro-TPS.
     */
    LIFETIME,
    /**
     * Configured daily rate for a number of days; the mode parameter is the day count.
     */
    DAILY
}
