package com.capacityengine.subscription;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of a subscription. {@code freeWeight} includes accrual up to {@code asOf}
 * while active. An expired subscription reports the weight it held when it stopped accruing.
 */
@Value
@Builder
public class SubscriptionStatus {
    String owner;
    int localId;
    SubscriptionMode mode;
    boolean active;
    boolean lockBacked;
    long freeWeight;
    Instant expirationTime;
    Instant asOf;
}
