package com.capacityengine.rules;

import com.capacityengine.subscription.Subscription;
import com.capacityengine.subscription.SubscriptionKey;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything the exemption rules look at for one operation.
 */
@Value
@Builder
public class ExemptionContext {
    String signer;
    SubscriptionKey key;

    /**
     * The stored subscription, or null when none exists for the key.
     */
    Subscription subscription;

    long estimatedCost;
    Instant now;
}
