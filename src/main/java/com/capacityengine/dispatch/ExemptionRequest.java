package com.capacityengine.dispatch;

import com.capacityengine.subscription.SubscriptionKey;
import lombok.Value;

/**
 * How an operation wants to be paid for: against a subscription, or with the normal fee.
 */
@Value
public class ExemptionRequest {
    boolean enabled;
    SubscriptionKey subscription;

    public static ExemptionRequest enabled(String owner, int localId) {
        return new ExemptionRequest(true, new SubscriptionKey(owner, localId));
    }

    public static ExemptionRequest disabled() {
        return new ExemptionRequest(false, null);
    }
}
