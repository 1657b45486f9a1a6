package com.capacityengine.dispatch;

import com.capacityengine.common.exception.CapacityEngineException;
import com.capacityengine.rules.RuleResult;
import com.capacityengine.subscription.SubscriptionKey;
import lombok.Value;

/**
 * Context handed from pre-dispatch to post-dispatch.
 */
@Value
public class PreDispatch {
    DispatchStatus status;
    SubscriptionKey subscription;
    CapacityEngineException error;

    public static PreDispatch exempt(SubscriptionKey subscription) {
        return new PreDispatch(DispatchStatus.EXEMPT, subscription, null);
    }

    public static PreDispatch charged() {
        return new PreDispatch(DispatchStatus.CHARGED, null, null);
    }

    public static PreDispatch rejected(RuleResult result) {
        return new PreDispatch(DispatchStatus.REJECTED, null, result.getError());
    }

    public boolean isPaysNoFee() {
        return status == DispatchStatus.EXEMPT;
    }

    public boolean isRejected() {
        return status == DispatchStatus.REJECTED;
    }
}
