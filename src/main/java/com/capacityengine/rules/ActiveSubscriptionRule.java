package com.capacityengine.rules;

import com.capacityengine.common.exception.SubscriptionExpiredException;
import com.capacityengine.common.exception.SubscriptionNotFoundException;
import com.capacityengine.subscription.Subscription;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * The subscription must exist and must not have expired.
 */
@Component
@Order(2)
public class ActiveSubscriptionRule implements ExemptionRule {

    @Override
    public RuleResult evaluate(ExemptionContext context) {
        Subscription subscription = context.getSubscription();
        if (subscription == null) {
            return RuleResult.decline(new SubscriptionNotFoundException(
                context.getKey().getOwner(), context.getKey().getLocalId()));
        }
        if (subscription.isExpiredAt(context.getNow())) {
            return RuleResult.decline(new SubscriptionExpiredException(
                context.getKey().getOwner(), context.getKey().getLocalId(), subscription.getExpirationTime()));
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "ActiveSubscription";
    }
}
