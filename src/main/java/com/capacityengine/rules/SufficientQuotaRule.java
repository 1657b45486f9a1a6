package com.capacityengine.rules;

import com.capacityengine.common.exception.QuotaExhaustedException;
import com.capacityengine.subscription.QuotaAccountant;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * After a trial accrual, the free weight must cover the estimated cost.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class SufficientQuotaRule implements ExemptionRule {

    private final QuotaAccountant quotaAccountant;

    @Override
    public RuleResult evaluate(ExemptionContext context) {
        long available = quotaAccountant.projectedFreeWeight(context.getSubscription(), context.getNow());
        if (context.getEstimatedCost() > available) {
            return RuleResult.decline(new QuotaExhaustedException(context.getKey().getOwner(),
                context.getKey().getLocalId(), context.getEstimatedCost(), available));
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "SufficientQuota";
    }
}
