package com.capacityengine.rules;

import com.capacityengine.common.exception.BadOriginException;
import com.capacityengine.delegation.Capability;
import com.capacityengine.delegation.DelegationFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * The signer must own the subscription or hold a grant for exactly this subscription.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class DelegationRule implements ExemptionRule {

    private final DelegationFilter delegationFilter;

    @Override
    public RuleResult evaluate(ExemptionContext context) {
        String owner = context.getKey().getOwner();
        int localId = context.getKey().getLocalId();
        if (owner.equals(context.getSigner())
                || delegationFilter.mayUse(context.getSigner(), owner, localId, Capability.USE_SUBSCRIPTION)) {
            return RuleResult.approve();
        }
        return RuleResult.decline(new BadOriginException(String.format(
            "Account %s may not use subscription %s", context.getSigner(), context.getKey())));
    }

    @Override
    public String getRuleName() {
        return "Delegation";
    }
}
