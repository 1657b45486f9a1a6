package com.capacityengine.rules;

/**
 * A check an operation must pass to run against a subscription instead of paying the fee.
 *
 * Rules must not modify the subscription.
 */
public interface ExemptionRule {

    RuleResult evaluate(ExemptionContext context);

    String getRuleName();
}
