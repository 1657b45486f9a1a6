package com.capacityengine.dispatch;

import com.capacityengine.rules.RuleResult;

/**
 * Three-phase hook around every dispatched operation.
 *
 * {@code validate} is side-effect free and may run any number of times. {@code preDispatch}
 * re-checks and commits the accrual immediately before the operation runs.
 * {@code postDispatch} charges the actual cost afterwards and never fails the operation.
 */
public interface RequestInterceptor {

    RuleResult validate(String signer, ExemptionRequest request, long estimatedCost);

    PreDispatch preDispatch(String signer, ExemptionRequest request, long estimatedCost);

    void postDispatch(PreDispatch pre, long actualCost, boolean success);
}
