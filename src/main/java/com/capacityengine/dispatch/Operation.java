package com.capacityengine.dispatch;

/**
 * A downstream operation that may run fee-exempt against a subscription.
 *
 * Implementations report failures through {@link OperationOutcome#failed} rather than by
 * throwing, since the quota is charged either way.
 */
public interface Operation {

    String getName();

    /**
     * Upper bound of the weight this operation will consume, known before it runs.
     */
    long getEstimatedCost();

    OperationOutcome execute(String signer);
}
