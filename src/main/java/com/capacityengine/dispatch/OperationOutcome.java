package com.capacityengine.dispatch;

import lombok.Value;

/**
 * What happened when an operation ran. A null actual cost means the estimate applies.
 */
@Value
public class OperationOutcome {
    boolean success;
    Long actualCost;
    String message;

    public static OperationOutcome succeeded(Long actualCost, String message) {
        return new OperationOutcome(true, actualCost, message);
    }

    public static OperationOutcome failed(Long actualCost, String message) {
        return new OperationOutcome(false, actualCost, message);
    }
}
