package com.capacityengine.dispatch;

import com.capacityengine.common.exception.ErrorCode;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a dispatched operation, including how it was paid for.
 */
@Value
@Builder
public class DispatchResult {
    String operation;
    DispatchStatus status;
    boolean executed;
    boolean success;
    Long actualCost;
    String message;
    ErrorCode rejectionCode;
    String rejectionReason;
}
