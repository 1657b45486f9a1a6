package com.capacityengine.rules;

import com.capacityengine.common.exception.CapacityEngineException;
import lombok.Value;

/**
 * Result of a rule evaluation. A decline carries the error that explains it.
 */
@Value
public class RuleResult {
    boolean approved;
    String reason;
    CapacityEngineException error;

    public static RuleResult approve() {
        return new RuleResult(true, null, null);
    }

    public static RuleResult decline(CapacityEngineException error) {
        return new RuleResult(false, error.getMessage(), error);
    }
}
