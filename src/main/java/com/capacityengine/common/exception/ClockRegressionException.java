package com.capacityengine.common.exception;

import java.time.Instant;

/**
 * Thrown when the clock reads earlier than a subscription's last update.
 */
public class ClockRegressionException extends CapacityEngineException {

    public ClockRegressionException(Instant lastUpdate, Instant now) {
        super(ErrorCode.CLOCK_REGRESSION,
            String.format("Clock went backwards: last update %s, now %s", lastUpdate, now));
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
