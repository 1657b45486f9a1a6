package com.capacityengine.common;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Source of "now" for every state transition.
 * Readings are truncated to milliseconds so that persisted timestamps compare exactly.
 */
@Component
@RequiredArgsConstructor
public class EngineClock {

    private final Clock clock;

    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
