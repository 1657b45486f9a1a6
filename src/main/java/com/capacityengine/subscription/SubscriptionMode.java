package com.capacityengine.subscription;

import com.capacityengine.common.exception.InvalidAmountException;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Kind and parameter of a subscription: {@code LIFETIME(tps)} or {@code DAILY(days)}.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubscriptionMode {

    public static final long MAX_PARAMETER = 4_294_967_295L;
    public static final long SECONDS_PER_DAY = 86_400L;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode_kind", nullable = false)
    private SubscriptionKind kind;

    @Column(name = "mode_param", nullable = false)
    private long parameter;

    public static SubscriptionMode lifetime(long microTps) {
        return of(SubscriptionKind.LIFETIME, microTps);
    }

    public static SubscriptionMode daily(long days) {
        return of(SubscriptionKind.DAILY, days);
    }

    public static SubscriptionMode of(SubscriptionKind kind, long parameter) {
        if (kind == null) {
            throw new IllegalArgumentException("Subscription kind is required");
        }
        if (parameter <= 0 || parameter > MAX_PARAMETER) {
            throw new InvalidAmountException(String.format(
                "%s parameter must be within 1..%d: %d", kind, MAX_PARAMETER, parameter));
        }
        return new SubscriptionMode(kind, parameter);
    }

    /**
     * Accrual rate in micro-TPS.
     *
     * @param dailyMicroTps the rate shared by all daily subscriptions
     */
    public long rateMicroTps(long dailyMicroTps) {
        return kind == SubscriptionKind.LIFETIME ? parameter : dailyMicroTps;
    }

    /**
     * @return when a subscription issued at {@code issueTime} stops being usable, or null if never
     */
    public Instant expirationFrom(Instant issueTime) {
        if (kind == SubscriptionKind.LIFETIME) {
            return null;
        }
        return issueTime.plusSeconds(parameter * SECONDS_PER_DAY);
    }

    @Override
    public String toString() {
        return kind + "(" + parameter + ")";
    }
}
