package com.capacityengine.subscription;

import com.capacityengine.common.SaturatingMath;
import com.capacityengine.common.exception.ClockRegressionException;
import com.capacityengine.common.exception.InvalidAmountException;
import com.capacityengine.common.exception.QuotaExhaustedException;
import com.capacityengine.common.exception.SubscriptionExpiredException;
import com.capacityengine.common.exception.SubscriptionNotFoundException;
import com.capacityengine.config.CapacityEngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

/**
 * Accrues and debits subscription quota.
 *
 * A subscription running at {@code r} micro-TPS gains {@code referenceCost * r * seconds / 10^9}
 * weight, so 50,000 micro-TPS earns 3,547 over two seconds. Elapsed time is measured in
 * milliseconds, hence the divisor of {@code 10^12} below. All arithmetic
 * saturates; the free weight is capped at the configured weight limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaAccountant {

    static final long MICROS_TIMES_MILLIS = 1_000_000_000_000L;

    private final SubscriptionRepository subscriptionRepository;
    private final CapacityEngineProperties properties;

    /**
     * Weight earned between the last update and {@code now}.
     *
     * @throws SubscriptionExpiredException if a daily subscription has reached its expiration
     * @throws ClockRegressionException if {@code now} precedes the last update
     */
    public long accruedSince(Subscription subscription, Instant now) {
        if (subscription.isExpiredAt(now)) {
            throw new SubscriptionExpiredException(subscription.getId().getOwner(),
                subscription.getId().getLocalId(), subscription.getExpirationTime());
        }
        long elapsedMillis = Duration.between(subscription.getLastUpdate(), now).toMillis();
        if (elapsedMillis < 0) {
            throw new ClockRegressionException(subscription.getLastUpdate(), now);
        }
        long rate = subscription.getMode().rateMicroTps(properties.getDailyMicroTps());
        return SaturatingMath.mulDiv(properties.getReferenceCallCost(), rate, elapsedMillis, MICROS_TIMES_MILLIS);
    }

    /**
     * Free weight the subscription would hold after accruing up to {@code now}.
     * Does not modify the subscription.
     */
    public long projectedFreeWeight(Subscription subscription, Instant now) {
        long accrued = accruedSince(subscription, now);
        return Math.min(properties.getWeightLimit(), SaturatingMath.add(subscription.getFreeWeight(), accrued));
    }

    /**
     * Bring the subscription's free weight up to date.
     */
    public void accrue(Subscription subscription, Instant now) {
        long updated = projectedFreeWeight(subscription, now);
        log.debug("Accrued subscription {}: {} -> {}", subscription.getId(), subscription.getFreeWeight(), updated);
        subscription.setFreeWeight(updated);
        subscription.setLastUpdate(now);
    }

    /**
     * Charge {@code cost} against already accrued weight.
     *
     * @throws QuotaExhaustedException if the cost exceeds the free weight
     */
    public void debit(Subscription subscription, long cost) {
        if (cost < 0) {
            throw new InvalidAmountException("Cost cannot be negative: " + cost);
        }
        if (cost > subscription.getFreeWeight()) {
            throw new QuotaExhaustedException(subscription.getId().getOwner(), subscription.getId().getLocalId(),
                cost, subscription.getFreeWeight());
        }
        subscription.setFreeWeight(subscription.getFreeWeight() - cost);
    }

    /**
     * Charge {@code cost} after the fact. Never fails on a short quota: the free weight is
     * drained to zero and the uncovered remainder is returned.
     */
    public long settle(Subscription subscription, long cost) {
        if (cost < 0) {
            throw new InvalidAmountException("Cost cannot be negative: " + cost);
        }
        long free = subscription.getFreeWeight();
        if (cost <= free) {
            debit(subscription, cost);
            return 0;
        }
        subscription.setFreeWeight(0);
        return SaturatingMath.subtractToZero(cost, free);
    }

    @Transactional(readOnly = true)
    public Subscription getSubscription(SubscriptionKey key) {
        return subscriptionRepository.findById(key)
            .orElseThrow(() -> new SubscriptionNotFoundException(key.getOwner(), key.getLocalId()));
    }
}
