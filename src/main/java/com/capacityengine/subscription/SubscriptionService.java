package com.capacityengine.subscription;

import com.capacityengine.common.EngineClock;
import com.capacityengine.lock.LockedAssetsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Read side of subscriptions.
 */
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final LockedAssetsRepository lockedAssetsRepository;
    private final QuotaAccountant quotaAccountant;
    private final EngineClock clock;

    @Transactional(readOnly = true)
    public Subscription getSubscription(String owner, int localId) {
        return quotaAccountant.getSubscription(new SubscriptionKey(owner, localId));
    }

    @Transactional(readOnly = true)
    public List<Subscription> getSubscriptions(String owner) {
        return subscriptionRepository.findByIdOwnerOrderByIdLocalIdAsc(owner);
    }

    @Transactional(readOnly = true)
    public SubscriptionStatus getStatus(String owner, int localId) {
        Subscription subscription = getSubscription(owner, localId);
        Instant now = clock.now();
        boolean active = !subscription.isExpiredAt(now);

        return SubscriptionStatus.builder()
            .owner(owner)
            .localId(localId)
            .mode(subscription.getMode())
            .active(active)
            .lockBacked(lockedAssetsRepository.existsById(subscription.getId()))
            .freeWeight(active ? quotaAccountant.projectedFreeWeight(subscription, now) : subscription.getFreeWeight())
            .expirationTime(subscription.getExpirationTime())
            .asOf(now)
            .build();
    }
}
