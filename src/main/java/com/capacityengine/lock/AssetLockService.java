package com.capacityengine.lock;

import com.capacityengine.common.AssetRatio;
import com.capacityengine.common.EngineClock;
import com.capacityengine.common.Origin;
import com.capacityengine.common.exception.BadOriginException;
import com.capacityengine.common.exception.NotLockBackedException;
import com.capacityengine.common.exception.SubscriptionNotFoundException;
import com.capacityengine.config.CapacityEngineProperties;
import com.capacityengine.currency.CurrencyAdapter;
import com.capacityengine.delegation.DelegationService;
import com.capacityengine.events.EngineEventPublisher;
import com.capacityengine.events.EngineEventType;
import com.capacityengine.subscription.Subscription;
import com.capacityengine.subscription.SubscriptionIssuer;
import com.capacityengine.subscription.SubscriptionKey;
import com.capacityengine.subscription.SubscriptionMode;
import com.capacityengine.subscription.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Lock-to-activate path: depositing assets with the custodial account buys a lifetime
 * subscription whose rate is proportional to the deposit. Stopping it refunds the deposit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetLockService {

    private final CurrencyAdapter currencyAdapter;
    private final SubscriptionIssuer subscriptionIssuer;
    private final SubscriptionRepository subscriptionRepository;
    private final LockedAssetsRepository lockedAssetsRepository;
    private final DelegationService delegationService;
    private final EngineEventPublisher eventPublisher;
    private final CapacityEngineProperties properties;
    private final EngineClock clock;

    /**
     * Lock {@code amount} and start a lifetime subscription for the caller.
     *
     * @return the new subscription's local id
     */
    @Transactional
    public int startLifetime(Origin origin, long amount) {
        String owner = origin.ensureSigned();
        if (owner.equals(properties.getCustodialAccount())) {
            throw new BadOriginException("The custodial account cannot lock assets");
        }
        long microTps = AssetRatio.fromPartsPerMillion(properties.getAssetToTpsRatioPpm()).microTpsFor(amount);
        Instant now = clock.now();

        currencyAdapter.transfer(owner, properties.getCustodialAccount(), amount, "lock:" + owner);

        Subscription subscription = subscriptionIssuer.issue(owner, SubscriptionMode.lifetime(microTps), now);
        lockedAssetsRepository.save(new LockedAssets(subscription.getId(), amount, now));

        log.info("Locked {} from {} for lifetime subscription {} at {} uTPS",
            amount, owner, subscription.getId(), microTps);
        return subscription.getId().getLocalId();
    }

    /**
     * Stop a lock-backed subscription of the caller and refund the locked amount.
     */
    @Transactional
    public long stopLifetime(Origin origin, int localId) {
        String owner = origin.ensureSigned();
        SubscriptionKey key = new SubscriptionKey(owner, localId);

        Subscription subscription = subscriptionRepository.findById(key)
            .orElseThrow(() -> new SubscriptionNotFoundException(owner, localId));
        LockedAssets locked = lockedAssetsRepository.findById(key)
            .orElseThrow(() -> new NotLockBackedException(owner, localId));

        currencyAdapter.transfer(properties.getCustodialAccount(), owner, locked.getAmount(), "unlock:" + key);

        lockedAssetsRepository.delete(locked);
        subscriptionRepository.delete(subscription);
        delegationService.revokeAll(key);

        log.info("Stopped lifetime subscription {}, refunded {}", key, locked.getAmount());
        eventPublisher.publish(eventPublisher.event(EngineEventType.SUBSCRIPTION_STOPPED)
            .with("owner", owner)
            .with("subscriptionId", localId)
            .with("refunded", locked.getAmount()));
        return locked.getAmount();
    }

    @Transactional(readOnly = true)
    public List<LockedAssets> getLocks(String owner) {
        return lockedAssetsRepository.findByIdOwner(owner);
    }
}
