package com.capacityengine.subscription;

import com.capacityengine.counter.CounterStore;
import com.capacityengine.events.EngineEventPublisher;
import com.capacityengine.events.EngineEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Creates subscriptions for both the auction and the asset-lock path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionIssuer {

    private final SubscriptionRepository subscriptionRepository;
    private final CounterStore counterStore;
    private final EngineEventPublisher eventPublisher;

    /**
     * Issue a subscription with empty quota, starting to accrue at {@code now}.
     */
    @Transactional
    public Subscription issue(String owner, SubscriptionMode mode, Instant now) {
        SubscriptionKey key = new SubscriptionKey(owner, counterStore.nextSubscriptionId(owner));
        Subscription subscription = subscriptionRepository.save(new Subscription(key, mode, now));

        log.info("Issued subscription {} with mode {}, expires {}", key, mode,
            subscription.getExpirationTime() == null ? "never" : subscription.getExpirationTime());

        eventPublisher.publish(eventPublisher.event(EngineEventType.SUBSCRIPTION_ACTIVATED)
            .with("owner", owner)
            .with("subscriptionId", key.getLocalId())
            .with("mode", mode));
        return subscription;
    }
}
