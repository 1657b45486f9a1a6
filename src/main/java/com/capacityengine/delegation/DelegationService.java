package com.capacityengine.delegation;

import com.capacityengine.common.EngineClock;
import com.capacityengine.common.Origin;
import com.capacityengine.common.exception.SubscriptionNotFoundException;
import com.capacityengine.events.EngineEventPublisher;
import com.capacityengine.events.EngineEventType;
import com.capacityengine.subscription.SubscriptionKey;
import com.capacityengine.subscription.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Lets subscription owners share their quota with other accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DelegationService {

    private final AccessGrantRepository accessGrantRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final EngineEventPublisher eventPublisher;
    private final EngineClock clock;

    /**
     * Grant {@code delegate} use of the caller's subscription. Granting twice is a no-op.
     */
    @Transactional
    public AccessGrant grantAccess(Origin origin, int localId, String delegate) {
        String owner = origin.ensureSigned();
        requireSubscription(owner, localId);
        if (delegate == null || delegate.isBlank()) {
            throw new IllegalArgumentException("Delegate is required");
        }

        return accessGrantRepository.findByOwnerAndLocalIdAndDelegate(owner, localId, delegate)
            .orElseGet(() -> {
                AccessGrant grant = accessGrantRepository.save(
                    new AccessGrant(owner, localId, delegate, clock.now()));
                log.info("Granted {} access to subscription {}/{}", delegate, owner, localId);
                eventPublisher.publish(eventPublisher.event(EngineEventType.ACCESS_GRANTED)
                    .with("owner", owner)
                    .with("subscriptionId", localId)
                    .with("delegate", delegate));
                return grant;
            });
    }

    /**
     * Revoke a grant. Revoking a grant that does not exist is a no-op.
     */
    @Transactional
    public void revokeAccess(Origin origin, int localId, String delegate) {
        String owner = origin.ensureSigned();
        requireSubscription(owner, localId);

        accessGrantRepository.findByOwnerAndLocalIdAndDelegate(owner, localId, delegate).ifPresent(grant -> {
            accessGrantRepository.delete(grant);
            log.info("Revoked {} access to subscription {}/{}", delegate, owner, localId);
            eventPublisher.publish(eventPublisher.event(EngineEventType.ACCESS_REVOKED)
                .with("owner", owner)
                .with("subscriptionId", localId)
                .with("delegate", delegate));
        });
    }

    /**
     * Drop every grant on a subscription that is being removed.
     */
    @Transactional
    public void revokeAll(SubscriptionKey key) {
        long removed = accessGrantRepository.deleteByOwnerAndLocalId(key.getOwner(), key.getLocalId());
        if (removed > 0) {
            log.info("Removed {} access grants of subscription {}", removed, key);
        }
    }

    @Transactional(readOnly = true)
    public List<AccessGrant> getGrants(String owner, int localId) {
        return accessGrantRepository.findByOwnerAndLocalId(owner, localId);
    }

    private void requireSubscription(String owner, int localId) {
        if (!subscriptionRepository.existsById(new SubscriptionKey(owner, localId))) {
            throw new SubscriptionNotFoundException(owner, localId);
        }
    }
}
