package com.capacityengine.dispatch;

import com.capacityengine.common.EngineClock;
import com.capacityengine.events.EngineEventPublisher;
import com.capacityengine.events.EngineEventType;
import com.capacityengine.rules.ExemptionContext;
import com.capacityengine.rules.ExemptionRulesEngine;
import com.capacityengine.rules.RuleResult;
import com.capacityengine.subscription.QuotaAccountant;
import com.capacityengine.subscription.Subscription;
import com.capacityengine.subscription.SubscriptionKey;
import com.capacityengine.subscription.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Request interceptor that exempts operations from the fee when a subscription covers them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubscriptionFeeInterceptor implements RequestInterceptor {

    private final ExemptionRulesEngine rulesEngine;
    private final QuotaAccountant quotaAccountant;
    private final SubscriptionRepository subscriptionRepository;
    private final EngineEventPublisher eventPublisher;
    private final EngineClock clock;

    @Override
    @Transactional(readOnly = true)
    public RuleResult validate(String signer, ExemptionRequest request, long estimatedCost) {
        if (!request.isEnabled()) {
            return RuleResult.approve();
        }
        return rulesEngine.evaluateRules(context(signer, request, estimatedCost, clock.now()));
    }

    @Override
    @Transactional
    public PreDispatch preDispatch(String signer, ExemptionRequest request, long estimatedCost) {
        if (!request.isEnabled()) {
            return PreDispatch.charged();
        }
        Instant now = clock.now();
        ExemptionContext context = context(signer, request, estimatedCost, now);
        RuleResult result = rulesEngine.evaluateRules(context);
        if (!result.isApproved()) {
            return PreDispatch.rejected(result);
        }

        Subscription subscription = context.getSubscription();
        quotaAccountant.accrue(subscription, now);
        subscriptionRepository.save(subscription);
        return PreDispatch.exempt(subscription.getId());
    }

    @Override
    @Transactional
    public void postDispatch(PreDispatch pre, long actualCost, boolean success) {
        if (!pre.isPaysNoFee()) {
            return;
        }
        SubscriptionKey key = pre.getSubscription();
        Subscription subscription = subscriptionRepository.findById(key).orElse(null);
        if (subscription == null) {
            log.warn("Subscription {} disappeared before its usage of {} could be recorded", key, actualCost);
            return;
        }

        long shortfall = quotaAccountant.settle(subscription, actualCost);
        subscriptionRepository.save(subscription);

        if (shortfall > 0) {
            log.warn("Subscription {} was short {} weight; drained to zero", key, shortfall);
            eventPublisher.publish(eventPublisher.event(EngineEventType.ACCOUNTING_DISCREPANCY)
                .with("owner", key.getOwner())
                .with("subscriptionId", key.getLocalId())
                .with("cost", actualCost)
                .with("shortfall", shortfall));
        }
        eventPublisher.publish(eventPublisher.event(EngineEventType.USAGE_RECORDED)
            .with("owner", key.getOwner())
            .with("subscriptionId", key.getLocalId())
            .with("cost", actualCost)
            .with("success", success));
    }

    private ExemptionContext context(String signer, ExemptionRequest request, long estimatedCost, Instant now) {
        SubscriptionKey key = request.getSubscription();
        return ExemptionContext.builder()
            .signer(signer)
            .key(key)
            .subscription(subscriptionRepository.findById(key).orElse(null))
            .estimatedCost(estimatedCost)
            .now(now)
            .build();
    }
}
