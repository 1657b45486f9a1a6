package com.capacityengine.counter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Allocates auction ids and per-owner subscription ids. Both sequences start at zero.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CounterStore {

    static final String AUCTION_SCOPE = "auction";
    static final String SUBSCRIPTION_SCOPE_PREFIX = "subscription:";

    private final CounterRepository counterRepository;

    @Transactional
    public long nextAuctionId() {
        return next(AUCTION_SCOPE);
    }

    @Transactional
    public int nextSubscriptionId(String owner) {
        return Math.toIntExact(next(SUBSCRIPTION_SCOPE_PREFIX + owner));
    }

    private long next(String scope) {
        Counter counter = counterRepository.findById(scope).orElseGet(() -> new Counter(scope));
        long value = counter.take();
        counterRepository.save(counter);
        log.debug("Allocated {} from counter {}", value, scope);
        return value;
    }
}
