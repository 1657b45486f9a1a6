package com.capacityengine.subscription;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Quota ledger of one subscription.
 *
 * {@code freeWeight} is the capacity available right now; it grows with time at the
 * mode's rate and shrinks as operations are charged against it.
 */
@Entity
@Table(name = "subscriptions")
@Data
@NoArgsConstructor
public class Subscription {

    @EmbeddedId
    private SubscriptionKey id;

    @Column(name = "free_weight", nullable = false)
    private long freeWeight;

    @Embedded
    private SubscriptionMode mode;

    @Column(name = "issue_time", nullable = false, updatable = false)
    private Instant issueTime;

    @Column(name = "last_update", nullable = false)
    private Instant lastUpdate;

    /**
     * Precomputed for daily subscriptions, null for lifetime ones.
     */
    @Column(name = "expiration_time")
    private Instant expirationTime;

    public Subscription(SubscriptionKey id, SubscriptionMode mode, Instant issueTime) {
        this.id = id;
        this.mode = mode;
        this.freeWeight = 0;
        this.issueTime = issueTime;
        this.lastUpdate = issueTime;
        this.expirationTime = mode.expirationFrom(issueTime);
    }

    public boolean isExpiredAt(Instant now) {
        return expirationTime != null && !now.isBefore(expirationTime);
    }
}
