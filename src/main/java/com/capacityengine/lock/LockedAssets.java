package com.capacityengine.lock;

import com.capacityengine.subscription.SubscriptionKey;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Deposit backing a lifetime subscription created by locking assets.
 * Exists exactly as long as its subscription.
 */
@Entity
@Table(name = "locked_assets")
@Data
@NoArgsConstructor
public class LockedAssets {

    @EmbeddedId
    private SubscriptionKey id;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "locked_at", nullable = false, updatable = false)
    private Instant lockedAt;

    public LockedAssets(SubscriptionKey id, long amount, Instant lockedAt) {
        this.id = id;
        this.amount = amount;
        this.lockedAt = lockedAt;
    }
}
