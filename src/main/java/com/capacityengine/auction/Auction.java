package com.capacityengine.auction;

import com.capacityengine.subscription.SubscriptionMode;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Ascending single-round auction for one subscription.
 *
 * Bidding opens with the first bid and closes {@code auctionDuration} later. The winner's
 * best price stays reserved until the claim burns it. Once the subscription is issued the
 * auction is final.
 */
@Entity
@Table(name = "auctions")
@Data
@NoArgsConstructor
public class Auction {

    @Id
    private Long auctionId;

    @Embedded
    private SubscriptionMode mode;

    private String winner;

    @Column(name = "best_price", nullable = false)
    private long bestPrice;

    @Column(name = "first_bid_time")
    private Instant firstBidTime;

    @Column(name = "subscription_owner")
    private String subscriptionOwner;

    @Column(name = "subscription_id")
    private Integer subscriptionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Auction(long auctionId, SubscriptionMode mode, Instant createdAt) {
        this.auctionId = auctionId;
        this.mode = mode;
        this.bestPrice = 0;
        this.createdAt = createdAt;
    }

    public boolean hasBids() {
        return winner != null;
    }

    public boolean isClaimed() {
        return subscriptionId != null;
    }

    /**
     * Bidding is closed once the window opened by the first bid has fully elapsed.
     * An auction without bids never closes.
     */
    public boolean isBiddingClosed(Instant now, Duration auctionDuration) {
        return firstBidTime != null && firstBidTime.plus(auctionDuration).isBefore(now);
    }

    public void placeBid(String bidder, long amount, Instant now) {
        if (amount <= bestPrice) {
            throw new IllegalStateException("Best price must strictly increase");
        }
        this.winner = bidder;
        this.bestPrice = amount;
        if (firstBidTime == null) {
            this.firstBidTime = now;
        }
    }

    public void markClaimed(String owner, int localId) {
        if (isClaimed()) {
            throw new IllegalStateException("Auction " + auctionId + " already claimed");
        }
        this.subscriptionOwner = owner;
        this.subscriptionId = localId;
    }
}
