package com.capacityengine.auction;

import com.capacityengine.common.EngineClock;
import com.capacityengine.common.Origin;
import com.capacityengine.common.exception.AlreadyClaimedException;
import com.capacityengine.common.exception.AuctionNotFoundException;
import com.capacityengine.common.exception.BadOriginException;
import com.capacityengine.common.exception.BidTooLowException;
import com.capacityengine.common.exception.BiddingClosedException;
import com.capacityengine.common.exception.BiddingOpenException;
import com.capacityengine.common.exception.InvalidAmountException;
import com.capacityengine.config.CapacityEngineProperties;
import com.capacityengine.counter.CounterStore;
import com.capacityengine.currency.CurrencyAdapter;
import com.capacityengine.events.EngineEventPublisher;
import com.capacityengine.events.EngineEventType;
import com.capacityengine.subscription.Subscription;
import com.capacityengine.subscription.SubscriptionIssuer;
import com.capacityengine.subscription.SubscriptionMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Burn-to-win auction flow.
 *
 * Flow:
 * 1. A privileged account starts an auction for a subscription mode
 * 2. Bidders reserve their bids; each accepted bid releases the previous winner's reserve
 * 3. After the bidding window the winner claims: the reserve is burned and the subscription issued
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuctionService {

    private final AuctionRepository auctionRepository;
    private final CounterStore counterStore;
    private final CurrencyAdapter currencyAdapter;
    private final SubscriptionIssuer subscriptionIssuer;
    private final EngineEventPublisher eventPublisher;
    private final CapacityEngineProperties properties;
    private final EngineClock clock;

    @Transactional
    public Auction startAuction(Origin origin, SubscriptionMode mode) {
        String admin = origin.ensurePrivileged();
        long auctionId = counterStore.nextAuctionId();
        Auction auction = auctionRepository.save(new Auction(auctionId, mode, clock.now()));

        log.info("Auction {} started by {} for {}", auctionId, admin, mode);
        eventPublisher.publish(eventPublisher.event(EngineEventType.AUCTION_STARTED)
            .with("auctionId", auctionId)
            .with("mode", mode));
        return auction;
    }

    @Transactional
    public Auction bid(Origin origin, long auctionId, long amount) {
        String bidder = origin.ensureSigned();
        Auction auction = getAuction(auctionId);
        Instant now = clock.now();

        if (auction.isClaimed()) {
            throw new AlreadyClaimedException(auctionId);
        }
        if (auction.isBiddingClosed(now, properties.getAuctionDuration())) {
            throw new BiddingClosedException(auctionId);
        }
        if (amount <= 0) {
            throw new InvalidAmountException("Bid must be positive: " + amount);
        }
        if (!auction.hasBids()) {
            if (amount < properties.getMinimalBid()) {
                throw new BidTooLowException(auctionId, amount, properties.getMinimalBid(), true);
            }
        } else if (amount <= auction.getBestPrice()) {
            throw new BidTooLowException(auctionId, amount, auction.getBestPrice(), false);
        }

        String reference = "auction:" + auctionId;
        currencyAdapter.reserve(bidder, amount, reference);
        if (auction.hasBids()) {
            currencyAdapter.unreserve(auction.getWinner(), auction.getBestPrice(), reference);
        }

        auction.placeBid(bidder, amount, now);
        auctionRepository.save(auction);

        log.info("Auction {}: {} bid {}", auctionId, bidder, amount);
        eventPublisher.publish(eventPublisher.event(EngineEventType.NEW_BID)
            .with("auctionId", auctionId)
            .with("bidder", bidder)
            .with("amount", amount));
        return auction;
    }

    /**
     * Finish the auction and issue its subscription.
     *
     * @param beneficiary owner of the new subscription; the winner when null
     */
    @Transactional
    public Auction claim(Origin origin, long auctionId, String beneficiary) {
        String caller = origin.ensureSigned();
        Auction auction = getAuction(auctionId);
        Instant now = clock.now();

        if (auction.isClaimed()) {
            throw new AlreadyClaimedException(auctionId);
        }
        if (!caller.equals(auction.getWinner())) {
            throw new BadOriginException("Only the winner of auction " + auctionId + " can claim it");
        }
        if (!auction.isBiddingClosed(now, properties.getAuctionDuration())) {
            throw new BiddingOpenException(auctionId);
        }

        currencyAdapter.burnReserved(caller, auction.getBestPrice(), "auction:" + auctionId);

        String owner = beneficiary == null || beneficiary.isBlank() ? caller : beneficiary;
        Subscription subscription = subscriptionIssuer.issue(owner, auction.getMode(), now);
        auction.markClaimed(owner, subscription.getId().getLocalId());
        auctionRepository.save(auction);

        log.info("Auction {} claimed by {} for {}, burned {}", auctionId, caller, subscription.getId(),
            auction.getBestPrice());
        eventPublisher.publish(eventPublisher.event(EngineEventType.AUCTION_FINISHED)
            .with("auctionId", auctionId)
            .with("winner", caller)
            .with("price", auction.getBestPrice())
            .with("owner", owner)
            .with("subscriptionId", subscription.getId().getLocalId()));
        return auction;
    }

    @Transactional(readOnly = true)
    public Auction getAuction(long auctionId) {
        return auctionRepository.findById(auctionId)
            .orElseThrow(() -> new AuctionNotFoundException(auctionId));
    }

    @Transactional(readOnly = true)
    public List<Auction> getAuctions(boolean openOnly) {
        return openOnly
            ? auctionRepository.findBySubscriptionIdIsNullOrderByAuctionIdAsc()
            : auctionRepository.findAllByOrderByAuctionIdAsc();
    }
}
