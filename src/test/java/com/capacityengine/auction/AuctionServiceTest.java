package com.capacityengine.auction;

import com.capacityengine.common.Origin;
import com.capacityengine.common.exception.AlreadyClaimedException;
import com.capacityengine.common.exception.AuctionNotFoundException;
import com.capacityengine.common.exception.BadOriginException;
import com.capacityengine.common.exception.BidTooLowException;
import com.capacityengine.common.exception.BiddingClosedException;
import com.capacityengine.common.exception.BiddingOpenException;
import com.capacityengine.common.exception.InsufficientBalanceException;
import com.capacityengine.common.exception.InvalidAmountException;
import com.capacityengine.currency.CurrencyAdapter;
import com.capacityengine.currency.WalletService;
import com.capacityengine.events.EngineEventPublisher;
import com.capacityengine.events.EngineEventType;
import com.capacityengine.subscription.Subscription;
import com.capacityengine.subscription.SubscriptionMode;
import com.capacityengine.subscription.SubscriptionService;
import com.capacityengine.support.MutableClock;
import com.capacityengine.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the auction flow.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestClockConfig.class)
class AuctionServiceTest {

    private static final Origin ROOT = Origin.privileged("root");
    private static final Origin ALICE = Origin.signed("alice");
    private static final Origin BOB = Origin.signed("bob");

    @Autowired
    private AuctionService auctionService;

    @Autowired
    private WalletService walletService;

    @Autowired
    private CurrencyAdapter currencyAdapter;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private EngineEventPublisher eventPublisher;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfig.START);
        walletService.createWallet("alice", 10_000);
        walletService.createWallet("bob", 10_000);
    }

    @Test
    void testStartAuctionRequiresPrivilegedOrigin() {
        assertThrows(BadOriginException.class,
            () -> auctionService.startAuction(ALICE, SubscriptionMode.lifetime(1_000)));
        assertThrows(BadOriginException.class,
            () -> auctionService.startAuction(Origin.none(), SubscriptionMode.lifetime(1_000)));
    }

    @Test
    void testAuctionIdsIncrementFromZero() {
        Auction first = auctionService.startAuction(ROOT, SubscriptionMode.lifetime(1_000));
        Auction second = auctionService.startAuction(ROOT, SubscriptionMode.daily(30));

        assertEquals(0L, first.getAuctionId().longValue());
        assertEquals(1L, second.getAuctionId().longValue());
        assertNull(first.getWinner());
        assertEquals(0, first.getBestPrice());
        assertNull(first.getFirstBidTime());
        assertEquals(2, eventPublisher.getEvents(EngineEventType.AUCTION_STARTED).size());
    }

    @Test
    void testFloorAndStrictOutbidding() {
        long id = auctionService.startAuction(ROOT, SubscriptionMode.lifetime(1_000)).getAuctionId();

        assertThrows(BidTooLowException.class, () -> auctionService.bid(ALICE, id, 99));

        Auction auction = auctionService.bid(ALICE, id, 100);
        assertEquals("alice", auction.getWinner());
        assertEquals(100, auction.getBestPrice());
        assertEquals(TestClockConfig.START, auction.getFirstBidTime());
        assertEquals(100, currencyAdapter.getReservedBalance("alice"));

        // a tie does not outbid
        assertThrows(BidTooLowException.class, () -> auctionService.bid(BOB, id, 100));

        clock.advance(Duration.ofSeconds(10));
        auction = auctionService.bid(BOB, id, 101);
        assertEquals("bob", auction.getWinner());
        assertEquals(101, auction.getBestPrice());
        assertEquals(TestClockConfig.START, auction.getFirstBidTime());

        assertEquals(0, currencyAdapter.getReservedBalance("alice"));
        assertEquals(10_000, currencyAdapter.getFreeBalance("alice"));
        assertEquals(101, currencyAdapter.getReservedBalance("bob"));
        assertEquals(2, eventPublisher.getEvents(EngineEventType.NEW_BID).size());
    }

    @Test
    void testBestPriceStrictlyIncreases() {
        long id = auctionService.startAuction(ROOT, SubscriptionMode.lifetime(1_000)).getAuctionId();
        long previous = 0;
        long[] bids = {150, 151, 400, 1_000};
        Origin[] bidders = {ALICE, BOB, ALICE, BOB};

        for (int i = 0; i < bids.length; i++) {
            Auction auction = auctionService.bid(bidders[i], id, bids[i]);
            assertTrue(auction.getBestPrice() > previous);
            previous = auction.getBestPrice();
        }
        assertThrows(BidTooLowException.class, () -> auctionService.bid(ALICE, id, 999));
    }

    @Test
    void testInvalidBids() {
        long id = auctionService.startAuction(ROOT, SubscriptionMode.lifetime(1_000)).getAuctionId();

        assertThrows(InvalidAmountException.class, () -> auctionService.bid(ALICE, id, 0));
        assertThrows(AuctionNotFoundException.class, () -> auctionService.bid(ALICE, 42, 100));
        assertThrows(BadOriginException.class, () -> auctionService.bid(Origin.none(), id, 100));
        assertThrows(InsufficientBalanceException.class, () -> auctionService.bid(ALICE, id, 20_000));
        assertThrows(InsufficientBalanceException.class,
            () -> auctionService.bid(Origin.signed("nobody"), id, 100));
    }

    @Test
    void testFullAuctionLifecycle() {
        long id = auctionService.startAuction(ROOT, SubscriptionMode.lifetime(1_000)).getAuctionId();
        auctionService.bid(ALICE, id, 100);
        auctionService.bid(BOB, id, 101);

        // window is still open exactly at first_bid_time + duration
        clock.set(TestClockConfig.START.plusSeconds(100));
        assertThrows(BiddingOpenException.class, () -> auctionService.claim(BOB, id, null));

        clock.set(TestClockConfig.START.plusSeconds(101));
        assertThrows(BiddingClosedException.class, () -> auctionService.bid(ALICE, id, 500));
        assertThrows(BadOriginException.class, () -> auctionService.claim(ALICE, id, null));

        Auction claimed = auctionService.claim(BOB, id, null);
        assertEquals("bob", claimed.getSubscriptionOwner());
        assertEquals(0, claimed.getSubscriptionId().intValue());
        assertTrue(claimed.isClaimed());

        assertEquals(0, currencyAdapter.getReservedBalance("bob"));
        assertEquals(10_000 - 101, currencyAdapter.getFreeBalance("bob"));

        Subscription subscription = subscriptionService.getSubscription("bob", 0);
        assertEquals(0, subscription.getFreeWeight());
        assertEquals(TestClockConfig.START.plusSeconds(101), subscription.getIssueTime());
        assertEquals(SubscriptionMode.lifetime(1_000), subscription.getMode());
        assertNull(subscription.getExpirationTime());

        assertThrows(AlreadyClaimedException.class, () -> auctionService.claim(BOB, id, null));
        assertThrows(AlreadyClaimedException.class, () -> auctionService.bid(ALICE, id, 500));
        assertEquals(1, eventPublisher.getEvents(EngineEventType.AUCTION_FINISHED).size());
        assertEquals(1, eventPublisher.getEvents(EngineEventType.SUBSCRIPTION_ACTIVATED).size());
    }

    @Test
    void testClaimForBeneficiaryWithDailyMode() {
        long id = auctionService.startAuction(ROOT, SubscriptionMode.daily(30)).getAuctionId();
        auctionService.bid(ALICE, id, 300);
        clock.advance(Duration.ofSeconds(101));

        Auction claimed = auctionService.claim(ALICE, id, "carol");

        assertEquals("carol", claimed.getSubscriptionOwner());
        Subscription subscription = subscriptionService.getSubscription("carol", 0);
        assertEquals(TestClockConfig.START.plusSeconds(101).plus(Duration.ofDays(30)),
            subscription.getExpirationTime());
        assertTrue(subscriptionService.getSubscriptions("alice").isEmpty());
    }

    @Test
    void testAuctionWithoutBidsNeverCloses() {
        long id = auctionService.startAuction(ROOT, SubscriptionMode.lifetime(1_000)).getAuctionId();
        clock.advance(Duration.ofDays(365));

        assertThrows(BadOriginException.class, () -> auctionService.claim(ALICE, id, null));

        Auction auction = auctionService.bid(ALICE, id, 100);
        assertEquals(clock.instant(), auction.getFirstBidTime());
    }

    @Test
    void testOpenAuctionsListing() {
        long first = auctionService.startAuction(ROOT, SubscriptionMode.lifetime(1_000)).getAuctionId();
        auctionService.startAuction(ROOT, SubscriptionMode.lifetime(2_000));
        auctionService.bid(ALICE, first, 100);
        clock.advance(Duration.ofSeconds(101));
        auctionService.claim(ALICE, first, null);

        assertEquals(2, auctionService.getAuctions(false).size());
        assertEquals(1, auctionService.getAuctions(true).size());
    }
}
