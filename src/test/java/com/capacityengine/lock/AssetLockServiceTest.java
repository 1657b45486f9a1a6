package com.capacityengine.lock;

import com.capacityengine.auction.AuctionService;
import com.capacityengine.common.Origin;
import com.capacityengine.common.exception.BadOriginException;
import com.capacityengine.common.exception.InsufficientBalanceException;
import com.capacityengine.common.exception.InvalidAmountException;
import com.capacityengine.common.exception.NotLockBackedException;
import com.capacityengine.common.exception.SubscriptionNotFoundException;
import com.capacityengine.currency.CurrencyAdapter;
import com.capacityengine.currency.WalletService;
import com.capacityengine.delegation.DelegationService;
import com.capacityengine.events.EngineEventPublisher;
import com.capacityengine.events.EngineEventType;
import com.capacityengine.subscription.Subscription;
import com.capacityengine.subscription.SubscriptionKey;
import com.capacityengine.subscription.SubscriptionKind;
import com.capacityengine.subscription.SubscriptionMode;
import com.capacityengine.subscription.SubscriptionRepository;
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
 * Integration tests for lock-backed lifetime subscriptions.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestClockConfig.class)
class AssetLockServiceTest {

    private static final Origin ALICE = Origin.signed("alice");
    private static final String CUSTODY = "capacity-custody";

    @Autowired
    private AssetLockService assetLockService;

    @Autowired
    private AuctionService auctionService;

    @Autowired
    private WalletService walletService;

    @Autowired
    private CurrencyAdapter currencyAdapter;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private SubscriptionRepository subscriptionRepository;

    @Autowired
    private LockedAssetsRepository lockedAssetsRepository;

    @Autowired
    private DelegationService delegationService;

    @Autowired
    private EngineEventPublisher eventPublisher;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfig.START);
        walletService.createWallet("alice", 1_000);
    }

    @Test
    void testStartLifetimeConvertsAmountToRate() {
        int localId = assetLockService.startLifetime(ALICE, 500);

        Subscription subscription = subscriptionService.getSubscription("alice", localId);
        assertEquals(SubscriptionKind.LIFETIME, subscription.getMode().getKind());
        assertEquals(50_000, subscription.getMode().getParameter());
        assertEquals(0, subscription.getFreeWeight());

        LockedAssets locked = lockedAssetsRepository.findById(new SubscriptionKey("alice", localId)).orElseThrow();
        assertEquals(500, locked.getAmount());
        assertEquals(500, currencyAdapter.getFreeBalance("alice"));
        assertEquals(500, currencyAdapter.getFreeBalance(CUSTODY));
        assertTrue(subscriptionService.getStatus("alice", localId).isLockBacked());
    }

    @Test
    void testLockUnlockConservesBalance() {
        int localId = assetLockService.startLifetime(ALICE, 500);
        clock.advance(Duration.ofHours(5));

        long refunded = assetLockService.stopLifetime(ALICE, localId);

        assertEquals(500, refunded);
        assertEquals(1_000, currencyAdapter.getFreeBalance("alice"));
        assertEquals(0, currencyAdapter.getFreeBalance(CUSTODY));
        assertFalse(subscriptionRepository.existsById(new SubscriptionKey("alice", localId)));
        assertFalse(lockedAssetsRepository.existsById(new SubscriptionKey("alice", localId)));
        assertEquals(1, eventPublisher.getEvents(EngineEventType.SUBSCRIPTION_STOPPED).size());
    }

    @Test
    void testLocalIdsAreNotReused() {
        int first = assetLockService.startLifetime(ALICE, 100);
        assetLockService.stopLifetime(ALICE, first);
        int second = assetLockService.startLifetime(ALICE, 100);

        assertEquals(0, first);
        assertEquals(1, second);
    }

    @Test
    void testStopUnknownSubscriptionIsNotFound() {
        assertThrows(SubscriptionNotFoundException.class, () -> assetLockService.stopLifetime(ALICE, 7));
    }

    @Test
    void testOnlyOwnerCanStop() {
        int localId = assetLockService.startLifetime(ALICE, 500);

        assertThrows(SubscriptionNotFoundException.class,
            () -> assetLockService.stopLifetime(Origin.signed("mallory"), localId));
        assertThrows(BadOriginException.class, () -> assetLockService.stopLifetime(Origin.none(), localId));
    }

    @Test
    void testCustodialAccountCannotLock() {
        walletService.createWallet(CUSTODY, 1_000);

        assertThrows(BadOriginException.class,
            () -> assetLockService.startLifetime(Origin.signed(CUSTODY), 500));

        assertEquals(1_000, walletService.getWallet(CUSTODY).getFreeBalance());
        assertTrue(subscriptionService.getSubscriptions(CUSTODY).isEmpty());
    }

    @Test
    void testAuctionSubscriptionIsNotLockBacked() {
        walletService.createWallet("bob", 1_000);
        long auctionId = auctionService.startAuction(Origin.privileged("root"), SubscriptionMode.lifetime(1_000))
            .getAuctionId();
        auctionService.bid(Origin.signed("bob"), auctionId, 100);
        clock.advance(Duration.ofSeconds(101));
        auctionService.claim(Origin.signed("bob"), auctionId, null);

        assertThrows(NotLockBackedException.class, () -> assetLockService.stopLifetime(Origin.signed("bob"), 0));
        assertTrue(subscriptionRepository.existsById(new SubscriptionKey("bob", 0)));
    }

    @Test
    void testInvalidLockAmounts() {
        assertThrows(InvalidAmountException.class, () -> assetLockService.startLifetime(ALICE, 0));
        assertThrows(InvalidAmountException.class, () -> assetLockService.startLifetime(ALICE, -5));
        assertThrows(InvalidAmountException.class, () -> assetLockService.startLifetime(ALICE, 50_000_000));
        assertEquals(1_000, currencyAdapter.getFreeBalance("alice"));
    }

    @Test
    void testLockBeyondBalanceFails() {
        assertThrows(InsufficientBalanceException.class, () -> assetLockService.startLifetime(ALICE, 1_001));
    }

    @Test
    void testStoppingRemovesAccessGrants() {
        int localId = assetLockService.startLifetime(ALICE, 500);
        delegationService.grantAccess(ALICE, localId, "bob");
        assertEquals(1, delegationService.getGrants("alice", localId).size());

        assetLockService.stopLifetime(ALICE, localId);

        assertTrue(delegationService.getGrants("alice", localId).isEmpty());
    }
}
