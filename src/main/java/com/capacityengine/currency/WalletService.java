package com.capacityengine.currency;

import com.capacityengine.common.EngineClock;
import com.capacityengine.common.exception.WalletNotFoundException;
import com.capacityengine.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for opening and funding wallets.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletService {

    private final WalletRepository walletRepository;
    private final LedgerService ledgerService;
    private final EngineClock clock;

    @Transactional
    public Wallet createWallet(String accountId, long initialBalance) {
        if (walletRepository.existsById(accountId)) {
            throw new IllegalArgumentException("Wallet already exists: " + accountId);
        }
        Wallet wallet = walletRepository.save(new Wallet(accountId, initialBalance, clock.now()));
        if (initialBalance > 0) {
            ledgerService.recordDeposit(accountId, initialBalance, "Initial deposit");
        }
        log.info("Created wallet {} with balance {}", accountId, initialBalance);
        return wallet;
    }

    @Transactional(readOnly = true)
    public Wallet getWallet(String accountId) {
        return walletRepository.findById(accountId)
            .orElseThrow(() -> new WalletNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public List<Wallet> getAllWallets() {
        return walletRepository.findAll();
    }

    @Transactional
    public Wallet deposit(String accountId, long amount) {
        Wallet wallet = getWallet(accountId);
        wallet.credit(amount, clock.now());
        walletRepository.save(wallet);
        ledgerService.recordDeposit(accountId, amount, "Manual deposit");
        log.info("Deposited {} to wallet {}", amount, accountId);
        return wallet;
    }
}
