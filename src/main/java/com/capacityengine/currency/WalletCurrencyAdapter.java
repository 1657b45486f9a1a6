package com.capacityengine.currency;

import com.capacityengine.common.EngineClock;
import com.capacityengine.common.exception.InsufficientBalanceException;
import com.capacityengine.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link CurrencyAdapter} over locally persisted wallets. Every movement is journaled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WalletCurrencyAdapter implements CurrencyAdapter {

    private final WalletRepository walletRepository;
    private final LedgerService ledgerService;
    private final EngineClock clock;

    @Override
    @Transactional
    public void reserve(String accountId, long amount, String reference) {
        Wallet wallet = walletRepository.findById(accountId)
            .orElseThrow(() -> new InsufficientBalanceException(accountId, amount, 0));
        wallet.reserve(amount, clock.now());
        walletRepository.save(wallet);
        ledgerService.recordReserve(accountId, amount, reference);
        log.debug("Reserved {} on wallet {} for {}", amount, accountId, reference);
    }

    @Override
    @Transactional
    public void unreserve(String accountId, long amount, String reference) {
        Wallet wallet = walletRepository.findById(accountId)
            .orElseThrow(() -> new IllegalStateException("No wallet holds a reservation for " + accountId));
        wallet.unreserve(amount, clock.now());
        walletRepository.save(wallet);
        ledgerService.recordUnreserve(accountId, amount, reference);
        log.debug("Unreserved {} on wallet {} for {}", amount, accountId, reference);
    }

    @Override
    @Transactional
    public void burnReserved(String accountId, long amount, String reference) {
        Wallet wallet = walletRepository.findById(accountId)
            .orElseThrow(() -> new InsufficientBalanceException(accountId, amount, 0));
        wallet.burnReserved(amount, clock.now());
        walletRepository.save(wallet);
        ledgerService.recordBurn(accountId, amount, reference);
        log.debug("Burned {} reserved on wallet {} for {}", amount, accountId, reference);
    }

    @Override
    @Transactional
    public void transfer(String fromAccountId, String toAccountId, long amount, String reference) {
        if (fromAccountId.equals(toAccountId)) {
            throw new IllegalArgumentException("Cannot transfer to the same wallet: " + fromAccountId);
        }
        Wallet from = walletRepository.findById(fromAccountId)
            .orElseThrow(() -> new InsufficientBalanceException(fromAccountId, amount, 0));
        Wallet to = walletRepository.findById(toAccountId)
            .orElseGet(() -> new Wallet(toAccountId, 0, clock.now()));

        from.debit(amount, clock.now());
        to.credit(amount, clock.now());
        walletRepository.save(from);
        walletRepository.save(to);
        ledgerService.recordTransfer(fromAccountId, toAccountId, amount, reference);
    }

    @Override
    @Transactional(readOnly = true)
    public long getFreeBalance(String accountId) {
        return walletRepository.findById(accountId).map(Wallet::getFreeBalance).orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public long getReservedBalance(String accountId) {
        return walletRepository.findById(accountId).map(Wallet::getReservedBalance).orElse(0L);
    }
}
