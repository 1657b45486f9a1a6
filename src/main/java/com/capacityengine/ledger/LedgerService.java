package com.capacityengine.ledger;

import com.capacityengine.common.EngineClock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Journal of every wallet movement made on behalf of the capacity engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerRepository ledgerRepository;
    private final EngineClock clock;

    @Transactional
    public String recordDeposit(String accountId, long amount, String description) {
        String transactionId = UUID.randomUUID().toString();
        ledgerRepository.save(new LedgerEntry(transactionId, accountId, LedgerEntry.EntryType.CREDIT,
            amount, TransactionType.DEPOSIT, null, description, clock.now()));

        log.info("Recorded DEPOSIT: txn={}, account={}, amount={}", transactionId, accountId, amount);
        return transactionId;
    }

    /**
     * Record funds moving from free to reserved balance.
     */
    @Transactional
    public String recordReserve(String accountId, long amount, String reference) {
        return recordSingle(accountId, LedgerEntry.EntryType.DEBIT, amount, TransactionType.RESERVE,
            reference, "Reserved for " + reference);
    }

    @Transactional
    public String recordUnreserve(String accountId, long amount, String reference) {
        return recordSingle(accountId, LedgerEntry.EntryType.CREDIT, amount, TransactionType.UNRESERVE,
            reference, "Released reservation for " + reference);
    }

    /**
     * Record destruction of reserved funds. Burned funds have no counter-entry.
     */
    @Transactional
    public String recordBurn(String accountId, long amount, String reference) {
        return recordSingle(accountId, LedgerEntry.EntryType.DEBIT, amount, TransactionType.BURN,
            reference, "Burned for " + reference);
    }

    /**
     * Record a transfer as a debit on the source and a credit on the destination.
     */
    @Transactional
    public String recordTransfer(String fromAccountId, String toAccountId, long amount, String reference) {
        String transactionId = UUID.randomUUID().toString();

        LedgerEntry debit = new LedgerEntry(transactionId, fromAccountId, LedgerEntry.EntryType.DEBIT,
            amount, TransactionType.TRANSFER, reference, "Transfer to " + toAccountId, clock.now());
        LedgerEntry credit = new LedgerEntry(transactionId, toAccountId, LedgerEntry.EntryType.CREDIT,
            amount, TransactionType.TRANSFER, reference, "Transfer from " + fromAccountId, clock.now());

        ledgerRepository.save(debit);
        ledgerRepository.save(credit);

        log.info("Recorded TRANSFER: txn={}, from={}, to={}, amount={}, ref={}",
            transactionId, fromAccountId, toAccountId, amount, reference);
        return transactionId;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getAccountLedger(String accountId) {
        return ledgerRepository.findByAccountIdOrderByCreatedAtDesc(accountId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getReferenceLedger(String reference) {
        return ledgerRepository.findByReferenceOrderByCreatedAtAsc(reference);
    }

    private String recordSingle(String accountId, LedgerEntry.EntryType entryType, long amount,
                                TransactionType transactionType, String reference, String description) {
        String transactionId = UUID.randomUUID().toString();
        ledgerRepository.save(new LedgerEntry(transactionId, accountId, entryType, amount,
            transactionType, reference, description, clock.now()));

        log.info("Recorded {}: txn={}, account={}, amount={}, ref={}",
            transactionType, transactionId, accountId, amount, reference);
        return transactionId;
    }
}
