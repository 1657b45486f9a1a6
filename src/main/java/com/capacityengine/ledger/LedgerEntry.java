package com.capacityengine.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable journal line for one wallet movement.
 *
 * Transfers produce a DEBIT and a CREDIT sharing one transaction id; reserve, unreserve
 * and burn produce a single line on the affected wallet. Entries are append-only.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_transaction_id", columnList = "transaction_id"),
    @Index(name = "idx_ledger_account_id", columnList = "account_id"),
    @Index(name = "idx_ledger_reference", columnList = "txn_reference")
})
@Data
@NoArgsConstructor
public class LedgerEntry {

    @Id
    private String entryId;

    /**
     * The movement this entry belongs to. Both sides of a transfer share it.
     */
    @Column(name = "transaction_id", nullable = false)
    private String transactionId;

    /**
     * The wallet affected by this entry.
     */
    @Column(name = "account_id", nullable = false)
    private String accountId;

    /**
     * Type of entry: DEBIT or CREDIT.
     */
    @Enumerated(EnumType.STRING)
    private EntryType entryType;

    /**
     * Amount moved, in the smallest currency unit.
     */
    private long amount;

    /**
     * Kind of movement this entry records.
     */
    @Enumerated(EnumType.STRING)
    private TransactionType transactionType;

    /**
     * What caused the movement, e.g. {@code auction:3} or {@code lock:alice/0}.
     */
    @Column(name = "txn_reference")
    private String reference;

    /**
     * Description or memo for this entry.
     */
    private String description;

    /**
     * When the entry was written. Entries are never updated.
     */
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(String transactionId, String accountId, EntryType entryType, long amount,
                       TransactionType transactionType, String reference, String description,
                       Instant createdAt) {
        this.entryId = UUID.randomUUID().toString();
        this.transactionId = transactionId;
        this.accountId = accountId;
        this.entryType = entryType;
        this.amount = amount;
        this.transactionType = transactionType;
        this.reference = reference;
        this.description = description;
        this.createdAt = createdAt;
    }

    public enum EntryType {
        DEBIT,
        CREDIT
    }
}
