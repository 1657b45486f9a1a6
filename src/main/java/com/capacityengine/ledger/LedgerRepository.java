package com.capacityengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ledger entries.
 */
@Repository
public interface LedgerRepository extends JpaRepository<LedgerEntry, String> {

    List<LedgerEntry> findByAccountIdOrderByCreatedAtDesc(String accountId);

    List<LedgerEntry> findByTransactionId(String transactionId);

    List<LedgerEntry> findByReferenceOrderByCreatedAtAsc(String reference);
}
