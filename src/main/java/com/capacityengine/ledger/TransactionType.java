package com.capacityengine.ledger;

/**
 * Types of currency movements recorded in the ledger.
 */
public enum TransactionType {
    DEPOSIT,
    RESERVE,
    UNRESERVE,
    BURN,
    TRANSFER
}
