package com.capacityengine.currency;

import com.capacityengine.common.exception.InsufficientBalanceException;

/**
 * Balance operations the capacity engine needs from the surrounding currency system.
 *
 * Every call is atomic: it either applies completely or throws and changes nothing.
 * The {@code reference} names the engine object the movement belongs to and is kept
 * for audit only.
 */
public interface CurrencyAdapter {

    /**
     * Move {@code amount} from the account's free balance to its reserved balance.
     *
     * @throws InsufficientBalanceException if the free balance is smaller than the amount
     */
    void reserve(String accountId, long amount, String reference);

    /**
     * Return a previous reservation to the free balance.
     */
    void unreserve(String accountId, long amount, String reference);

    /**
     * Destroy reserved funds.
     *
     * @throws InsufficientBalanceException if the reserved balance is smaller than the amount
     */
    void burnReserved(String accountId, long amount, String reference);

    /**
     * Move free funds between two accounts. The destination is created when missing.
     *
     * @throws InsufficientBalanceException if the source cannot cover the amount
     */
    void transfer(String fromAccountId, String toAccountId, long amount, String reference);

    long getFreeBalance(String accountId);

    long getReservedBalance(String accountId);
}
