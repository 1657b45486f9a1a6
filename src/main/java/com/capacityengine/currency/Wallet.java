package com.capacityengine.currency;

import com.capacityengine.common.exception.InsufficientBalanceException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Balance holder for one account: free funds and funds reserved by open bids.
 */
@Entity
@Table(name = "wallets")
@Data
@NoArgsConstructor
public class Wallet {

    @Id
    private String accountId;

    @Column(name = "free_balance", nullable = false)
    private long freeBalance;

    @Column(name = "reserved_balance", nullable = false)
    private long reservedBalance;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Wallet(String accountId, long initialBalance, Instant now) {
        if (initialBalance < 0) {
            throw new IllegalArgumentException("Initial balance cannot be negative");
        }
        this.accountId = accountId;
        this.freeBalance = initialBalance;
        this.reservedBalance = 0;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public void reserve(long amount, Instant now) {
        requirePositive(amount);
        if (freeBalance < amount) {
            throw new InsufficientBalanceException(accountId, amount, freeBalance);
        }
        freeBalance -= amount;
        reservedBalance += amount;
        this.updatedAt = now;
    }

    public void unreserve(long amount, Instant now) {
        requirePositive(amount);
        if (reservedBalance < amount) {
            throw new IllegalStateException(String.format(
                "Cannot unreserve %d from wallet %s holding %d reserved", amount, accountId, reservedBalance));
        }
        reservedBalance -= amount;
        freeBalance = Math.addExact(freeBalance, amount);
        this.updatedAt = now;
    }

    public void burnReserved(long amount, Instant now) {
        requirePositive(amount);
        if (reservedBalance < amount) {
            throw new InsufficientBalanceException(accountId, amount, reservedBalance);
        }
        reservedBalance -= amount;
        this.updatedAt = now;
    }

    public void debit(long amount, Instant now) {
        requirePositive(amount);
        if (freeBalance < amount) {
            throw new InsufficientBalanceException(accountId, amount, freeBalance);
        }
        freeBalance -= amount;
        this.updatedAt = now;
    }

    public void credit(long amount, Instant now) {
        requirePositive(amount);
        freeBalance = Math.addExact(freeBalance, amount);
        this.updatedAt = now;
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }
}
