package com.capacityengine.common;

import com.capacityengine.common.exception.BadOriginException;
import lombok.Value;

/**
 * Who is calling: a signed account, possibly privileged, or nobody.
 */
@Value
public class Origin {

    String accountId;
    boolean privileged;

    public static Origin signed(String accountId) {
        return new Origin(accountId, false);
    }

    public static Origin privileged(String accountId) {
        return new Origin(accountId, true);
    }

    public static Origin none() {
        return new Origin(null, false);
    }

    /**
     * @return the signing account
     * @throws BadOriginException if the call is unsigned
     */
    public String ensureSigned() {
        if (accountId == null || accountId.isBlank()) {
            throw new BadOriginException("Operation requires a signed origin");
        }
        return accountId;
    }

    public String ensurePrivileged() {
        String account = ensureSigned();
        if (!privileged) {
            throw new BadOriginException("Account " + account + " is not privileged");
        }
        return account;
    }
}
