package com.capacityengine.common.exception;

/**
 * Thrown when a wallet does not exist.
 */
public class WalletNotFoundException extends CapacityEngineException {

    public WalletNotFoundException(String accountId) {
        super(ErrorCode.NOT_FOUND, "Wallet not found: " + accountId);
    }
}
