package com.capacityengine.common.exception;

/**
 * Thrown when a wallet cannot cover a reserve, transfer or burn.
 */
public class InsufficientBalanceException extends CapacityEngineException {

    public InsufficientBalanceException(String accountId, long required, long available) {
        super(ErrorCode.INSUFFICIENT_BALANCE,
            String.format("Insufficient balance in wallet %s. Required: %d, Available: %d",
                accountId, required, available));
    }
}
