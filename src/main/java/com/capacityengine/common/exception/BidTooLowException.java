package com.capacityengine.common.exception;

/**
 * Thrown when a bid does not beat the current best price or the auction floor.
 */
public class BidTooLowException extends CapacityEngineException {

    public BidTooLowException(long auctionId, long amount, long required, boolean firstBid) {
        super(ErrorCode.BID_TOO_LOW, firstBid
            ? String.format("Bid %d on auction %d is below the minimal bid %d", amount, auctionId, required)
            : String.format("Bid %d on auction %d must exceed the best price %d", amount, auctionId, required));
    }
}
