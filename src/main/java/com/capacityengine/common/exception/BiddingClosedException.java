package com.capacityengine.common.exception;

/**
 * Thrown when a bid arrives after the bidding window has closed.
 */
public class BiddingClosedException extends CapacityEngineException {

    public BiddingClosedException(long auctionId) {
        super(ErrorCode.BIDDING_CLOSED, "Bidding is closed for auction " + auctionId);
    }
}
