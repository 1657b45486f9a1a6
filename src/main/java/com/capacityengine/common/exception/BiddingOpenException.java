package com.capacityengine.common.exception;

/**
 * Thrown when an auction is claimed before its bidding window has closed.
 */
public class BiddingOpenException extends CapacityEngineException {

    public BiddingOpenException(long auctionId) {
        super(ErrorCode.BIDDING_OPEN, "Bidding is still open for auction " + auctionId);
    }
}
