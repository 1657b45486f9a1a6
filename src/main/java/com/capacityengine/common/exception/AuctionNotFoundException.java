package com.capacityengine.common.exception;

/**
 * Thrown when an auction id does not exist.
 */
public class AuctionNotFoundException extends CapacityEngineException {

    public AuctionNotFoundException(long auctionId) {
        super(ErrorCode.NOT_FOUND, "Auction not found: " + auctionId);
    }
}
