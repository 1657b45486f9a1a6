package com.capacityengine.common.exception;

/**
 * Thrown when an auction has already produced its subscription.
 */
public class AlreadyClaimedException extends CapacityEngineException {

    public AlreadyClaimedException(long auctionId) {
        super(ErrorCode.ALREADY_CLAIMED, "Auction already claimed: " + auctionId);
    }
}
