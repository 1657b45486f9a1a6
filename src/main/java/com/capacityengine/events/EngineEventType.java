package com.capacityengine.events;

public enum EngineEventType {
    AUCTION_STARTED,
    NEW_BID,
    AUCTION_FINISHED,
    SUBSCRIPTION_ACTIVATED,
    SUBSCRIPTION_STOPPED,
    USAGE_RECORDED,
    ACCOUNTING_DISCREPANCY,
    ACCESS_GRANTED,
    ACCESS_REVOKED
}
