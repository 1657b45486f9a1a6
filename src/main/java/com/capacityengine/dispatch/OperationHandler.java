package com.capacityengine.dispatch;

/**
 * Builds operations of one kind from their request payload.
 */
public interface OperationHandler {

    String getName();

    Operation prepare(String payload);
}
