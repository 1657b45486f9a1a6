package com.capacityengine.delegation;

/**
 * Decides whether a delegate may act on a subscription owned by someone else.
 *
 * Implementations must only ever allow {@link Capability#USE_SUBSCRIPTION}, and only for
 * the exact subscription the owner granted.
 */
public interface DelegationFilter {

    boolean mayUse(String delegate, String owner, int localId, Capability capability);
}
