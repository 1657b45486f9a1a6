package com.capacityengine.common;

import com.capacityengine.config.CapacityEngineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps the caller header onto an {@link Origin}. Accounts listed as admin accounts
 * are privileged.
 */
@Component
@RequiredArgsConstructor
public class OriginResolver {

    private final CapacityEngineProperties properties;

    public Origin resolve(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            return Origin.none();
        }
        if (properties.getAdminAccounts().contains(accountId)) {
            return Origin.privileged(accountId);
        }
        return Origin.signed(accountId);
    }
}
