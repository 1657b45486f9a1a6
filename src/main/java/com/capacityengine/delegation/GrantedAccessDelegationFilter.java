package com.capacityengine.delegation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Delegation filter backed by explicit access grants.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GrantedAccessDelegationFilter implements DelegationFilter {

    private final AccessGrantRepository accessGrantRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean mayUse(String delegate, String owner, int localId, Capability capability) {
        if (capability != Capability.USE_SUBSCRIPTION) {
            log.debug("Refused {} for delegate {} on {}/{}", capability, delegate, owner, localId);
            return false;
        }
        return accessGrantRepository.existsByOwnerAndLocalIdAndDelegate(owner, localId, delegate);
    }
}
