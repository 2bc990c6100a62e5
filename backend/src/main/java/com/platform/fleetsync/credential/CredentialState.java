package com.platform.fleetsync.credential;

import java.util.Map;
import java.util.Set;

/**
 * States of credential recovery for one logical device operation.
 */
public enum CredentialState {
    
    /**
     * Nothing chosen yet, or the call goes out unauthenticated.
     */
    NO_CREDENTIAL,
    
    /**
     * Using the credential saved on the device record.
     */
    USING_SAVED,
    
    /**
     * Using the fleet-wide provisioning credential.
     */
    USING_FALLBACK,
    
    VERIFIED,
    
    FAILED;
    
    private static final Map<CredentialState, Set<CredentialState>> ALLOWED_TRANSITIONS = Map.of(
        NO_CREDENTIAL, Set.of(USING_SAVED, USING_FALLBACK, VERIFIED, FAILED),
        USING_SAVED, Set.of(USING_FALLBACK, VERIFIED, FAILED),
        USING_FALLBACK, Set.of(VERIFIED, FAILED),
        VERIFIED, Set.of(),
        FAILED, Set.of()
    );
    
    public boolean canTransitionTo(CredentialState target) {
        return ALLOWED_TRANSITIONS.get(this).contains(target);
    }
    
    public boolean isTerminal() {
        return ALLOWED_TRANSITIONS.get(this).isEmpty();
    }
}
