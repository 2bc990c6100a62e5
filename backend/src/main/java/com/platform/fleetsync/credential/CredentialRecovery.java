package com.platform.fleetsync.credential;

import com.platform.fleetsync.protocol.DeviceCredential;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Credential recovery for a single logical operation against one device.
 * 
 * The machine starts in {@link CredentialState#NO_CREDENTIAL} and picks the
 * saved credential, the fallback credential, or no credential at all. An auth
 * failure moves it forward at most once; it never re-enters a state it has left,
 * so an operation makes at most {@link #MAX_ATTEMPTS} authentication attempts.
 * 
 * Not thread-safe; create one per operation.
 */
public final class CredentialRecovery {
    
    public static final int MAX_ATTEMPTS = 2;
    
    public record Transition(CredentialState from, CredentialState to, String reason) {
    }
    
    private final DeviceCredential saved;
    private final DeviceCredential fallback;
    private final List<Transition> transitions = new ArrayList<>();
    
    private CredentialState state = CredentialState.NO_CREDENTIAL;
    private int attempts;
    private boolean fallbackTried;
    private boolean clearSavedRequired;
    
    private CredentialRecovery(DeviceCredential saved, DeviceCredential fallback) {
        this.saved = saved;
        this.fallback = fallback;
    }
    
    /**
     * @param saved          credential stored on the device record, may be null
     * @param deviceAuthEnabled whether the device reported auth as enabled
     * @param fallback       fleet-wide credential, null when disabled
     */
    public static CredentialRecovery start(DeviceCredential saved, boolean deviceAuthEnabled,
                                           DeviceCredential fallback) {
        CredentialRecovery recovery = new CredentialRecovery(saved, fallback);
        if (saved != null) {
            recovery.moveTo(CredentialState.USING_SAVED, "saved credential present");
        } else if (deviceAuthEnabled && fallback != null) {
            recovery.moveTo(CredentialState.USING_FALLBACK, "device requires auth, no saved credential");
            recovery.fallbackTried = true;
        }
        return recovery;
    }
    
    /**
     * Credential for the next attempt; null means an unauthenticated call.
     * Counts the attempt.
     */
    public DeviceCredential nextAttempt() {
        if (state.isTerminal()) {
            throw new IllegalStateException("Credential recovery already finished in state " + state);
        }
        if (attempts >= MAX_ATTEMPTS) {
            throw new IllegalStateException("Credential recovery exceeded " + MAX_ATTEMPTS + " attempts");
        }
        attempts++;
        return currentCredential();
    }
    
    public DeviceCredential currentCredential() {
        return switch (state) {
            case USING_SAVED -> saved;
            case USING_FALLBACK -> fallback;
            default -> null;
        };
    }
    
    /**
     * The last attempt succeeded.
     * 
     * @return the credential to persist on the device record, or null when nothing changes
     */
    public DeviceCredential onSuccess() {
        CredentialState previous = state;
        moveTo(CredentialState.VERIFIED, "call succeeded");
        return previous == CredentialState.USING_FALLBACK ? fallback : null;
    }
    
    /**
     * The last attempt was rejected.
     * 
     * @return true when another attempt should be made
     */
    public boolean onAuthFailure() {
        switch (state) {
            case USING_SAVED -> {
                clearSavedRequired = true;
                if (canUseFallback()) {
                    fallbackTried = true;
                    moveTo(CredentialState.USING_FALLBACK, "saved credential rejected");
                } else {
                    moveTo(CredentialState.FAILED, "saved credential rejected, no fallback");
                }
            }
            case NO_CREDENTIAL -> {
                if (canUseFallback()) {
                    fallbackTried = true;
                    moveTo(CredentialState.USING_FALLBACK, "device requires auth");
                } else {
                    moveTo(CredentialState.FAILED, "device requires auth, no fallback");
                }
            }
            case USING_FALLBACK -> moveTo(CredentialState.FAILED, "fallback credential rejected");
            default -> throw new IllegalStateException("Auth failure reported in terminal state " + state);
        }
        return state != CredentialState.FAILED;
    }
    
    private boolean canUseFallback() {
        return fallback != null && !fallbackTried && attempts < MAX_ATTEMPTS;
    }
    
    private void moveTo(CredentialState target, String reason) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Invalid credential transition " + state + " -> " + target);
        }
        transitions.add(new Transition(state, target, reason));
        state = target;
    }
    
    public CredentialState getState() {
        return state;
    }
    
    public int getAttempts() {
        return attempts;
    }
    
    /**
     * True once the saved credential was rejected and must be removed from the record.
     */
    public boolean isClearSavedRequired() {
        return clearSavedRequired;
    }
    
    public List<Transition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }
}
