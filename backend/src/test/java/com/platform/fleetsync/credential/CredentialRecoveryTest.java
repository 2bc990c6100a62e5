package com.platform.fleetsync.credential;

import com.platform.fleetsync.protocol.DeviceCredential;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialRecoveryTest {

    private static final DeviceCredential SAVED = new DeviceCredential("admin", "old");
    private static final DeviceCredential FALLBACK = new DeviceCredential("admin", "fleet");

    @Test
    void savedCredential_accepted_verifiesWithoutPersisting() {
        CredentialRecovery recovery = CredentialRecovery.start(SAVED, true, FALLBACK);

        assertThat(recovery.nextAttempt()).isEqualTo(SAVED);
        assertThat(recovery.onSuccess()).isNull();
        assertThat(recovery.getState()).isEqualTo(CredentialState.VERIFIED);
    }

    @Test
    void savedCredential_rejected_fallsBackOnce() {
        CredentialRecovery recovery = CredentialRecovery.start(SAVED, true, FALLBACK);

        recovery.nextAttempt();
        assertThat(recovery.onAuthFailure()).isTrue();
        assertThat(recovery.isClearSavedRequired()).isTrue();
        assertThat(recovery.nextAttempt()).isEqualTo(FALLBACK);
        assertThat(recovery.onSuccess()).isEqualTo(FALLBACK);
        assertThat(recovery.getAttempts()).isEqualTo(2);
    }

    @Test
    void fallbackRejected_fails() {
        CredentialRecovery recovery = CredentialRecovery.start(SAVED, true, FALLBACK);

        recovery.nextAttempt();
        recovery.onAuthFailure();
        recovery.nextAttempt();

        assertThat(recovery.onAuthFailure()).isFalse();
        assertThat(recovery.getState()).isEqualTo(CredentialState.FAILED);
        assertThatThrownBy(recovery::nextAttempt).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void authEnabledWithoutSavedCredential_startsWithFallback() {
        CredentialRecovery recovery = CredentialRecovery.start(null, true, FALLBACK);

        assertThat(recovery.getState()).isEqualTo(CredentialState.USING_FALLBACK);
        assertThat(recovery.nextAttempt()).isEqualTo(FALLBACK);
        assertThat(recovery.onAuthFailure()).isFalse();
        assertThat(recovery.getAttempts()).isEqualTo(1);
    }

    @Test
    void unauthenticatedCall_rejected_triesFallback() {
        CredentialRecovery recovery = CredentialRecovery.start(null, false, FALLBACK);

        assertThat(recovery.nextAttempt()).isNull();
        assertThat(recovery.onAuthFailure()).isTrue();
        assertThat(recovery.nextAttempt()).isEqualTo(FALLBACK);
    }

    @Test
    void savedRejected_withoutFallback_failsImmediately() {
        CredentialRecovery recovery = CredentialRecovery.start(SAVED, true, null);

        recovery.nextAttempt();

        assertThat(recovery.onAuthFailure()).isFalse();
        assertThat(recovery.isClearSavedRequired()).isTrue();
        assertThat(recovery.getTransitions())
            .extracting(CredentialRecovery.Transition::to)
            .containsExactly(CredentialState.USING_SAVED, CredentialState.FAILED);
    }

    @Test
    void terminalStates_acceptNoTransitions() {
        assertThat(CredentialState.VERIFIED.isTerminal()).isTrue();
        assertThat(CredentialState.FAILED.canTransitionTo(CredentialState.USING_SAVED)).isFalse();
        assertThat(CredentialState.USING_FALLBACK.canTransitionTo(CredentialState.USING_SAVED)).isFalse();
    }
}
