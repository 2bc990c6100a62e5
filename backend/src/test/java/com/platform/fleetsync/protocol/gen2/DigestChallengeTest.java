package com.platform.fleetsync.protocol.gen2;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DigestChallengeTest {

    @Test
    void parse_withQuotedParameters_extractsAllFields() {
        DigestChallenge challenge = DigestChallenge.parse(
            "Digest qop=\"auth\", realm=\"shellyplus1-a8032ab12345\", nonce=\"60dc59c1\", algorithm=SHA-256");

        assertThat(challenge.realm()).isEqualTo("shellyplus1-a8032ab12345");
        assertThat(challenge.nonce()).isEqualTo("60dc59c1");
        assertThat(challenge.qop()).isEqualTo("auth");
        assertThat(challenge.algorithm()).isEqualTo("SHA-256");
        assertThat(challenge.stale()).isFalse();
    }

    @Test
    void parse_withoutAlgorithm_defaultsToMd5() {
        DigestChallenge challenge = DigestChallenge.parse("Digest realm=\"r\", nonce=\"n\"");

        assertThat(challenge.algorithm()).isEqualTo("MD5");
        assertThat(challenge.qop()).isNull();
        assertThat(challenge.opaque()).isNull();
    }

    @Test
    void parse_withCommaInsideQuotedQop_picksAuth() {
        DigestChallenge challenge = DigestChallenge.parse(
            "digest realm=\"r\", qop=\"auth,auth-int\", nonce=\"n\", opaque=\"o\", stale=TRUE");

        assertThat(challenge.qop()).isEqualTo("auth");
        assertThat(challenge.opaque()).isEqualTo("o");
        assertThat(challenge.stale()).isTrue();
    }

    @Test
    void parse_withoutNonce_isRejected() {
        assertThatThrownBy(() -> DigestChallenge.parse("Digest realm=\"r\""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse_basicChallenge_isRejected() {
        assertThatThrownBy(() -> DigestChallenge.parse("Basic realm=\"r\""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
