package com.platform.fleetsync.protocol.gen2;

import com.platform.fleetsync.protocol.DeviceCredential;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DigestAuthenticatorTest {

    private static final DigestChallenge RFC_CHALLENGE = new DigestChallenge(
        "testrealm@host.com", "dcd98b7102dd2f0e8b11d0f600bfb0c093", "auth",
        "5ccc069c403ebaf9f0171e9517f40e41", "MD5", false);

    @Test
    void authorize_rfc2617Example_producesKnownResponse() {
        DigestAuthenticator authenticator = new DigestAuthenticator(new DeviceCredential("Mufasa", "Circle Of Life"));

        String header = authenticator.authorize(RFC_CHALLENGE, "GET", "/dir/index.html", "0a4f113b");

        assertThat(header)
            .startsWith("Digest username=\"Mufasa\"")
            .contains("response=\"6629fae49393a05397450978507c4ef1\"")
            .contains("nc=00000001")
            .contains("cnonce=\"0a4f113b\"")
            .contains("opaque=\"5ccc069c403ebaf9f0171e9517f40e41\"")
            .doesNotContain("algorithm=");
    }

    @Test
    void authorize_sameNonce_incrementsNonceCount() {
        DigestAuthenticator authenticator = new DigestAuthenticator(new DeviceCredential("admin", "secret"));

        authenticator.authorize(RFC_CHALLENGE, "POST", "/rpc", "c1");
        String second = authenticator.authorize(RFC_CHALLENGE, "POST", "/rpc", "c2");

        assertThat(second).contains("nc=00000002");
    }

    @Test
    void authorize_newNonce_restartsNonceCount() {
        DigestAuthenticator authenticator = new DigestAuthenticator(new DeviceCredential("admin", "secret"));
        DigestChallenge fresh = new DigestChallenge("testrealm@host.com", "other-nonce", "auth", null, "MD5", true);

        authenticator.authorize(RFC_CHALLENGE, "POST", "/rpc", "c1");
        String header = authenticator.authorize(fresh, "POST", "/rpc", "c2");

        assertThat(header).contains("nc=00000001").contains("nonce=\"other-nonce\"");
    }

    @Test
    void authorize_sha256Challenge_namesAlgorithm() {
        DigestAuthenticator authenticator = new DigestAuthenticator(new DeviceCredential("admin", "secret"));
        DigestChallenge challenge = new DigestChallenge("shelly", "abc", "auth", null, "SHA-256", false);

        String header = authenticator.authorize(challenge, "POST", "/rpc", "c1");

        String ha1 = DigestAuthenticator.hash("SHA-256", "admin:shelly:secret");
        String ha2 = DigestAuthenticator.hash("SHA-256", "POST:/rpc");
        String expected = DigestAuthenticator.hash("SHA-256", ha1 + ":abc:00000001:c1:auth:" + ha2);
        assertThat(header).contains("algorithm=SHA-256").contains("response=\"" + expected + "\"");
        assertThat(expected).hasSize(64);
    }
}
