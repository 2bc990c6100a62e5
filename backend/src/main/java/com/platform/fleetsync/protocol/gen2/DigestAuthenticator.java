package com.platform.fleetsync.protocol.gen2;

import com.platform.fleetsync.protocol.DeviceCredential;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Computes digest {@code Authorization} headers for one credential.
 * The nonce count restarts whenever the server issues a new nonce.
 */
public class DigestAuthenticator {
    
    private static final SecureRandom RANDOM = new SecureRandom();
    
    private final DeviceCredential credential;
    private String currentNonce;
    private int nonceCount;
    
    public DigestAuthenticator(DeviceCredential credential) {
        this.credential = credential;
    }
    
    public synchronized String authorize(DigestChallenge challenge, String method, String uri) {
        return authorize(challenge, method, uri, newCnonce());
    }
    
    synchronized String authorize(DigestChallenge challenge, String method, String uri, String cnonce) {
        if (!challenge.nonce().equals(currentNonce)) {
            currentNonce = challenge.nonce();
            nonceCount = 0;
        }
        nonceCount++;
        String nc = String.format("%08x", nonceCount);
        
        String algorithm = challenge.algorithm();
        String ha1 = hash(algorithm, credential.username() + ":" + challenge.realm() + ":" + credential.password());
        String ha2 = hash(algorithm, method + ":" + uri);
        
        String response;
        if (challenge.qop() != null) {
            response = hash(algorithm,
                ha1 + ":" + challenge.nonce() + ":" + nc + ":" + cnonce + ":" + challenge.qop() + ":" + ha2);
        } else {
            response = hash(algorithm, ha1 + ":" + challenge.nonce() + ":" + ha2);
        }
        
        StringBuilder header = new StringBuilder()
            .append("Digest username=\"").append(credential.username()).append('"')
            .append(", realm=\"").append(challenge.realm()).append('"')
            .append(", nonce=\"").append(challenge.nonce()).append('"')
            .append(", uri=\"").append(uri).append('"')
            .append(", response=\"").append(response).append('"');
        if (!"MD5".equals(algorithm)) {
            header.append(", algorithm=").append(algorithm);
        }
        if (challenge.qop() != null) {
            header.append(", qop=").append(challenge.qop())
                .append(", nc=").append(nc)
                .append(", cnonce=\"").append(cnonce).append('"');
        }
        if (challenge.opaque() != null) {
            header.append(", opaque=\"").append(challenge.opaque()).append('"');
        }
        return header.toString();
    }
    
    static String hash(String algorithm, String data) {
        String jcaName = "SHA-256".equals(algorithm) ? "SHA-256" : "MD5";
        try {
            MessageDigest md = MessageDigest.getInstance(jcaName);
            return HexFormat.of().formatHex(md.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(jcaName + " not available", e);
        }
    }
    
    private static String newCnonce() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
