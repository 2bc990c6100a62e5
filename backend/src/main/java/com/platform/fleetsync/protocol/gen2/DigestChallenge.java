package com.platform.fleetsync.protocol.gen2;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed {@code WWW-Authenticate: Digest ...} challenge (RFC 2617).
 *
 * @param qop       "auth" when offered, otherwise null
 * @param algorithm MD5 unless the device asks for SHA-256
 * @param stale     nonce expired; credentials were not rejected
 */
public record DigestChallenge(String realm, String nonce, String qop, String opaque, String algorithm,
        boolean stale) {
    
    private static final String PREFIX = "digest ";
    
    /**
     * @throws IllegalArgumentException when the header is not a digest challenge or lacks realm or nonce
     */
    public static DigestChallenge parse(String header) {
        if (header == null || !header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            throw new IllegalArgumentException("not a digest challenge");
        }
        Map<String, String> params = parseParams(header.substring(PREFIX.length()));
        
        String realm = params.get("realm");
        String nonce = params.get("nonce");
        if (realm == null || realm.isEmpty() || nonce == null || nonce.isEmpty()) {
            throw new IllegalArgumentException("incomplete digest challenge");
        }
        
        String qop = null;
        String offered = params.get("qop");
        if (offered != null) {
            for (String option : offered.split(",")) {
                if ("auth".equalsIgnoreCase(option.trim())) {
                    qop = "auth";
                }
            }
        }
        
        String algorithm = params.getOrDefault("algorithm", "MD5").toUpperCase(Locale.ROOT);
        boolean stale = "true".equalsIgnoreCase(params.get("stale"));
        return new DigestChallenge(realm, nonce, qop, params.get("opaque"), algorithm, stale);
    }
    
    /**
     * Split comma-separated key=value pairs, honouring commas inside quoted values.
     */
    private static Map<String, String> parseParams(String input) {
        Map<String, String> params = new HashMap<>();
        int i = 0;
        int length = input.length();
        while (i < length) {
            while (i < length && (input.charAt(i) == ',' || Character.isWhitespace(input.charAt(i)))) {
                i++;
            }
            int eq = input.indexOf('=', i);
            if (eq < 0) {
                break;
            }
            String key = input.substring(i, eq).trim().toLowerCase(Locale.ROOT);
            i = eq + 1;
            String value;
            if (i < length && input.charAt(i) == '"') {
                int end = input.indexOf('"', i + 1);
                if (end < 0) {
                    end = length;
                }
                value = input.substring(i + 1, end);
                i = end + 1;
            } else {
                int end = input.indexOf(',', i);
                if (end < 0) {
                    end = length;
                }
                value = input.substring(i, end).trim();
                i = end;
            }
            params.put(key, value);
        }
        return params;
    }
}
