package com.capsulo.cms.core.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Login names keyed by a fingerprint of the token that produced them. Raw tokens are never
 * stored. Entries live until {@link #invalidate} or process exit.
 */
public final class IdentityCache {

    private final Map<String, String> logins = new ConcurrentHashMap<>();

    /**
     * Returns the cached login for {@code token}, calling {@code lookup} on a miss. Two callers
     * missing at the same time may both call {@code lookup}; the answer is the same either way.
     */
    public String get(String token, Supplier<String> lookup) {
        String key = fingerprint(token);
        String cached = logins.get(key);
        if (cached != null) return cached;

        String login = lookup.get();
        logins.put(key, login);
        return login;
    }

    public void invalidate(String token) {
        logins.remove(fingerprint(token));
    }

    public int size() {
        return logins.size();
    }

    static String fingerprint(String token) {
        if (token == null) throw new IllegalArgumentException("token is required");
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
