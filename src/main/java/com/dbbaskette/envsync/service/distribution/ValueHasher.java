package com.dbbaskette.envsync.service.distribution;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints of secret values. Only these ever reach storage.
 */
public final class ValueHasher {

    private static final int FINGERPRINT_LENGTH = 8;

    private ValueHasher() {}

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Short prefix of a hash, safe to show in reports. */
    public static String fingerprint(String hash) {
        if (hash == null) return null;
        return hash.length() <= FINGERPRINT_LENGTH ? hash : hash.substring(0, FINGERPRINT_LENGTH);
    }
}
