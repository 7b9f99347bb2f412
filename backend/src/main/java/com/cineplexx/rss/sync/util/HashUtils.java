package com.cineplexx.rss.sync.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class HashUtils {
    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /** Hashes the parts joined with {@code |}; null parts hash as empty strings. */
    public static String sha256Hex(String first, String... rest) {
        StringBuilder raw = new StringBuilder(first == null ? "" : first);
        for (String part : rest) {
            raw.append('|').append(part == null ? "" : part);
        }
        return sha256Hex(raw.toString());
    }
}
