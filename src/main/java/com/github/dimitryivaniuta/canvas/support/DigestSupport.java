package com.github.dimitryivaniuta.canvas.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Non-reversible fingerprints for credentials and cache keys. Output is lowercase hex.
 */
public final class DigestSupport {
    private DigestSupport() {}

    public static String sha1Hex(String input) {
        return hex("SHA-1", input);
    }

    public static String md5Hex(String input) {
        return hex("MD5", input);
    }

    /** First {@code length} hex chars of a digest; the whole digest when it is shorter. */
    public static String prefix(String hex, int length) {
        return hex.length() <= length ? hex : hex.substring(0, length);
    }

    private static String hex(String algorithm, String input) {
        try {
            MessageDigest md = MessageDigest.getInstance(algorithm);
            return toHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Digest algorithm not available: " + algorithm, e);
        }
    }

    private static String toHex(byte[] b) {
        StringBuilder sb = new StringBuilder(b.length * 2);
        for (byte x : b) sb.append(String.format("%02x", x));
        return sb.toString();
    }
}
