package net.miragecodex.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers shared by search fingerprinting and advisory lock keys.
 */
public final class HashUtils {

    private static final String SHA_256 = "SHA-256";

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes SHA-256 hash of string data using UTF-8 encoding.
     *
     * @param data String to hash
     * @return SHA-256 hash as byte array
     * @throws IllegalStateException If the JVM does not provide SHA-256
     */
    public static byte[] computeSha256(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(SHA_256);
            return digest.digest(data.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Computes SHA-256 hash of string and returns as hexadecimal string.
     *
     * @param data String to hash
     * @return SHA-256 hash as lowercase hex string (64 characters)
     *
     * @example
     * <pre>{@code
     * String hex = HashUtils.sha256Hex("{\"pageNumber\":1}");
     * }</pre>
     */
    public static String sha256Hex(String data) {
        return bytesToHex(computeSha256(data));
    }

    /**
     * Folds the first eight bytes of the SHA-256 digest into a signed long,
     * suitable for PostgreSQL {@code pg_advisory_lock(bigint)}.
     */
    public static long sha256Long(String data) {
        byte[] hash = computeSha256(data);
        long value = 0L;
        for (int i = 0; i < Long.BYTES; i++) {
            value = (value << 8) | (hash[i] & 0xFFL);
        }
        return value;
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
