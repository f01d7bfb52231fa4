package net.miragecodex.util;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * Identifier utilities
 * - time-ordered UUID v7 row ids, so creation order survives in primary keys
 * - short base62 tokens used to disambiguate generated pen names
 */
public final class IdGenerator {
    private static final char[] BASE62_ALPHABET =
            "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();
    private static final int PEN_NAME_SUFFIX_SIZE = 4;

    // Single SecureRandom instance; thread-safe for concurrent use
    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {}

    /** Random base62 token of the given size */
    public static String generate(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        char[] id = new char[size];
        for (int i = 0; i < size; i++) {
            id[i] = BASE62_ALPHABET[RANDOM.nextInt(BASE62_ALPHABET.length)];
        }
        return new String(id);
    }

    /** Suffix appended to a pen name that collided with an existing author */
    public static String penNameSuffix() {
        return generate(PEN_NAME_SUFFIX_SIZE);
    }

    /** Time-ordered epoch UUID v7 */
    public static UUID uuidV7() {
        long ts = System.currentTimeMillis() & 0xFFFFFFFFFFFFL; // 48-bit millis
        int randA = RANDOM.nextInt(1 << 12) & 0x0FFF;            // 12-bit random

        long msb = (ts << 16) | (0x7L << 12) | randA;           // 48 ts | ver=7 | randA

        long randB = RANDOM.nextLong();
        long lsb = (randB & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L; // variant 10 + 62-bit rand

        return new UUID(msb, lsb);
    }
}
