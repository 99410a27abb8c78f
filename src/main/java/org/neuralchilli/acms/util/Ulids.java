package org.neuralchilli.acms.util;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Instant;

/**
 * ULID helpers: 26-character, lexicographically sortable identifiers made of a 48-bit
 * millisecond timestamp and 80 bits of randomness, encoded in Crockford base32.
 * Used for task and run trace ids.
 */
public final class Ulids {

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();

    private static final int TIMESTAMP_LENGTH = 10;
    private static final int RANDOMNESS_LENGTH = 16;
    public static final int LENGTH = TIMESTAMP_LENGTH + RANDOMNESS_LENGTH;

    private static final long MAX_TIMESTAMP = (1L << 48) - 1;
    private static final BigInteger MAX_RANDOMNESS = BigInteger.ONE.shiftLeft(80).subtract(BigInteger.ONE);
    private static final int RANDOMNESS_BYTES = 10;

    private static final SecureRandom RANDOM = new SecureRandom();

    private Ulids() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Generate a ULID for the current instant.
     */
    public static String newUlid() {
        return newUlid(Instant.now());
    }

    /**
     * Generate a ULID for the given instant with fresh randomness.
     */
    public static String newUlid(Instant timestamp) {
        byte[] randomness = new byte[RANDOMNESS_BYTES];
        RANDOM.nextBytes(randomness);
        return newUlid(timestamp, randomness);
    }

    /**
     * Generate a ULID from explicit parts.
     *
     * @param randomness exactly 10 bytes
     */
    public static String newUlid(Instant timestamp, byte[] randomness) {
        if (randomness == null || randomness.length != RANDOMNESS_BYTES) {
            throw new IllegalArgumentException("ULID randomness must be exactly 10 bytes");
        }
        return encode(timestamp.toEpochMilli(), new BigInteger(1, randomness));
    }

    /**
     * Check whether a string is a well-formed ULID.
     */
    public static boolean isValid(String candidate) {
        if (candidate == null || candidate.length() != LENGTH) {
            return false;
        }
        for (int i = 0; i < LENGTH; i++) {
            if (indexOf(candidate.charAt(i)) < 0) {
                return false;
            }
        }
        return decode(candidate.substring(0, TIMESTAMP_LENGTH)).compareTo(BigInteger.valueOf(MAX_TIMESTAMP)) <= 0;
    }

    /**
     * Extract the timestamp component of a ULID.
     *
     * @throws IllegalArgumentException if the value is not a valid ULID
     */
    public static Instant timestampOf(String ulid) {
        if (!isValid(ulid)) {
            throw new IllegalArgumentException("Not a valid ULID: " + ulid);
        }
        return Instant.ofEpochMilli(decode(ulid.substring(0, TIMESTAMP_LENGTH)).longValueExact());
    }

    /**
     * Create a generator whose ULIDs stay strictly increasing within one millisecond.
     */
    public static MonotonicGenerator monotonic() {
        return new MonotonicGenerator();
    }

    static String encode(long timestampMillis, BigInteger randomness) {
        if (timestampMillis < 0 || timestampMillis > MAX_TIMESTAMP) {
            throw new IllegalArgumentException("Timestamp out of ULID range: " + timestampMillis);
        }
        if (randomness.signum() < 0 || randomness.compareTo(MAX_RANDOMNESS) > 0) {
            throw new IllegalArgumentException("Randomness out of ULID range");
        }
        return encode(BigInteger.valueOf(timestampMillis), TIMESTAMP_LENGTH) +
                encode(randomness, RANDOMNESS_LENGTH);
    }

    private static String encode(BigInteger value, int length) {
        char[] chars = new char[length];
        BigInteger remaining = value;
        for (int i = length - 1; i >= 0; i--) {
            chars[i] = ALPHABET[remaining.intValue() & 0x1F];
            remaining = remaining.shiftRight(5);
        }
        return new String(chars);
    }

    private static BigInteger decode(String encoded) {
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < encoded.length(); i++) {
            value = value.shiftLeft(5).or(BigInteger.valueOf(indexOf(encoded.charAt(i))));
        }
        return value;
    }

    private static int indexOf(char c) {
        for (int i = 0; i < ALPHABET.length; i++) {
            if (ALPHABET[i] == c) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Thread-safe generator that increments the randomness component when called
     * repeatedly within the same millisecond.
     */
    public static final class MonotonicGenerator {

        private long lastTimestamp = -1;
        private BigInteger lastRandomness = BigInteger.ZERO;

        private MonotonicGenerator() {
        }

        public synchronized String next() {
            return next(Instant.now().toEpochMilli());
        }

        synchronized String next(long timestampMillis) {
            if (timestampMillis == lastTimestamp) {
                lastRandomness = lastRandomness.add(BigInteger.ONE).and(MAX_RANDOMNESS);
            } else {
                byte[] randomness = new byte[RANDOMNESS_BYTES];
                RANDOM.nextBytes(randomness);
                lastTimestamp = timestampMillis;
                lastRandomness = new BigInteger(1, randomness);
            }
            return encode(lastTimestamp, lastRandomness);
        }
    }
}
