package decentralabs.gmp.util;

import java.math.BigInteger;

/**
 * Helpers for u64 wire values carried in Java {@code long}s.
 */
public final class Uint64 {

    public static final BigInteger MAX = new BigInteger("18446744073709551615");

    private Uint64() {
    }

    public static BigInteger toBigInteger(long value) {
        return new BigInteger(Long.toUnsignedString(value));
    }

    public static long fromBigInteger(BigInteger value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " cannot be null");
        }
        if (value.signum() < 0 || value.compareTo(MAX) > 0) {
            throw new IllegalArgumentException(fieldName + " must fit in an unsigned 64-bit integer: " + value);
        }
        return value.longValue();
    }

    public static long parse(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " cannot be null or empty");
        }
        try {
            return fromBigInteger(new BigInteger(value.trim()), fieldName);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(fieldName + " must be a valid number: " + value, ex);
        }
    }

    public static String toString(long value) {
        return Long.toUnsignedString(value);
    }
}
