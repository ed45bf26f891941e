package decentralabs.gmp.util;

import java.util.Arrays;

import org.web3j.utils.Numeric;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Immutable 32-byte value used for intent ids and canonical addresses.
 *
 * <p>A native address narrower than 32 bytes occupies the low-order bytes, the
 * high-order bytes being zero. The all-zero value is the "any" sentinel.
 */
public final class Bytes32 implements Comparable<Bytes32> {

    public static final int LENGTH = 32;

    public static final Bytes32 ZERO = new Bytes32(new byte[LENGTH]);

    private final byte[] value;

    private Bytes32(byte[] value) {
        this.value = value;
    }

    /**
     * Wraps exactly 32 bytes (copied).
     */
    public static Bytes32 wrap(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Expected 32 bytes, got " + (bytes == null ? "null" : bytes.length));
        }
        return new Bytes32(bytes.clone());
    }

    /**
     * Reads 32 bytes starting at {@code offset}.
     */
    public static Bytes32 read(byte[] buffer, int offset) {
        return new Bytes32(Arrays.copyOfRange(buffer, offset, offset + LENGTH));
    }

    /**
     * Canonicalizes a native address of up to 32 bytes by left-padding with zeros.
     */
    public static Bytes32 fromNative(byte[] nativeAddress) {
        if (nativeAddress == null || nativeAddress.length > LENGTH) {
            throw new IllegalArgumentException("Native address must be at most 32 bytes");
        }
        byte[] padded = new byte[LENGTH];
        System.arraycopy(nativeAddress, 0, padded, LENGTH - nativeAddress.length, nativeAddress.length);
        return new Bytes32(padded);
    }

    /**
     * Parses a hex string, with or without {@code 0x}; shorter values are left-padded
     * (addresses printed with stripped leading zeros are restored).
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Bytes32 fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Hex value cannot be null or empty");
        }
        String clean = Numeric.cleanHexPrefix(hex.trim());
        if (clean.length() > LENGTH * 2) {
            throw new IllegalArgumentException("Hex value longer than 32 bytes: " + LogSanitizer.shortHex(hex));
        }
        if (!clean.matches("[0-9a-fA-F]*")) {
            throw new IllegalArgumentException("Invalid hex value: " + LogSanitizer.shortHex(hex));
        }
        if (clean.length() % 2 != 0) {
            clean = "0" + clean;
        }
        return fromNative(Numeric.hexStringToByteArray(clean));
    }

    /**
     * Recovers a native address of {@code length} bytes from the low-order bytes.
     */
    public byte[] toNative(int length) {
        if (length <= 0 || length > LENGTH) {
            throw new IllegalArgumentException("Native length must be between 1 and 32");
        }
        for (int i = 0; i < LENGTH - length; i++) {
            if (value[i] != 0) {
                throw new IllegalArgumentException("Value does not fit in " + length + " bytes");
            }
        }
        return Arrays.copyOfRange(value, LENGTH - length, LENGTH);
    }

    public byte[] toArray() {
        return value.clone();
    }

    public void writeTo(byte[] buffer, int offset) {
        System.arraycopy(value, 0, buffer, offset, LENGTH);
    }

    public boolean isZero() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @JsonValue
    public String toHex() {
        return Numeric.toHexString(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof Bytes32 && Arrays.equals(value, ((Bytes32) other).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public int compareTo(Bytes32 other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
