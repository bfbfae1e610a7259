package com.meganode.core.model;

import java.util.HexFormat;
import java.util.Locale;

/**
 * A user's public key: the stable identity of a user whose node may run
 * inside this meganode.
 *
 * Invariants:
 * - exactly 32 bytes, stored as 64 lowercase hex characters
 */
public record UserPk(String hex) implements Comparable<UserPk> {

    public static final int LENGTH_BYTES = 32;

    private static final HexFormat HEX = HexFormat.of();

    public UserPk {
        if (hex == null) {
            throw new IllegalArgumentException("User pk must not be null");
        }
        hex = hex.toLowerCase(Locale.ROOT);
        if (hex.length() != LENGTH_BYTES * 2) {
            throw new IllegalArgumentException(
                "User pk must be " + LENGTH_BYTES + " bytes, got hex of length " + hex.length());
        }
        // Throws IllegalArgumentException on non-hex input
        HEX.parseHex(hex);
    }

    public static UserPk fromHex(String hex) {
        return new UserPk(hex);
    }

    public static UserPk fromBytes(byte[] bytes) {
        if (bytes.length != LENGTH_BYTES) {
            throw new IllegalArgumentException(
                "User pk must be " + LENGTH_BYTES + " bytes, got " + bytes.length);
        }
        return new UserPk(HEX.formatHex(bytes));
    }

    /**
     * Build a pk whose last eight bytes hold {@code value}. Useful for tests and
     * simulations that need a small, readable set of users.
     */
    public static UserPk fromLong(long value) {
        byte[] bytes = new byte[LENGTH_BYTES];
        for (int i = 0; i < Long.BYTES; i++) {
            bytes[LENGTH_BYTES - 1 - i] = (byte) (value >>> (8 * i));
        }
        return fromBytes(bytes);
    }

    public byte[] toBytes() {
        return HEX.parseHex(hex);
    }

    /**
     * First eight hex characters, for log lines.
     */
    public String shortId() {
        return hex.substring(0, 8);
    }

    @Override
    public int compareTo(UserPk other) {
        return hex.compareTo(other.hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
