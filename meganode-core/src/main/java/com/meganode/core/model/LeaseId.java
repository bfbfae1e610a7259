package com.meganode.core.model;

/**
 * Capability token issued by the fleet manager that scopes one admission.
 * The meganode compares lease ids for equality only; it never validates them.
 */
public record LeaseId(int value) {

    public static final long MAX_UNSIGNED = 0xFFFF_FFFFL;

    public static LeaseId of(int value) {
        return new LeaseId(value);
    }

    /**
     * Lease id from its unsigned 32-bit wire form.
     */
    public static LeaseId fromUnsigned(long value) {
        if (value < 0 || value > MAX_UNSIGNED) {
            throw new IllegalArgumentException("Lease id out of range: " + value);
        }
        return new LeaseId((int) value);
    }

    public long unsignedValue() {
        return Integer.toUnsignedLong(value);
    }

    @Override
    public String toString() {
        return Integer.toUnsignedString(value);
    }
}
