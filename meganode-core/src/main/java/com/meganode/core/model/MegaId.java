package com.meganode.core.model;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Identity of one meganode instance, fixed at process start.
 * Requests carrying another meganode's id were misrouted.
 */
public record MegaId(int value) {

    public static final int MAX_VALUE = 0xFFFF;

    public MegaId {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Mega id out of range [0, 65535]: " + value);
        }
    }

    public static MegaId of(int value) {
        return new MegaId(value);
    }

    /**
     * Generate a random mega id, as done once at startup.
     */
    public static MegaId random() {
        return new MegaId(ThreadLocalRandom.current().nextInt(MAX_VALUE + 1));
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
