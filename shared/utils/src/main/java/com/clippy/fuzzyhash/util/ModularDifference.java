package com.clippy.fuzzyhash.util;

/**
 * Distance between two positions on a ring of {@code ringSize} slots.
 *
 * <p>Values near the wrap point (255 and 0 on a byte ring) are one step apart,
 * not 255.
 */
public final class ModularDifference {

    private ModularDifference() {
    }

    /**
     * Returns {@code min(|b - a|, ringSize - |b - a|)}.
     *
     * @param a        first position, in {@code [0, ringSize)}
     * @param b        second position, in {@code [0, ringSize)}
     * @param ringSize number of slots on the ring, must be positive
     * @throws IllegalArgumentException if the ring size is not positive or a position is off the ring
     */
    public static int distance(int a, int b, int ringSize) {
        if (ringSize <= 0) {
            throw new IllegalArgumentException("ringSize must be > 0, got: " + ringSize);
        }
        if (a < 0 || a >= ringSize || b < 0 || b >= ringSize) {
            throw new IllegalArgumentException(
                    "Positions must be in [0, " + ringSize + "), got: " + a + ", " + b);
        }
        int internal = Math.abs(b - a);
        int external = ringSize - internal;
        return Math.min(internal, external);
    }
}
