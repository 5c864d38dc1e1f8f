package com.clippy.fuzzyhash.util;

/**
 * Log-scaled input length code, one byte.
 * Lengths that differ by a few bytes usually share a code.
 */
public record LValue(int value) {

    /** Number of distinct codes; distances between codes wrap around this ring. */
    public static final int RING_SIZE = 256;

    public LValue {
        if (value < 0 || value >= RING_SIZE) {
            throw new IllegalArgumentException("LValue must be a byte value, got: " + value);
        }
    }

    /**
     * Circular distance to another length code.
     */
    public int distanceTo(LValue other) {
        return ModularDifference.distance(value, other.value, RING_SIZE);
    }

    @Override
    public String toString() {
        return String.format("%02x", value);
    }
}
