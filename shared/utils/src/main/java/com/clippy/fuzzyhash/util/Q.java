package com.clippy.fuzzyhash.util;

/**
 * Quartile ratios packed into one byte: Q1 ratio in the low nibble, Q2 ratio in the high nibble.
 */
public record Q(int q1Ratio, int q2Ratio) {

    /** Ratios are nibbles; distances between them wrap around this ring. */
    public static final int RING_SIZE = 16;

    public Q {
        if (q1Ratio < 0 || q1Ratio >= RING_SIZE || q2Ratio < 0 || q2Ratio >= RING_SIZE) {
            throw new IllegalArgumentException(
                    "Quartile ratios must be nibbles, got: " + q1Ratio + ", " + q2Ratio);
        }
    }

    /**
     * Unpacks a byte built by {@link #packed()}.
     */
    public static Q fromPacked(int packed) {
        if (packed < 0 || packed > 0xFF) {
            throw new IllegalArgumentException("Packed Q must be a byte value, got: " + packed);
        }
        return new Q(packed & 0x0F, (packed >>> 4) & 0x0F);
    }

    public int packed() {
        return (q1Ratio & 0x0F) | ((q2Ratio & 0x0F) << 4);
    }

    public int q1DistanceTo(Q other) {
        return ModularDifference.distance(q1Ratio, other.q1Ratio, RING_SIZE);
    }

    public int q2DistanceTo(Q other) {
        return ModularDifference.distance(q2Ratio, other.q2Ratio, RING_SIZE);
    }

    @Override
    public String toString() {
        return String.format("%02x", packed());
    }
}
