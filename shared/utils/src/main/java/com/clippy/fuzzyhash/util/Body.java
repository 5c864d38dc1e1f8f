package com.clippy.fuzzyhash.util;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Quantized histogram of a digest (32 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>Each of the 128 sampled buckets takes two bits: 0 when its count is at or
 * below Q1, 1 at or below Q2, 2 at or below Q3, 3 above Q3. Bucket {@code i}
 * lives in byte {@code i / 4}, bits {@code 2 * (i % 4)} and up.
 */
public record Body(byte[] bytes) {
    public static final int LENGTH = 32;
    public static final int BUCKETS = LENGTH * 4;

    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public Body {
        Objects.requireNonNull(bytes, "Body bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                "Body must be " + LENGTH + " bytes, got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Returns a copy of the encoded bytes.
     */
    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Two-bit quantization code (0..3) of one bucket.
     */
    public int bucketCode(int bucket) {
        Objects.checkIndex(bucket, BUCKETS);
        return (bytes[bucket / 4] >>> (2 * (bucket % 4))) & 0x03;
    }

    /**
     * Raw byte at {@code index}, as an unsigned value.
     */
    public int byteAt(int index) {
        Objects.checkIndex(index, LENGTH);
        return bytes[index] & 0xFF;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Body other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return HEX_FORMAT.formatHex(bytes);
    }
}
