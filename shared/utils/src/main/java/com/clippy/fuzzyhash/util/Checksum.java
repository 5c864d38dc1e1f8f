package com.clippy.fuzzyhash.util;

/**
 * One-byte rolling checksum over the whole input stream.
 */
public record Checksum(int value) {

    public Checksum {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("Checksum must be a byte value, got: " + value);
        }
    }

    @Override
    public String toString() {
        return String.format("%02x", value);
    }
}
