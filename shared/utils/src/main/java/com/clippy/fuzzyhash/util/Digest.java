package com.clippy.fuzzyhash.util;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Fuzzy digest of a byte stream: checksum, length code, quartile ratios and body.
 * Immutable value object that can be used as a map key.
 *
 * <p>Text format: 70 lowercase hex characters. The checksum, length and Q bytes come
 * first with their nibbles swapped, followed by the body bytes in reverse order.
 * {@link #fromHex(String)} also accepts the form prefixed with {@code T1}.
 */
public record Digest(Checksum checksum, LValue lValue, Q q, Body body) {
    public static final int HEX_LENGTH = (3 + Body.LENGTH) * 2;

    private static final String VERSION_PREFIX = "T1";
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public Digest {
        Objects.requireNonNull(checksum, "checksum cannot be null");
        Objects.requireNonNull(lValue, "lValue cannot be null");
        Objects.requireNonNull(q, "q cannot be null");
        Objects.requireNonNull(body, "body cannot be null");
    }

    /**
     * Parses the text produced by {@link #toHex()}.
     *
     * @throws IllegalArgumentException if the text has the wrong length or is not hex
     */
    public static Digest fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        String digits = hex.regionMatches(true, 0, VERSION_PREFIX, 0, VERSION_PREFIX.length())
                ? hex.substring(VERSION_PREFIX.length())
                : hex;
        if (digits.length() != HEX_LENGTH) {
            throw new IllegalArgumentException(
                "Digest hex string must be " + HEX_LENGTH + " characters, got: " + digits.length()
            );
        }

        byte[] data;
        try {
            data = HEX_FORMAT.parseHex(digits);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }

        int i = 0;
        Checksum checksum = new Checksum(swapNibbles(data[i++] & 0xFF));
        LValue lValue = new LValue(swapNibbles(data[i++] & 0xFF));
        Q q = Q.fromPacked(swapNibbles(data[i++] & 0xFF));

        byte[] bodyBytes = new byte[Body.LENGTH];
        for (int j = 0; j < Body.LENGTH; j++) {
            bodyBytes[j] = data[data.length - 1 - j];
        }
        return new Digest(checksum, lValue, q, new Body(bodyBytes));
    }

    /**
     * Returns the lowercase hex representation (70 characters).
     */
    public String toHex() {
        byte[] data = new byte[3 + Body.LENGTH];
        int i = 0;
        data[i++] = (byte) swapNibbles(checksum.value());
        data[i++] = (byte) swapNibbles(lValue.value());
        data[i++] = (byte) swapNibbles(q.packed());
        for (int j = Body.LENGTH - 1; j >= 0; j--) {
            data[i++] = (byte) body.byteAt(j);
        }
        return HEX_FORMAT.formatHex(data);
    }

    private static int swapNibbles(int value) {
        return ((value & 0x0F) << 4) | ((value & 0xF0) >>> 4);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
