package com.clippy.fuzzyhash.core.bucket;

import java.util.Arrays;
import java.util.Objects;

/**
 * Quartiles of the first {@value #SAMPLE_SIZE} histogram buckets.
 *
 * <p>Only that leading window is sampled; the remaining buckets never influence the
 * quartiles. When the third quartile is zero both ratios are 0.
 */
public final class Quartiles {

    public static final int SAMPLE_SIZE = 128;

    private static final int RATIO_MODULUS = 16;

    private final long first;
    private final long second;
    private final long third;

    /**
     * @param buckets histogram with at least {@value #SAMPLE_SIZE} entries
     * @throws IllegalArgumentException if the histogram is shorter than the sample window
     */
    public Quartiles(long[] buckets) {
        Objects.requireNonNull(buckets, "buckets cannot be null");
        if (buckets.length < SAMPLE_SIZE) {
            throw new IllegalArgumentException(
                    "Quartiles need at least " + SAMPLE_SIZE + " buckets, got: " + buckets.length);
        }

        long[] sample = Arrays.copyOf(buckets, SAMPLE_SIZE);
        Arrays.sort(sample);

        this.first = sample[SAMPLE_SIZE / 4 - 1];
        this.second = sample[SAMPLE_SIZE / 2 - 1];
        this.third = sample[SAMPLE_SIZE - SAMPLE_SIZE / 4 - 1];
    }

    public long getFirst() {
        return first;
    }

    public long getSecond() {
        return second;
    }

    public long getThird() {
        return third;
    }

    /**
     * True when the third quartile is zero and the ratios fall back to 0.
     */
    public boolean isDegenerate() {
        return third == 0;
    }

    public int getQ1Ratio() {
        return ratio(first);
    }

    public int getQ2Ratio() {
        return ratio(second);
    }

    private int ratio(long quartile) {
        if (third == 0) {
            return 0;
        }
        return (int) ((quartile * 100 / third) % RATIO_MODULUS);
    }

    @Override
    public String toString() {
        return "Quartiles[" + first + ", " + second + ", " + third + "]";
    }
}
