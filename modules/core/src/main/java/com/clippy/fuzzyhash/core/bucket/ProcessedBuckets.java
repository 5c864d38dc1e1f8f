package com.clippy.fuzzyhash.core.bucket;

import java.util.Arrays;
import java.util.Objects;

/**
 * Result of one pass over an input: its length, the 256-bucket histogram and the checksum.
 *
 * @param length      bytes read
 * @param buckets     triplet hit counts, one per Pearson hash value
 * @param checksum    rolling checksum after the last byte
 * @param sampleCount positions at which every triplet definition could be formed
 */
public record ProcessedBuckets(long length, long[] buckets, int checksum, long sampleCount) {

    /** Samples needed before quartiles of the histogram are meaningful. */
    public static final int MIN_SAMPLES = 128;

    /** At most this many non-empty sampled buckets makes an input too simple. */
    public static final int SIMPLE_BUCKET_LIMIT = Quartiles.SAMPLE_SIZE / 2;

    public ProcessedBuckets {
        Objects.requireNonNull(buckets, "buckets cannot be null");
        if (buckets.length != BucketProcessor.BUCKET_COUNT) {
            throw new IllegalArgumentException(
                "Histogram must have " + BucketProcessor.BUCKET_COUNT + " buckets, got: " + buckets.length
            );
        }
        if (length < 0 || sampleCount < 0 || sampleCount > length) {
            throw new IllegalArgumentException(
                "Invalid length/sampleCount: " + length + "/" + sampleCount
            );
        }
        buckets = Arrays.copyOf(buckets, buckets.length);
    }

    /**
     * Returns a copy of the histogram.
     */
    @Override
    public long[] buckets() {
        return Arrays.copyOf(buckets, buckets.length);
    }

    public long bucket(int index) {
        return buckets[index];
    }

    public boolean hasSufficientData() {
        return sampleCount >= MIN_SAMPLES;
    }

    /**
     * Number of sampled buckets (the first {@value Quartiles#SAMPLE_SIZE}) that were hit at least once.
     */
    public int nonZeroSampledBuckets() {
        int count = 0;
        for (int i = 0; i < Quartiles.SAMPLE_SIZE; i++) {
            if (buckets[i] > 0) {
                count++;
            }
        }
        return count;
    }

    /**
     * Whether so few sampled buckets were hit that the histogram carries little shape.
     */
    public boolean isTooSimple() {
        return nonZeroSampledBuckets() <= SIMPLE_BUCKET_LIMIT;
    }

    public Quartiles quartiles() {
        return new Quartiles(buckets);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ProcessedBuckets other)) return false;
        return length == other.length
                && checksum == other.checksum
                && sampleCount == other.sampleCount
                && Arrays.equals(buckets, other.buckets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(length, checksum, sampleCount, Arrays.hashCode(buckets));
    }

    @Override
    public String toString() {
        return "ProcessedBuckets[length=" + length + ", checksum=" + checksum
                + ", sampleCount=" + sampleCount + "]";
    }
}
