package com.clippy.fuzzyhash.core;

import com.clippy.fuzzyhash.core.bucket.ProcessedBuckets;

/**
 * Thrown in strict mode when too few sampled buckets were hit
 * (at most {@value ProcessedBuckets#SIMPLE_BUCKET_LIMIT}) for the digest to discriminate.
 */
public class InsufficientComplexityException extends FuzzyHashException {

    private final int nonZeroBuckets;

    public InsufficientComplexityException(int nonZeroBuckets) {
        super("Input data hasn't enough complexity: " + nonZeroBuckets
                + " non-empty buckets, need more than " + ProcessedBuckets.SIMPLE_BUCKET_LIMIT);
        this.nonZeroBuckets = nonZeroBuckets;
    }

    public int nonZeroBuckets() {
        return nonZeroBuckets;
    }
}
