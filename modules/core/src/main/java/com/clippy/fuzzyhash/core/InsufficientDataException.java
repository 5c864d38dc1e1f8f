package com.clippy.fuzzyhash.core;

import com.clippy.fuzzyhash.core.bucket.ProcessedBuckets;

/**
 * Thrown when an input is too short to yield {@value ProcessedBuckets#MIN_SAMPLES} full-window samples.
 * Retrying the same input reproduces it.
 */
public class InsufficientDataException extends FuzzyHashException {

    private final long length;
    private final long sampleCount;

    public InsufficientDataException(long length, long sampleCount) {
        super("Insufficient data: " + length + " bytes gave " + sampleCount
                + " samples, need " + ProcessedBuckets.MIN_SAMPLES);
        this.length = length;
        this.sampleCount = sampleCount;
    }

    public long length() {
        return length;
    }

    public long sampleCount() {
        return sampleCount;
    }
}
