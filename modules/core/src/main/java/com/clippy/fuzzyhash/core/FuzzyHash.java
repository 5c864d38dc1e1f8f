package com.clippy.fuzzyhash.core;

import com.clippy.fuzzyhash.core.bucket.BucketProcessor;
import com.clippy.fuzzyhash.core.bucket.ProcessedBuckets;
import com.clippy.fuzzyhash.core.digest.DigestBuilder;
import com.clippy.fuzzyhash.core.digest.DigestDistance;
import com.clippy.fuzzyhash.util.Digest;

import java.io.IOException;
import java.io.InputStream;

/**
 * Entry points of the engine: digest a byte sequence, compare two digests.
 *
 * <p>Stateless and safe to call from any number of threads.
 */
public final class FuzzyHash {

    private FuzzyHash() {
    }

    /**
     * @throws InsufficientDataException if the input yields fewer than 128 samples
     */
    public static Digest computeDigest(byte[] data) {
        return computeDigest(BucketProcessor.process(data), false);
    }

    /**
     * Digests a stream read to EOF. The stream is not closed.
     *
     * @throws InsufficientDataException if the input yields fewer than 128 samples
     */
    public static Digest computeDigest(InputStream in) throws IOException {
        return computeDigest(BucketProcessor.process(in), false);
    }

    /**
     * Turns a finished pass into a digest.
     *
     * @param requireComplexity also reject histograms with too few non-empty buckets
     * @throws InsufficientDataException       if fewer than 128 samples were taken
     * @throws InsufficientComplexityException if {@code requireComplexity} and the histogram is too simple
     */
    public static Digest computeDigest(ProcessedBuckets processed, boolean requireComplexity) {
        if (!processed.hasSufficientData()) {
            throw new InsufficientDataException(processed.length(), processed.sampleCount());
        }
        if (requireComplexity && processed.isTooSimple()) {
            throw new InsufficientComplexityException(processed.nonZeroSampledBuckets());
        }
        return DigestBuilder.fromBuckets(processed);
    }

    /**
     * Distance with the default weights, length included.
     */
    public static int compareDigests(Digest a, Digest b) {
        return DigestDistance.DEFAULT.distance(a, b);
    }
}
