package com.clippy.fuzzyhash.core.digest;

/**
 * Weights of the digest distance.
 *
 * @param lengthMultiplier      applied to length code differences above 1
 * @param ratioMultiplier       applied to (quartile ratio difference - 1) when the difference is above 1
 * @param checksumPenalty       added when checksums differ
 * @param extremeBucketPenalty  charged for a bucket coded 0 on one side and 3 on the other
 */
public record DistanceWeights(int lengthMultiplier, int ratioMultiplier,
                              int checksumPenalty, int extremeBucketPenalty) {

    public static final DistanceWeights DEFAULT = new DistanceWeights(12, 12, 1, 6);

    public DistanceWeights {
        if (lengthMultiplier < 0 || ratioMultiplier < 0 || checksumPenalty < 0 || extremeBucketPenalty < 0) {
            throw new IllegalArgumentException("Distance weights must be >= 0, got: "
                    + lengthMultiplier + ", " + ratioMultiplier + ", "
                    + checksumPenalty + ", " + extremeBucketPenalty);
        }
    }
}
