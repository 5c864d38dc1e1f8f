package com.clippy.fuzzyhash.core.digest;

import com.clippy.fuzzyhash.util.Body;
import com.clippy.fuzzyhash.util.Digest;

import java.util.Objects;

/**
 * Distance between two digests: 0 for equal digests, symmetric, and growing with how far
 * apart the length codes, quartile ratios, checksums and bucket codes are.
 */
public final class DigestDistance {

    public static final DigestDistance DEFAULT = new DigestDistance(DistanceWeights.DEFAULT, true);

    private final DistanceWeights weights;
    private final boolean includeLength;

    /**
     * @param includeLength false scores inputs of very different size by content shape only
     */
    public DigestDistance(DistanceWeights weights, boolean includeLength) {
        this.weights = Objects.requireNonNull(weights, "weights cannot be null");
        this.includeLength = includeLength;
    }

    public DistanceWeights weights() {
        return weights;
    }

    public boolean includeLength() {
        return includeLength;
    }

    public int distance(Digest a, Digest b) {
        Objects.requireNonNull(a, "first digest cannot be null");
        Objects.requireNonNull(b, "second digest cannot be null");

        int total = 0;
        if (includeLength) {
            total += lengthDistance(a, b);
        }
        total += ratioDistance(a, b);
        total += checksumDistance(a, b);
        total += bodyDistance(a.body(), b.body());
        return total;
    }

    int lengthDistance(Digest a, Digest b) {
        int diff = a.lValue().distanceTo(b.lValue());
        return diff <= 1 ? diff : diff * weights.lengthMultiplier();
    }

    int ratioDistance(Digest a, Digest b) {
        return scaleRatio(a.q().q1DistanceTo(b.q())) + scaleRatio(a.q().q2DistanceTo(b.q()));
    }

    int checksumDistance(Digest a, Digest b) {
        return a.checksum().equals(b.checksum()) ? 0 : weights.checksumPenalty();
    }

    int bodyDistance(Body a, Body b) {
        int total = 0;
        for (int bucket = 0; bucket < Body.BUCKETS; bucket++) {
            int diff = Math.abs(a.bucketCode(bucket) - b.bucketCode(bucket));
            total += diff == 3 ? weights.extremeBucketPenalty() : diff;
        }
        return total;
    }

    private int scaleRatio(int diff) {
        return diff <= 1 ? diff : (diff - 1) * weights.ratioMultiplier();
    }
}
