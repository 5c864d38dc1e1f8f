package com.clippy.fuzzyhash.core.service;

import com.clippy.fuzzyhash.core.FuzzyHash;
import com.clippy.fuzzyhash.core.FuzzyHashException;
import com.clippy.fuzzyhash.core.bucket.BucketProcessor;
import com.clippy.fuzzyhash.core.bucket.ProcessedBuckets;
import com.clippy.fuzzyhash.core.digest.DigestDistance;
import com.clippy.fuzzyhash.core.digest.DistanceWeights;
import com.clippy.fuzzyhash.util.Digest;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;

/**
 * Computes and compares fuzzy digests with the configured strictness and distance weights.
 */
@ApplicationScoped
public class FuzzyHashService {

    private static final Logger log = Logger.getLogger(FuzzyHashService.class);

    @ConfigProperty(name = "fuzzyhash.require-complexity", defaultValue = "false")
    boolean requireComplexity;

    @ConfigProperty(name = "fuzzyhash.distance.include-length", defaultValue = "true")
    boolean includeLength;

    @ConfigProperty(name = "fuzzyhash.distance.length-multiplier", defaultValue = "12")
    int lengthMultiplier;

    @ConfigProperty(name = "fuzzyhash.distance.ratio-multiplier", defaultValue = "12")
    int ratioMultiplier;

    @ConfigProperty(name = "fuzzyhash.distance.checksum-penalty", defaultValue = "1")
    int checksumPenalty;

    @ConfigProperty(name = "fuzzyhash.distance.extreme-bucket-penalty", defaultValue = "6")
    int extremeBucketPenalty;

    /**
     * @throws com.clippy.fuzzyhash.core.InsufficientDataException       if the input is too short
     * @throws com.clippy.fuzzyhash.core.InsufficientComplexityException in strict mode, if the input is too simple
     */
    public Digest digest(byte[] data) {
        return digest(BucketProcessor.process(data));
    }

    /**
     * Digests a stream read to EOF. The stream is not closed.
     *
     * @throws FuzzyHashException if reading fails, or for the reasons {@link #digest(byte[])} gives
     */
    public Digest digest(InputStream in) {
        ProcessedBuckets processed;
        try {
            processed = BucketProcessor.process(in);
        } catch (IOException e) {
            throw new FuzzyHashException("Failed to read input", e);
        }
        return digest(processed);
    }

    public int compare(Digest a, Digest b) {
        return distance().distance(a, b);
    }

    /**
     * Compares two digests given in their text form.
     *
     * @throws IllegalArgumentException if either text is not a valid digest
     */
    public int compare(String hexA, String hexB) {
        return compare(Digest.fromHex(hexA), Digest.fromHex(hexB));
    }

    DigestDistance distance() {
        return new DigestDistance(
                new DistanceWeights(lengthMultiplier, ratioMultiplier, checksumPenalty, extremeBucketPenalty),
                includeLength);
    }

    private Digest digest(ProcessedBuckets processed) {
        Digest digest = FuzzyHash.computeDigest(processed, requireComplexity);
        if (log.isDebugEnabled()) {
            var quartiles = processed.quartiles();
            if (quartiles.isDegenerate()) {
                log.debugf("Q3 is 0 for %d-byte input, quartile ratios fall back to 0", processed.length());
            }
            log.debugf("Digest %s: length=%d samples=%d %s",
                    digest, processed.length(), processed.sampleCount(), quartiles);
        }
        return digest;
    }
}
