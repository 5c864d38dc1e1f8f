package com.clippy.fuzzyhash.core.digest;

import com.clippy.fuzzyhash.core.bucket.ProcessedBuckets;
import com.clippy.fuzzyhash.core.bucket.Quartiles;
import com.clippy.fuzzyhash.util.Body;
import com.clippy.fuzzyhash.util.Checksum;
import com.clippy.fuzzyhash.util.Digest;
import com.clippy.fuzzyhash.util.LValue;
import com.clippy.fuzzyhash.util.Q;

import java.util.Objects;

/**
 * Staged construction of a {@link Digest}.
 *
 * <p>Each stage exposes only the next setter, so checksum, length, quartiles and body
 * are all supplied, in that order, before {@code build()} is reachable:
 * <pre>{@code
 * Digest digest = DigestBuilder.newBuilder()
 *         .withChecksum(buckets.checksum())
 *         .withLength(buckets.length())
 *         .withQuartiles(quartiles)
 *         .withBody(buckets.buckets())
 *         .build();
 * }</pre>
 */
public final class DigestBuilder {

    private static final int MOD_VALUE = LValue.RING_SIZE;

    private static final double LOG_1_1 = 0.095310180;
    private static final double LOG_1_3 = 0.26236426;
    private static final double LOG_1_5 = 0.4054651;

    private static final long LOW_RANGE = 656;
    private static final long MID_RANGE = 3199;

    private DigestBuilder() {
    }

    public interface ChecksumStage {
        LengthStage withChecksum(int checksum);
    }

    public interface LengthStage {
        QuartilesStage withLength(long length);
    }

    public interface QuartilesStage {
        BodyStage withQuartiles(Quartiles quartiles);
    }

    public interface BodyStage {
        /**
         * Encodes the sampled buckets against the quartiles given in the previous stage.
         */
        FinalStage withBody(long[] buckets);
    }

    public interface FinalStage {
        Digest build();
    }

    public static ChecksumStage newBuilder() {
        return new Stages();
    }

    /**
     * Builds the digest of a finished pass. Callers check {@link ProcessedBuckets#hasSufficientData()} first.
     */
    public static Digest fromBuckets(ProcessedBuckets processed) {
        long[] buckets = processed.buckets();
        return newBuilder()
                .withChecksum(processed.checksum())
                .withLength(processed.length())
                .withQuartiles(new Quartiles(buckets))
                .withBody(buckets)
                .build();
    }

    /**
     * Log-scale length code. Three length brackets (up to 656, up to 3199, above) each
     * use their own log base and offset; the result is taken mod 256.
     *
     * @throws IllegalArgumentException if length is not positive
     */
    public static int calculateLValue(long length) {
        if (length <= 0) {
            throw new IllegalArgumentException("length must be > 0, got: " + length);
        }

        double log = Math.log(length);
        if (length <= LOW_RANGE) {
            return (int) Math.floor(log / LOG_1_5) % MOD_VALUE;
        }
        if (length <= MID_RANGE) {
            return (int) Math.floor(log / LOG_1_3 - 8.72777) % MOD_VALUE;
        }
        return (int) Math.floor(log / LOG_1_1 - 62.5472) % MOD_VALUE;
    }

    /**
     * Quantizes each sampled bucket to two bits against Q1/Q2/Q3.
     */
    public static Body encodeBody(long[] buckets, Quartiles quartiles) {
        Objects.requireNonNull(buckets, "buckets cannot be null");
        Objects.requireNonNull(quartiles, "quartiles cannot be null");
        if (buckets.length < Body.BUCKETS) {
            throw new IllegalArgumentException(
                    "Body needs at least " + Body.BUCKETS + " buckets, got: " + buckets.length);
        }

        byte[] data = new byte[Body.LENGTH];
        for (int i = 0; i < Body.LENGTH; i++) {
            int packed = 0;
            for (int j = 0; j < 4; j++) {
                packed |= quantize(buckets[4 * i + j], quartiles) << (2 * j);
            }
            data[i] = (byte) packed;
        }
        return new Body(data);
    }

    private static int quantize(long count, Quartiles quartiles) {
        if (count > quartiles.getThird()) {
            return 3;
        }
        if (count > quartiles.getSecond()) {
            return 2;
        }
        if (count > quartiles.getFirst()) {
            return 1;
        }
        return 0;
    }

    private static final class Stages
            implements ChecksumStage, LengthStage, QuartilesStage, BodyStage, FinalStage {

        private Checksum checksum;
        private LValue lValue;
        private Quartiles quartiles;
        private Q q;
        private Body body;

        @Override
        public LengthStage withChecksum(int checksum) {
            this.checksum = new Checksum(checksum);
            return this;
        }

        @Override
        public QuartilesStage withLength(long length) {
            this.lValue = new LValue(calculateLValue(length));
            return this;
        }

        @Override
        public BodyStage withQuartiles(Quartiles quartiles) {
            this.quartiles = Objects.requireNonNull(quartiles, "quartiles cannot be null");
            this.q = new Q(quartiles.getQ1Ratio(), quartiles.getQ2Ratio());
            return this;
        }

        @Override
        public FinalStage withBody(long[] buckets) {
            this.body = encodeBody(buckets, quartiles);
            return this;
        }

        @Override
        public Digest build() {
            return new Digest(checksum, lValue, q, body);
        }
    }
}
