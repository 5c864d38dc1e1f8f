package com.clippy.fuzzyhash.core.bucket;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class BucketProcessorTest {

    @Test
    void shouldYieldSeedAndEmptyHistogramForEmptyInput() {
        ProcessedBuckets processed = BucketProcessor.process(new byte[0]);

        assertThat(processed.length()).isZero();
        assertThat(processed.checksum()).isEqualTo(SlideWindow.CHECKSUM_SEED);
        assertThat(processed.buckets()).hasSize(BucketProcessor.BUCKET_COUNT).containsOnly(0L);
        assertThat(processed.sampleCount()).isZero();
        assertThat(processed.hasSufficientData()).isFalse();
    }

    @Test
    void shouldNotFailOnInputShorterThanWindow() {
        ProcessedBuckets processed = BucketProcessor.process("ab".getBytes(StandardCharsets.US_ASCII));

        assertThat(processed.length()).isEqualTo(2);
        assertThat(Arrays.stream(processed.buckets()).sum()).isZero();
        assertThat(processed.checksum()).isEqualTo(169);
    }

    @Test
    void shouldCountEveryEvaluableTriplet() {
        ProcessedBuckets processed = BucketProcessor.process("abcde".getBytes(StandardCharsets.US_ASCII));

        // 1 + 3 + 6 triplets for the 3rd, 4th and 5th byte
        assertThat(Arrays.stream(processed.buckets()).sum()).isEqualTo(10);
        assertThat(processed.sampleCount()).isEqualTo(1);
        assertThat(processed.checksum()).isEqualTo(197);
        for (int bucket : new int[]{67, 77, 90, 92, 113, 137, 173, 187, 232, 250}) {
            assertThat(processed.bucket(bucket)).isEqualTo(1);
        }
    }

    @Test
    void shouldCountSixTripletsPerFullWindowPosition() {
        byte[] data = randomBytes(1000, 7);
        ProcessedBuckets processed = BucketProcessor.process(data);

        assertThat(Arrays.stream(processed.buckets()).sum()).isEqualTo(6L * data.length - 20);
        assertThat(processed.sampleCount()).isEqualTo(data.length - 4);
    }

    @Test
    void shouldNeedAtLeast132BytesForEnoughSamples() {
        assertThat(BucketProcessor.process(new byte[131]).hasSufficientData()).isFalse();
        assertThat(BucketProcessor.process(new byte[132]).hasSufficientData()).isTrue();
    }

    @Test
    void shouldMatchAcrossChunkedUpdatesAndStreams() throws Exception {
        byte[] data = randomBytes(20_000, 11);

        BucketProcessor chunked = new BucketProcessor();
        for (int offset = 0; offset < data.length; offset += 333) {
            chunked.update(data, offset, Math.min(333, data.length - offset));
            assertThat(chunked.length()).isEqualTo(Math.min(offset + 333, data.length));
        }

        ProcessedBuckets whole = BucketProcessor.process(data);
        assertThat(chunked.finish()).isEqualTo(whole);
        assertThat(BucketProcessor.process(new ByteArrayInputStream(data))).isEqualTo(whole);
    }

    @Test
    void shouldRejectUpdatesAfterFinish() {
        BucketProcessor processor = new BucketProcessor().update('a');
        processor.finish();

        assertThatIllegalStateException().isThrownBy(() -> processor.update('b'));
        assertThatIllegalStateException().isThrownBy(processor::finish);
    }

    @Test
    void shouldDetectTooSimpleHistograms() {
        byte[] repeated = new byte[2000];
        Arrays.fill(repeated, (byte) 'a');

        assertThat(BucketProcessor.process(repeated).isTooSimple()).isTrue();
        assertThat(BucketProcessor.process(randomBytes(2000, 3)).isTooSimple()).isFalse();
    }

    @Test
    void shouldProtectHistogramFromCallers() {
        ProcessedBuckets processed = BucketProcessor.process(randomBytes(500, 5));
        long before = processed.bucket(0);

        processed.buckets()[0] = before + 1000;

        assertThat(processed.bucket(0)).isEqualTo(before);
    }

    static byte[] randomBytes(int length, long seed) {
        byte[] data = new byte[length];
        new Random(seed).nextBytes(data);
        return data;
    }
}
