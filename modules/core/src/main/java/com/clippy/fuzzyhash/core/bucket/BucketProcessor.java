package com.clippy.fuzzyhash.core.bucket;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Single forward pass over an input, filling the 256-bucket histogram and the checksum.
 *
 * <p>Bytes can be fed in any number of {@code update} calls; {@link #finish()} ends the
 * pass and may be called once. An instance handles exactly one input and is not
 * thread-safe; separate instances share nothing.
 */
public class BucketProcessor {

    public static final int BUCKET_COUNT = 256;

    private static final int READ_CHUNK = 8192;

    private final long[] buckets = new long[BUCKET_COUNT];
    private final SlideWindow window = new SlideWindow();
    private int checksum = SlideWindow.CHECKSUM_SEED;
    private long sampleCount;
    private boolean finished;

    /**
     * Processes a whole byte array.
     */
    public static ProcessedBuckets process(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new BucketProcessor().update(data, 0, data.length).finish();
    }

    /**
     * Processes a stream until EOF. The stream is not closed.
     */
    public static ProcessedBuckets process(InputStream in) throws IOException {
        Objects.requireNonNull(in, "input stream cannot be null");
        BucketProcessor processor = new BucketProcessor();
        byte[] chunk = new byte[READ_CHUNK];
        int read;
        while ((read = in.read(chunk)) != -1) {
            processor.update(chunk, 0, read);
        }
        return processor.finish();
    }

    /**
     * Feeds one byte.
     *
     * @param value byte value; only the low 8 bits are used
     */
    public BucketProcessor update(int value) {
        checkOpen();
        long startPivot = window.getPivot();
        window.put(value);

        checksum = window.getChecksum(startPivot, checksum);
        for (int hash : window.getTripletHashes(startPivot)) {
            buckets[hash]++;
        }
        if (window.isFull(startPivot)) {
            sampleCount++;
        }
        return this;
    }

    public BucketProcessor update(byte[] data, int offset, int length) {
        Objects.checkFromIndexSize(offset, length, data.length);
        for (int i = offset; i < offset + length; i++) {
            update(data[i]);
        }
        return this;
    }

    /**
     * Bytes consumed so far.
     */
    public long length() {
        return window.getPivot();
    }

    /**
     * Ends the pass.
     *
     * @throws IllegalStateException if already finished
     */
    public ProcessedBuckets finish() {
        checkOpen();
        finished = true;
        return new ProcessedBuckets(window.getPivot(), buckets, checksum, sampleCount);
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("BucketProcessor already finished");
        }
    }
}
