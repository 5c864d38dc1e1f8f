package com.clippy.fuzzyhash.core.bucket;

/**
 * Rolling buffer of the five most recent bytes.
 *
 * <p>The pivot counts the bytes put so far. Callers read it before {@link #put(int)}
 * and pass it back to {@link #getChecksum(long, int)} and {@link #getTripletHashes(long)},
 * which both refer to the byte that was just put.
 */
public class SlideWindow {

    /** Newest byte plus the four before it. */
    public static final int CAPACITY = 5;

    /** Checksum value before any byte has been folded in. */
    public static final int CHECKSUM_SEED = 0;

    private static final int CHECKSUM_SALT = 0;
    private static final TripletDefinition[] DEFINITIONS = TripletDefinition.values();
    private static final int[] NO_HASHES = new int[0];

    private final int[] window = new int[CAPACITY];
    private long pivot;

    /**
     * Pushes a byte, dropping the oldest one once the window is full.
     *
     * @param value byte value; only the low 8 bits are kept
     */
    public void put(int value) {
        window[slot(pivot)] = value & 0xFF;
        pivot++;
    }

    /**
     * Number of bytes put so far. Read before a put, this is the position of the byte being put.
     */
    public long getPivot() {
        return pivot;
    }

    /**
     * Whether every triplet definition can be formed for the newest byte.
     */
    public boolean isFull(long startPivot) {
        checkNewest(startPivot);
        return startPivot >= CAPACITY - 1;
    }

    /**
     * Folds the newest byte and the one before it into the running checksum.
     * Before a second byte arrives the checksum is returned unchanged.
     *
     * @param startPivot        pivot read just before the newest byte was put
     * @param previousChecksum  checksum after the previous byte
     */
    public int getChecksum(long startPivot, int previousChecksum) {
        checkNewest(startPivot);
        if (startPivot < 1) {
            return previousChecksum;
        }
        return PearsonHash.hash(CHECKSUM_SALT, byteAt(startPivot, 0), byteAt(startPivot, 1),
                previousChecksum);
    }

    /**
     * Bucket indices of all triplets that can be formed for the newest byte.
     * Fewer (or none) are returned while the window is still filling.
     *
     * @param startPivot pivot read just before the newest byte was put
     */
    public int[] getTripletHashes(long startPivot) {
        checkNewest(startPivot);
        if (startPivot < 2) {
            return NO_HASHES;
        }

        int count = 0;
        for (TripletDefinition definition : DEFINITIONS) {
            if (startPivot >= definition.requiredHistory()) {
                count++;
            }
        }

        int[] hashes = new int[count];
        int newest = byteAt(startPivot, 0);
        int i = 0;
        for (TripletDefinition definition : DEFINITIONS) {
            if (startPivot >= definition.requiredHistory()) {
                Triplet triplet = definition.triplet(newest,
                        byteAt(startPivot, definition.secondOffset()),
                        byteAt(startPivot, definition.thirdOffset()));
                hashes[i++] = triplet.getHash();
            }
        }
        return hashes;
    }

    private int byteAt(long startPivot, int back) {
        return window[slot(startPivot - back)];
    }

    private void checkNewest(long startPivot) {
        if (startPivot != pivot - 1) {
            throw new IllegalStateException(
                    "Pivot " + startPivot + " does not refer to the newest byte (pivot is " + pivot + ")");
        }
    }

    private static int slot(long position) {
        return (int) (position % CAPACITY);
    }
}
