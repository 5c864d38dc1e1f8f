package com.clippy.fuzzyhash.core.bucket;

/**
 * The triplets taken at every window position.
 *
 * <p>Each definition picks the newest byte and two older ones (by how far back they sit)
 * and carries its own salt, so one position hits several unrelated buckets.
 */
public enum TripletDefinition {
    A(2, 1, 2),
    B(3, 1, 3),
    C(5, 2, 3),
    D(7, 2, 4),
    E(11, 1, 4),
    F(13, 3, 4);

    private final int salt;
    private final int secondOffset;
    private final int thirdOffset;

    TripletDefinition(int salt, int secondOffset, int thirdOffset) {
        this.salt = salt;
        this.secondOffset = secondOffset;
        this.thirdOffset = thirdOffset;
    }

    public int salt() {
        return salt;
    }

    public int secondOffset() {
        return secondOffset;
    }

    public int thirdOffset() {
        return thirdOffset;
    }

    /**
     * Number of bytes that must precede the newest one before this triplet can be formed.
     */
    public int requiredHistory() {
        return Math.max(secondOffset, thirdOffset);
    }

    public Triplet triplet(int newest, int second, int third) {
        return new Triplet(newest, second, third, salt);
    }
}
