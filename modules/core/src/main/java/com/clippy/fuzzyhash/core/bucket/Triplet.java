package com.clippy.fuzzyhash.core.bucket;

/**
 * Three window bytes plus a salt, mapped to a bucket index.
 */
public record Triplet(int c1, int c2, int c3, int salt) {

    public int getHash() {
        return PearsonHash.hash(salt, c1, c2, c3);
    }
}
