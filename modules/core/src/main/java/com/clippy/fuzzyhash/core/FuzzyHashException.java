package com.clippy.fuzzyhash.core;

/**
 * Base class for failures to compute a digest.
 */
public class FuzzyHashException extends RuntimeException {

    public FuzzyHashException(String message, Throwable cause) {
        super(message, cause);
    }

    public FuzzyHashException(String message) {
        super(message);
    }
}
