/**
 * Shared value types for fuzzy digests.
 *
 * <p>Contains {@link com.clippy.fuzzyhash.util.Digest} and its parts
 * ({@link com.clippy.fuzzyhash.util.Checksum}, {@link com.clippy.fuzzyhash.util.LValue},
 * {@link com.clippy.fuzzyhash.util.Q}, {@link com.clippy.fuzzyhash.util.Body}) plus the
 * {@link com.clippy.fuzzyhash.util.ModularDifference} primitive.
 * No framework dependencies, pure Java.
 */
package com.clippy.fuzzyhash.util;
