package io.marketsync.core;

/**
 * Why one partition of a task ended without data.
 */
public record PartitionError(String partition, String message, boolean transientFailure, int attempts) {}
