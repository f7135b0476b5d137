package io.marketsync.core;

/**
 * How often a unit's upstream data is expected to change.
 */
public enum Cadence {
    DAILY,
    WEEKLY,
    OTHER
}
