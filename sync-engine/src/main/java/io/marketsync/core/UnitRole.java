package io.marketsync.core;

/** Listing order hint for control surfaces: reference data first, derived data last. */
public enum UnitRole {
    BASIC,
    PRIMARY,
    DERIVED,
    AUXILIARY
}
