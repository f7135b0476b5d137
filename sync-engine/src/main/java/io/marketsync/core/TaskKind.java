package io.marketsync.core;

public enum TaskKind {
    /** Reload everything; a single {@link Partition#ALL_HISTORY} partition. */
    FULL,
    /** Today's partition only. */
    INCREMENTAL,
    /** An explicit list of historical dates. */
    BACKFILL
}
