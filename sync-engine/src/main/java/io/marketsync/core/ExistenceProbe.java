package io.marketsync.core;

/**
 * Answers whether a unit's output already exists.
 */
public interface ExistenceProbe {
    /** Whether the partition's rows are present. */
    boolean hasData(Partition partition) throws Exception;

    /** Whether any row at all is present; used for dependency satisfaction. */
    boolean hasAnyData() throws Exception;
}
