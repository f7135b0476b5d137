package io.marketsync.core;

/**
 * Fetches, transforms and loads one partition of one unit. Opaque to the scheduler, which only
 * looks at the returned outcome. Thrown exceptions are treated as permanent failures.
 */
@FunctionalInterface
public interface PartitionFetcher {
    FetchResult fetch(String unitName, Partition partition) throws Exception;
}
