package io.marketsync.core;

/**
 * A partition could not be fetched. Transient failures are worth retrying; permanent ones are not.
 */
public class PartitionFetchException extends SyncException {
    private final Partition partition;
    private final boolean transientFailure;

    public PartitionFetchException(Partition partition, String message, boolean transientFailure) {
        super(message);
        this.partition = partition;
        this.transientFailure = transientFailure;
    }

    public PartitionFetchException(Partition partition, String message, Throwable cause) {
        super(message, cause);
        this.partition = partition;
        this.transientFailure = false;
    }

    public Partition partition() { return partition; }
    public boolean isTransient() { return transientFailure; }
}
