package io.marketsync.core;

import java.time.Instant;
import java.util.List;

/**
 * Immutable point-in-time view of a task, safe to hand to any thread.
 */
public record TaskSnapshot(
        String id,
        String unitName,
        TaskKind kind,
        List<Partition> partitions,
        TaskStatus status,
        int processed,
        int total,
        long rowsWritten,
        List<PartitionError> errors,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String message
) {
    public TaskSnapshot {
        partitions = List.copyOf(partitions);
        errors = List.copyOf(errors);
    }

    public double progressPct() {
        return total == 0 ? 0.0 : (100.0 * processed) / total;
    }
}
