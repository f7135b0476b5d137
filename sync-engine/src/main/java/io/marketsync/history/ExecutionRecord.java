package io.marketsync.history;

import io.marketsync.core.Partition;
import io.marketsync.core.PartitionError;
import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskSnapshot;
import io.marketsync.core.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Durable summary of one terminated task. Records are only ever appended, and removed by
 * retention cleanup.
 */
public record ExecutionRecord(
        String taskId,
        String unitName,
        TaskKind kind,
        TaskStatus status,
        List<Partition> partitions,
        int processed,
        int total,
        long rowsWritten,
        List<PartitionError> errors,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String message
) {
    public ExecutionRecord {
        if (!status.isTerminal()) throw new IllegalArgumentException("record of non-terminal task " + taskId + ": " + status);
        partitions = List.copyOf(partitions);
        errors = List.copyOf(errors);
    }

    public static ExecutionRecord of(TaskSnapshot t) {
        return new ExecutionRecord(t.id(), t.unitName(), t.kind(), t.status(), t.partitions(), t.processed(), t.total(),
                t.rowsWritten(), t.errors(), t.createdAt(), t.startedAt(), t.completedAt(), t.message());
    }

    public TaskSnapshot toSnapshot() {
        return new TaskSnapshot(taskId, unitName, kind, partitions, status, processed, total, rowsWritten, errors,
                createdAt, startedAt, completedAt, message);
    }

    public Duration age(Instant now) {
        return Duration.between(completedAt, now);
    }
}
