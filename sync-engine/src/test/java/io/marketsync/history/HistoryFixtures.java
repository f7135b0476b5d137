package io.marketsync.history;

import io.marketsync.core.Partition;
import io.marketsync.core.PartitionError;
import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

final class HistoryFixtures {
    static final Instant NOW = Instant.parse("2024-06-30T12:00:00Z");

    private HistoryFixtures() {}

    static ExecutionRecord record(String id, String unit, TaskKind kind, TaskStatus status, int daysAgo) {
        Instant completed = NOW.minusSeconds(86_400L * daysAgo);
        List<Partition> partitions = kind == TaskKind.FULL
                ? List.of(Partition.ALL_HISTORY)
                : List.of(Partition.of(LocalDate.of(2024, 6, 27)), Partition.of(LocalDate.of(2024, 6, 28)));
        List<PartitionError> errors = status == TaskStatus.COMPLETED
                ? List.of()
                : List.of(new PartitionError(partitions.get(0).key(), "upstream 500", true, 4));
        return new ExecutionRecord(id, unit, kind, status, partitions, partitions.size(), partitions.size(),
                status == TaskStatus.COMPLETED ? 42 : 0, errors,
                completed.minusSeconds(120), completed.minusSeconds(60), completed,
                status == TaskStatus.COMPLETED ? null : "all partitions failed");
    }

    static void seed(TaskHistoryStore store) {
        store.record(record("t1", "daily", TaskKind.INCREMENTAL, TaskStatus.COMPLETED, 0));
        store.record(record("t2", "daily", TaskKind.BACKFILL, TaskStatus.FAILED, 1));
        store.record(record("t3", "adj_factor", TaskKind.INCREMENTAL, TaskStatus.COMPLETED, 2));
        store.record(record("t4", "stock_basic", TaskKind.FULL, TaskStatus.COMPLETED, 40));
        store.record(record("t5", "daily", TaskKind.INCREMENTAL, TaskStatus.CANCELLED, 45));
    }
}
