package io.marketsync.history;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of terminated tasks. {@link #cleanupOlderThan(int)} is the only operation
 * that deletes.
 */
public interface TaskHistoryStore extends AutoCloseable {
    void record(ExecutionRecord record);

    Optional<ExecutionRecord> find(String taskId);

    List<ExecutionRecord> query(HistoryQuery query);

    long count(HistoryQuery query);

    /** Deletes records completed more than {@code days} days ago; returns how many. */
    int cleanupOlderThan(int days);

    @Override
    default void close() {}
}
