package io.marketsync.runtime;

import io.marketsync.core.Partition;
import io.marketsync.core.PartitionError;
import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskSnapshot;
import io.marketsync.core.TaskStatus;
import io.marketsync.core.UnitDescriptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live, engine-owned task state. Status changes are serialized on the task itself; counters are
 * updated by partition workers without locking.
 */
final class Task {
    private final String id;
    private final UnitDescriptor unit;
    private final TaskKind kind;
    private final List<Partition> partitions;
    private final Instant createdAt;

    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicLong rowsWritten = new AtomicLong();
    private final ConcurrentLinkedQueue<PartitionError> errors = new ConcurrentLinkedQueue<>();
    private final CompletableFuture<TaskSnapshot> done = new CompletableFuture<>();

    private TaskStatus status = TaskStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private String message;
    private volatile boolean cancelRequested;

    Task(String id, UnitDescriptor unit, TaskKind kind, List<Partition> partitions, Instant createdAt) {
        this.id = id;
        this.unit = unit;
        this.kind = kind;
        this.partitions = List.copyOf(partitions);
        this.createdAt = createdAt;
    }

    String id() { return id; }
    UnitDescriptor unit() { return unit; }
    String unitName() { return unit.name(); }
    TaskKind kind() { return kind; }
    List<Partition> partitions() { return partitions; }
    int total() { return partitions.size(); }
    int processed() { return processed.get(); }
    int failed() { return failed.get(); }
    boolean isCancelRequested() { return cancelRequested; }
    CompletableFuture<TaskSnapshot> done() { return done; }

    synchronized TaskStatus status() { return status; }

    synchronized boolean start(Instant at) {
        if (status != TaskStatus.PENDING) return false;
        status = TaskStatus.RUNNING;
        startedAt = at;
        return true;
    }

    synchronized boolean cancelPending(Instant at, String reason) {
        if (status != TaskStatus.PENDING) return false;
        status = TaskStatus.CANCELLED;
        completedAt = at;
        message = reason;
        return true;
    }

    /** Flags a running task; returns false if it is not running. */
    synchronized boolean requestCancel() {
        if (status != TaskStatus.RUNNING) return false;
        cancelRequested = true;
        return true;
    }

    /** Moves a running task to a terminal state; false if something else finished it first. */
    synchronized boolean finish(TaskStatus to, String reason, Instant at) {
        if (status != TaskStatus.RUNNING) return false;
        status = to;
        completedAt = at;
        message = reason;
        return true;
    }

    void partitionSucceeded(long rows) {
        rowsWritten.addAndGet(rows);
        processed.incrementAndGet();
    }

    void partitionFailed(PartitionError error) {
        errors.add(error);
        failed.incrementAndGet();
        processed.incrementAndGet();
    }

    synchronized TaskSnapshot snapshot() {
        return new TaskSnapshot(id, unit.name(), kind, partitions, status, processed.get(), partitions.size(),
                rowsWritten.get(), new ArrayList<>(errors), createdAt, startedAt, completedAt, message);
    }
}
