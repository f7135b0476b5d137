package io.marketsync.schedule;

import io.marketsync.core.Partition;
import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskStatus;

import java.util.List;

/**
 * What a sync run did with one unit. {@code taskStatus} follows the submitted task to its end.
 */
public record UnitOutcome(
        String unitName,
        Kind kind,
        String taskId,
        TaskKind taskKind,
        List<Partition> partitions,
        int missingCount,
        TaskStatus taskStatus,
        String message
) {
    public enum Kind {
        SUBMITTED,
        SKIPPED_ALERT,
        SKIPPED_DEPENDENCY,
        SKIPPED_DISABLED,
        SKIPPED_STOPPED,
        SUBMIT_FAILED
    }

    public UnitOutcome {
        partitions = partitions == null ? List.of() : List.copyOf(partitions);
    }

    static UnitOutcome skipped(String unitName, Kind kind, int missingCount, String message) {
        return new UnitOutcome(unitName, kind, null, null, List.of(), missingCount, null, message);
    }

    UnitOutcome withTaskStatus(TaskStatus status, String message) {
        return new UnitOutcome(unitName, kind, taskId, taskKind, partitions, missingCount, status, message);
    }

    /** Submitted but ended FAILED, or planned but never accepted by the engine. */
    public boolean isRetryable() {
        if (taskKind == null) return false;
        return taskStatus == TaskStatus.FAILED || kind == Kind.SUBMIT_FAILED || kind == Kind.SKIPPED_DEPENDENCY;
    }
}
