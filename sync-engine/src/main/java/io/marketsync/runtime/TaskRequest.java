package io.marketsync.runtime;

import io.marketsync.core.Partition;
import io.marketsync.core.TaskKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * What to run: one unit, a task kind and its partitions. Partitions are de-duplicated and sorted.
 * A FULL request without partitions covers the whole history.
 */
public record TaskRequest(String unitName, TaskKind kind, List<Partition> partitions, boolean autoResolveDependencies) {
    public TaskRequest {
        Objects.requireNonNull(unitName, "unitName");
        Objects.requireNonNull(kind, "kind");
        List<Partition> given = partitions == null ? List.of() : partitions;
        if (given.isEmpty()) {
            if (kind != TaskKind.FULL) throw new IllegalArgumentException(kind + " task for " + unitName + " needs at least one partition");
            partitions = List.of(Partition.ALL_HISTORY);
        } else {
            partitions = List.copyOf(new ArrayList<>(new TreeSet<>(given)));
        }
    }

    public static TaskRequest full(String unitName) {
        return new TaskRequest(unitName, TaskKind.FULL, List.of(), false);
    }

    public static TaskRequest of(String unitName, TaskKind kind, List<Partition> partitions) {
        return new TaskRequest(unitName, kind, partitions, false);
    }

    public TaskRequest withAutoResolve() {
        return new TaskRequest(unitName, kind, partitions, true);
    }
}
