package io.marketsync.policy;

import io.marketsync.core.Partition;
import io.marketsync.core.TaskKind;

import java.util.List;

/**
 * What the sync tick should do for one unit. Skipped decisions carry no partitions.
 */
public record BackfillDecision(Action action, List<Partition> partitions, int missingCount) {
    public enum Action { INCREMENTAL, BACKFILL, SKIP_WITH_ALERT }

    public BackfillDecision {
        partitions = List.copyOf(partitions);
    }

    public boolean isSkip() { return action == Action.SKIP_WITH_ALERT; }

    public TaskKind taskKind() {
        return switch (action) {
            case INCREMENTAL -> TaskKind.INCREMENTAL;
            case BACKFILL -> TaskKind.BACKFILL;
            case SKIP_WITH_ALERT -> throw new IllegalStateException("skipped decision has no task kind");
        };
    }
}
