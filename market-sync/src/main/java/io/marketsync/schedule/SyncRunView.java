package io.marketsync.schedule;

import java.time.Instant;
import java.util.List;

public record SyncRunView(
        String id,
        TriggerType trigger,
        SyncRun.Status status,
        Instant startedAt,
        Instant completedAt,
        String reason,
        String retryOf,
        List<UnitOutcome> outcomes
) {}
