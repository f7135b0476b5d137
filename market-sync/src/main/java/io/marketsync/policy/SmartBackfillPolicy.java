package io.marketsync.policy;

import io.marketsync.core.Partition;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Chooses between an incremental sync, a small backfill, or an alert when too much is missing.
 * Up to {@code threshold} missing days are backfilled together with today; more than that is
 * left for an operator.
 */
public final class SmartBackfillPolicy {
    public static final int DEFAULT_THRESHOLD = 3;

    private final int threshold;

    public SmartBackfillPolicy() { this(DEFAULT_THRESHOLD); }

    public SmartBackfillPolicy(int threshold) {
        if (threshold < 0) throw new IllegalArgumentException("threshold must be >= 0: " + threshold);
        this.threshold = threshold;
    }

    public int threshold() { return threshold; }

    public BackfillDecision decide(Collection<LocalDate> missingDates, LocalDate today) {
        TreeSet<LocalDate> missing = new TreeSet<>(missingDates);
        missing.remove(today);
        int n = missing.size();
        if (n == 0) {
            return new BackfillDecision(BackfillDecision.Action.INCREMENTAL, List.of(Partition.of(today)), 0);
        }
        if (n > threshold) {
            return new BackfillDecision(BackfillDecision.Action.SKIP_WITH_ALERT, List.of(), n);
        }
        List<Partition> partitions = new ArrayList<>(n + 1);
        for (LocalDate d : missing) partitions.add(Partition.of(d));
        partitions.add(Partition.of(today));
        return new BackfillDecision(BackfillDecision.Action.BACKFILL, partitions, n);
    }
}
