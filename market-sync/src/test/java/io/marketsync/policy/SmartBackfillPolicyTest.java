package io.marketsync.policy;

import io.marketsync.core.Partition;
import io.marketsync.core.TaskKind;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SmartBackfillPolicyTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);
    private final SmartBackfillPolicy policy = new SmartBackfillPolicy(3);

    @Test
    void nothing_missing_syncs_today_only() {
        BackfillDecision d = policy.decide(List.of(), TODAY);
        assertEquals(BackfillDecision.Action.INCREMENTAL, d.action());
        assertEquals(TaskKind.INCREMENTAL, d.taskKind());
        assertEquals(List.of(Partition.of(TODAY)), d.partitions());
        assertEquals(0, d.missingCount());
    }

    @Test
    void small_gap_is_backfilled_in_date_order_with_today_last() {
        BackfillDecision d = policy.decide(List.of(LocalDate.of(2024, 3, 14), LocalDate.of(2024, 3, 12)), TODAY);
        assertEquals(BackfillDecision.Action.BACKFILL, d.action());
        assertEquals(TaskKind.BACKFILL, d.taskKind());
        assertEquals(List.of(Partition.of(LocalDate.of(2024, 3, 12)), Partition.of(LocalDate.of(2024, 3, 14)), Partition.of(TODAY)),
                d.partitions());
        assertEquals(2, d.missingCount());
    }

    @Test
    void gap_equal_to_threshold_is_still_backfilled() {
        BackfillDecision d = policy.decide(List.of(
                LocalDate.of(2024, 3, 12), LocalDate.of(2024, 3, 13), LocalDate.of(2024, 3, 14)), TODAY);
        assertEquals(BackfillDecision.Action.BACKFILL, d.action());
        assertEquals(4, d.partitions().size());
    }

    @Test
    void gap_over_threshold_is_skipped_with_alert() {
        BackfillDecision d = policy.decide(List.of(
                LocalDate.of(2024, 3, 11), LocalDate.of(2024, 3, 12), LocalDate.of(2024, 3, 13), LocalDate.of(2024, 3, 14)), TODAY);
        assertTrue(d.isSkip());
        assertTrue(d.partitions().isEmpty());
        assertEquals(4, d.missingCount());
    }

    @Test
    void today_in_the_missing_set_is_not_counted_twice() {
        BackfillDecision d = policy.decide(List.of(TODAY, LocalDate.of(2024, 3, 14), LocalDate.of(2024, 3, 14)), TODAY);
        assertEquals(1, d.missingCount());
        assertEquals(List.of(Partition.of(LocalDate.of(2024, 3, 14)), Partition.of(TODAY)), d.partitions());

        assertEquals(BackfillDecision.Action.INCREMENTAL, policy.decide(List.of(TODAY), TODAY).action());
    }

    @Test
    void zero_threshold_alerts_on_any_gap() {
        SmartBackfillPolicy strict = new SmartBackfillPolicy(0);
        assertTrue(strict.decide(List.of(LocalDate.of(2024, 3, 14)), TODAY).isSkip());
        assertFalse(strict.decide(List.of(), TODAY).isSkip());
        assertThrows(IllegalArgumentException.class, () -> new SmartBackfillPolicy(-1));
    }
}
