package io.marketsync.history;

import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.marketsync.history.HistoryFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

/** Behaviour every history store shares; subclasses provide a fresh, seeded store. */
abstract class TaskHistoryStoreContract {

    abstract TaskHistoryStore newStore();

    private static List<String> ids(List<ExecutionRecord> records) {
        return records.stream().map(ExecutionRecord::taskId).toList();
    }

    @Test
    void find_returns_the_recorded_task() {
        TaskHistoryStore store = newStore();
        HistoryFixtures.seed(store);

        ExecutionRecord r = store.find("t2").orElseThrow();
        assertEquals(HistoryFixtures.record("t2", "daily", TaskKind.BACKFILL, TaskStatus.FAILED, 1), r);
        assertTrue(store.find("missing").isEmpty());
    }

    @Test
    void default_query_is_newest_first() {
        TaskHistoryStore store = newStore();
        HistoryFixtures.seed(store);

        assertEquals(List.of("t1", "t2", "t3", "t4", "t5"), ids(store.query(HistoryQuery.all())));
        assertEquals(5, store.count(HistoryQuery.all()));
    }

    @Test
    void filters_combine() {
        TaskHistoryStore store = newStore();
        HistoryFixtures.seed(store);

        HistoryQuery daily = HistoryQuery.builder().unitName("daily").build();
        assertEquals(List.of("t1", "t2", "t5"), ids(store.query(daily)));
        assertEquals(3, store.count(daily));

        HistoryQuery dailyIncremental = HistoryQuery.builder().unitName("daily").kind(TaskKind.INCREMENTAL).build();
        assertEquals(List.of("t1", "t5"), ids(store.query(dailyIncremental)));

        HistoryQuery completed = HistoryQuery.builder().status(TaskStatus.COMPLETED)
                .completedAfter(NOW.minusSeconds(86_400L * 3)).build();
        assertEquals(List.of("t1", "t3"), ids(store.query(completed)));

        HistoryQuery old = HistoryQuery.builder().completedBefore(NOW.minusSeconds(86_400L * 30)).build();
        assertEquals(List.of("t4", "t5"), ids(store.query(old)));
    }

    @Test
    void sorts_and_pages() {
        TaskHistoryStore store = newStore();
        HistoryFixtures.seed(store);

        HistoryQuery byUnit = HistoryQuery.builder().sortBy(HistoryQuery.SortField.UNIT_NAME, true).build();
        assertEquals(List.of("t3", "t1", "t2", "t5", "t4"), ids(store.query(byUnit)));

        HistoryQuery oldestFirst = HistoryQuery.builder()
                .sortBy(HistoryQuery.SortField.COMPLETED_AT, true).page(2, 2).build();
        assertEquals(List.of("t3", "t2"), ids(store.query(oldestFirst)));
        assertEquals(5, store.count(oldestFirst));

        HistoryQuery pastTheEnd = HistoryQuery.builder().page(4, 2).build();
        assertTrue(store.query(pastTheEnd).isEmpty());
    }

    @Test
    void cleanup_removes_only_old_records() {
        TaskHistoryStore store = newStore();
        HistoryFixtures.seed(store);

        assertEquals(2, store.cleanupOlderThan(30));
        assertEquals(List.of("t1", "t2", "t3"), ids(store.query(HistoryQuery.all())));
        assertEquals(0, store.cleanupOlderThan(30));
        assertEquals(1, store.cleanupOlderThan(1));
    }
}
