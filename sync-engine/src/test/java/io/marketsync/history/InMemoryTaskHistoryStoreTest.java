package io.marketsync.history;

import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class InMemoryTaskHistoryStoreTest extends TaskHistoryStoreContract {

    @Override
    TaskHistoryStore newStore() {
        return new InMemoryTaskHistoryStore(Clock.fixed(HistoryFixtures.NOW, ZoneOffset.UTC));
    }

    @Test
    void records_are_append_only() {
        TaskHistoryStore store = newStore();
        store.record(HistoryFixtures.record("t1", "daily", TaskKind.FULL, TaskStatus.COMPLETED, 0));
        assertThrows(IllegalStateException.class,
                () -> store.record(HistoryFixtures.record("t1", "daily", TaskKind.FULL, TaskStatus.FAILED, 0)));
    }
}
