package io.marketsync.history;

import io.marketsync.core.Partition;
import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskStatus;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcTaskHistoryStoreTest extends TaskHistoryStoreContract {
    private String url;

    @Override
    TaskHistoryStore newStore() {
        url = "jdbc:h2:mem:history-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        return new JdbcTaskHistoryStore(url, null, null, "task_history", Clock.fixed(HistoryFixtures.NOW, ZoneOffset.UTC));
    }

    @Test
    void partitions_and_errors_are_stored_as_json() throws Exception {
        TaskHistoryStore store = newStore();
        store.record(HistoryFixtures.record("t9", "daily", TaskKind.BACKFILL, TaskStatus.FAILED, 0));

        try (Connection c = DriverManager.getConnection(url); Statement s = c.createStatement()) {
            ResultSet rs = s.executeQuery("SELECT partitions, errors FROM task_history WHERE task_id = 't9'");
            assertTrue(rs.next());
            assertEquals("[\"2024-06-27\",\"2024-06-28\"]", rs.getString(1));
            assertTrue(rs.getString(2).contains("upstream 500"));
        }
    }

    @Test
    void full_history_partition_survives_a_round_trip() {
        TaskHistoryStore store = newStore();
        store.record(HistoryFixtures.record("t8", "stock_basic", TaskKind.FULL, TaskStatus.COMPLETED, 0));
        assertEquals(List.of(Partition.ALL_HISTORY), store.find("t8").orElseThrow().partitions());
    }

    @Test
    void reopening_keeps_existing_rows() {
        TaskHistoryStore store = newStore();
        HistoryFixtures.seed(store);
        TaskHistoryStore again = new JdbcTaskHistoryStore(url, null, null, "task_history");
        assertEquals(5, again.count(HistoryQuery.all()));
    }

    @Test
    void rejects_unsafe_table_names() {
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcTaskHistoryStore("jdbc:h2:mem:x", null, null, "t; DROP TABLE x"));
    }
}
