package io.marketsync.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketsync.core.Partition;
import io.marketsync.core.PartitionError;
import io.marketsync.core.SyncException;
import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed history with one row per task. Partition keys and partition errors are kept as
 * JSON text columns; instants as epoch millis. The table is created on construction if missing.
 * Opens a connection per call; put a pooled URL in front of it for anything busy.
 */
public class JdbcTaskHistoryStore implements TaskHistoryStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcTaskHistoryStore.class);
    private static final TypeReference<List<String>> PARTITION_KEYS = new TypeReference<>() {};
    private static final TypeReference<List<PartitionError>> ERRORS = new TypeReference<>() {};

    private static final String COLUMNS = "task_id, unit_name, kind, status, partitions, processed, total, "
            + "rows_written, errors, created_at, started_at, completed_at, message";

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final String table;
    private final Clock clock;
    private final ObjectMapper json = new ObjectMapper();

    public JdbcTaskHistoryStore(String jdbcUrl, String user, String password, String table) {
        this(jdbcUrl, user, password, table, Clock.systemUTC());
    }

    public JdbcTaskHistoryStore(String jdbcUrl, String user, String password, String table, Clock clock) {
        if (!table.matches("[A-Za-z_][A-Za-z0-9_]*")) throw new IllegalArgumentException("bad table name: " + table);
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.table = table;
        this.clock = clock;
        createTable();
    }

    private void createTable() {
        String ddl = "CREATE TABLE IF NOT EXISTS " + table + " ("
                + "task_id VARCHAR(64) PRIMARY KEY, "
                + "unit_name VARCHAR(128) NOT NULL, "
                + "kind VARCHAR(16) NOT NULL, "
                + "status VARCHAR(16) NOT NULL, "
                + "partitions CLOB NOT NULL, "
                + "processed INT NOT NULL, "
                + "total INT NOT NULL, "
                + "rows_written BIGINT NOT NULL, "
                + "errors CLOB NOT NULL, "
                + "created_at BIGINT NOT NULL, "
                + "started_at BIGINT, "
                + "completed_at BIGINT NOT NULL, "
                + "message VARCHAR(1024))";
        try (Connection c = getConnection(); Statement st = c.createStatement()) {
            st.execute(ddl);
            st.execute("CREATE INDEX IF NOT EXISTS " + table + "_completed_idx ON " + table + " (completed_at)");
        } catch (SQLException e) {
            throw new SyncException("Cannot create history table " + table, e);
        }
    }

    @Override
    public void record(ExecutionRecord r) {
        String sql = "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection c = getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, r.taskId());
            ps.setString(2, r.unitName());
            ps.setString(3, r.kind().name());
            ps.setString(4, r.status().name());
            ps.setString(5, json.writeValueAsString(r.partitions().stream().map(Partition::key).toList()));
            ps.setInt(6, r.processed());
            ps.setInt(7, r.total());
            ps.setLong(8, r.rowsWritten());
            ps.setString(9, json.writeValueAsString(r.errors()));
            ps.setLong(10, r.createdAt().toEpochMilli());
            if (r.startedAt() == null) ps.setNull(11, Types.BIGINT);
            else ps.setLong(11, r.startedAt().toEpochMilli());
            ps.setLong(12, r.completedAt().toEpochMilli());
            ps.setString(13, truncate(r.message()));
            ps.executeUpdate();
        } catch (SQLException | JsonProcessingException e) {
            throw new SyncException("Cannot record task " + r.taskId(), e);
        }
    }

    @Override
    public Optional<ExecutionRecord> find(String taskId) {
        String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE task_id = ?";
        try (Connection c = getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new SyncException("Cannot read task " + taskId, e);
        }
    }

    @Override
    public List<ExecutionRecord> query(HistoryQuery q) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT " + COLUMNS + " FROM " + table + where(q, params)
                + " ORDER BY " + column(q.sortBy()) + (q.ascending() ? " ASC" : " DESC")
                + ", task_id" + (q.ascending() ? " ASC" : " DESC")
                + " OFFSET ? ROWS FETCH NEXT ? ROWS ONLY";
        params.add(q.offset());
        params.add(q.pageSize());
        try (Connection c = getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, params);
            List<ExecutionRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(read(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new SyncException("History query failed", e);
        }
    }

    @Override
    public long count(HistoryQuery q) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM " + table + where(q, params);
        try (Connection c = getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new SyncException("History count failed", e);
        }
    }

    @Override
    public int cleanupOlderThan(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(Math.max(0, days)));
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE completed_at < ?")) {
            ps.setLong(1, cutoff.toEpochMilli());
            int removed = ps.executeUpdate();
            if (removed > 0) log.info("Removed {} execution records completed before {}", removed, cutoff);
            return removed;
        } catch (SQLException e) {
            throw new SyncException("History cleanup failed", e);
        }
    }

    private static String where(HistoryQuery q, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (q.unitName() != null) { clauses.add("unit_name = ?"); params.add(q.unitName()); }
        if (q.kind() != null) { clauses.add("kind = ?"); params.add(q.kind().name()); }
        if (q.status() != null) { clauses.add("status = ?"); params.add(q.status().name()); }
        if (q.completedAfter() != null) { clauses.add("completed_at >= ?"); params.add(q.completedAfter().toEpochMilli()); }
        if (q.completedBefore() != null) { clauses.add("completed_at < ?"); params.add(q.completedBefore().toEpochMilli()); }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    private static String column(HistoryQuery.SortField f) {
        return switch (f) {
            case CREATED_AT -> "created_at";
            case COMPLETED_AT -> "completed_at";
            case UNIT_NAME -> "unit_name";
            case STATUS -> "status";
        };
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) ps.setObject(i + 1, params.get(i));
    }

    private ExecutionRecord read(ResultSet rs) throws SQLException {
        try {
            List<Partition> partitions = json.readValue(rs.getString("partitions"), PARTITION_KEYS)
                    .stream().map(Partition::parse).toList();
            List<PartitionError> errors = json.readValue(rs.getString("errors"), ERRORS);
            long started = rs.getLong("started_at");
            Instant startedAt = rs.wasNull() ? null : Instant.ofEpochMilli(started);
            return new ExecutionRecord(
                    rs.getString("task_id"),
                    rs.getString("unit_name"),
                    TaskKind.valueOf(rs.getString("kind")),
                    TaskStatus.valueOf(rs.getString("status")),
                    partitions,
                    rs.getInt("processed"),
                    rs.getInt("total"),
                    rs.getLong("rows_written"),
                    errors,
                    Instant.ofEpochMilli(rs.getLong("created_at")),
                    startedAt,
                    Instant.ofEpochMilli(rs.getLong("completed_at")),
                    rs.getString("message"));
        } catch (JsonProcessingException e) {
            throw new SQLException("Corrupt JSON column in " + table, e);
        }
    }

    private static String truncate(String s) {
        return s == null || s.length() <= 1024 ? s : s.substring(0, 1024);
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
