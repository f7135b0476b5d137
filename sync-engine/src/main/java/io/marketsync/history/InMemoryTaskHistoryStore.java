package io.marketsync.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

public class InMemoryTaskHistoryStore implements TaskHistoryStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskHistoryStore.class);

    private final ConcurrentHashMap<String, ExecutionRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTaskHistoryStore() { this(Clock.systemUTC()); }

    public InMemoryTaskHistoryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void record(ExecutionRecord record) {
        if (records.putIfAbsent(record.taskId(), record) != null) {
            throw new IllegalStateException("Task already recorded: " + record.taskId());
        }
    }

    @Override
    public Optional<ExecutionRecord> find(String taskId) {
        return Optional.ofNullable(records.get(taskId));
    }

    @Override
    public List<ExecutionRecord> query(HistoryQuery query) {
        return records.values().stream()
                .filter(query.predicate())
                .sorted(query.comparator())
                .skip(query.offset())
                .limit(query.pageSize())
                .collect(Collectors.toList());
    }

    @Override
    public long count(HistoryQuery query) {
        return records.values().stream().filter(query.predicate()).count();
    }

    @Override
    public int cleanupOlderThan(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(Math.max(0, days)));
        int removed = 0;
        for (ExecutionRecord r : records.values()) {
            if (r.completedAt().isBefore(cutoff) && records.remove(r.taskId(), r)) removed++;
        }
        if (removed > 0) log.info("Removed {} execution records completed before {}", removed, cutoff);
        return removed;
    }
}
