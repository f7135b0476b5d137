package io.marketsync.schedule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/** The newest sync runs, in memory. Older runs fall off the end. */
public class SyncRunLog {
    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<SyncRun> runs = new ArrayDeque<>();

    public SyncRunLog() { this(DEFAULT_CAPACITY); }

    public SyncRunLog(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized void add(SyncRun run) {
        runs.addFirst(run);
        while (runs.size() > capacity) runs.removeLast();
    }

    public synchronized Optional<SyncRun> find(String id) {
        for (SyncRun r : runs) if (r.id().equals(id)) return Optional.of(r);
        return Optional.empty();
    }

    /** Newest first. */
    public synchronized List<SyncRun> recent(int limit) {
        List<SyncRun> out = new ArrayList<>();
        Iterator<SyncRun> it = runs.iterator();
        while (it.hasNext() && out.size() < limit) out.add(it.next());
        return out;
    }

    public synchronized int size() { return runs.size(); }
}
