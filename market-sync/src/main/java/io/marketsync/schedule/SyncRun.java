package io.marketsync.schedule;

import io.marketsync.core.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * One execution of the sync tick, manual trigger or retry. Updated from tick workers and task
 * completion callbacks, so every access is synchronized.
 */
public final class SyncRun {
    public enum Status {
        RUNNING, COMPLETED, FAILED, SKIPPED, STOPPED;

        public boolean isTerminal() { return this != RUNNING; }
    }

    private final String id;
    private final TriggerType trigger;
    private final Instant startedAt;
    private final String retryOf;
    private final Map<String, UnitOutcome> outcomes = new LinkedHashMap<>();
    private final CompletableFuture<SyncRunView> done = new CompletableFuture<>();

    private Status status = Status.RUNNING;
    private Instant completedAt;
    private String reason;
    private Runnable onFinish = () -> {};

    SyncRun(String id, TriggerType trigger, Instant startedAt, String retryOf) {
        this.id = id;
        this.trigger = trigger;
        this.startedAt = startedAt;
        this.retryOf = retryOf;
    }

    public String id() { return id; }
    public TriggerType trigger() { return trigger; }

    public synchronized Status status() { return status; }

    synchronized void outcome(UnitOutcome o) {
        outcomes.put(o.unitName(), o);
    }

    synchronized void taskFinished(String unitName, TaskStatus taskStatus, String message) {
        UnitOutcome o = outcomes.get(unitName);
        if (o != null) outcomes.put(unitName, o.withTaskStatus(taskStatus, message));
    }

    synchronized List<UnitOutcome> outcomes() {
        return new ArrayList<>(outcomes.values());
    }

    /** Runs {@code hook} when the run ends, before {@link #completion()} completes. */
    void onFinish(Runnable hook) {
        synchronized (this) {
            if (!status.isTerminal()) {
                onFinish = hook;
                return;
            }
        }
        hook.run();
    }

    /** Moves a running run to its end state; false if it already ended. */
    boolean finish(Status to, String why, Instant at) {
        SyncRunView v;
        Runnable hook;
        synchronized (this) {
            if (status.isTerminal()) return false;
            status = to;
            reason = why;
            completedAt = at;
            v = view();
            hook = onFinish;
        }
        hook.run();
        done.complete(v);
        return true;
    }

    public CompletableFuture<SyncRunView> completion() { return done.copy(); }

    public synchronized SyncRunView view() {
        return new SyncRunView(id, trigger, status, startedAt, completedAt, reason, retryOf, new ArrayList<>(outcomes.values()));
    }
}
