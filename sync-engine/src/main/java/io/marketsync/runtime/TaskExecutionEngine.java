package io.marketsync.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.marketsync.budget.PartitionParallelism;
import io.marketsync.budget.TaskSlots;
import io.marketsync.budget.UnitRateLimiter;
import io.marketsync.core.FetchResult;
import io.marketsync.core.Partition;
import io.marketsync.core.PartitionError;
import io.marketsync.core.PartitionFetchException;
import io.marketsync.core.SyncException;
import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskSnapshot;
import io.marketsync.core.TaskStatus;
import io.marketsync.core.UnitDescriptor;
import io.marketsync.history.ExecutionRecord;
import io.marketsync.history.TaskHistoryStore;
import io.marketsync.metrics.Metrics;
import io.marketsync.registry.DependencyCheckResult;
import io.marketsync.registry.DependencyNotSatisfiedException;
import io.marketsync.registry.MissingDependency;
import io.marketsync.registry.PluginRegistry;
import io.marketsync.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs sync tasks with bounded concurrency.
 *
 * <p>Submitted tasks queue FIFO and a single dispatcher thread hands them to the worker pool once
 * a task slot is free, so at most {@code maxConcurrentTasks} tasks run at a time. Each running
 * task fans its partitions out to a small fixed pool sized from the unit's rate limit, and every
 * call to the unit goes through that unit's rate limiter. A failed partition is recorded and the
 * task moves on; the task fails only when no partition succeeded.
 */
public class TaskExecutionEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskExecutionEngine.class);

    static final String SHUTDOWN_MESSAGE = "shutdown";
    static final int MAX_UNRECORDED = 1000;

    private final PluginRegistry registry;
    private final TaskHistoryStore history;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final int maxPartitionParallelism;
    private final long defaultCallMillis;

    private final TaskSlots slots;
    private final ConcurrentHashMap<String, Task> live = new ConcurrentHashMap<>();
    private final LinkedBlockingQueue<Task> pending = new LinkedBlockingQueue<>();
    private final ConcurrentHashMap<String, UnitRateLimiter> limiters = new ConcurrentHashMap<>();
    // Terminal snapshots the history store refused; oldest dropped first.
    private final Map<String, TaskSnapshot> unrecorded = Collections.synchronizedMap(new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, TaskSnapshot> eldest) {
            return size() > MAX_UNRECORDED;
        }
    });
    private final ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private volatile Thread dispatcher;

    private final Meter submittedMeter;
    private final Meter completedMeter;
    private final Meter failedMeter;
    private final Meter cancelledMeter;
    private final Meter partitionSucceededMeter;
    private final Meter partitionFailedMeter;
    private final Meter partitionRetriedMeter;
    private final Timer taskTimer;
    private final Timer partitionTimer;

    TaskExecutionEngine(PluginRegistry registry,
                        TaskHistoryStore history,
                        RetryPolicy retryPolicy,
                        Metrics metrics,
                        Clock clock,
                        int maxConcurrentTasks,
                        int maxPartitionParallelism,
                        long defaultCallMillis) {
        this.registry = registry;
        this.history = history;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.maxPartitionParallelism = Math.max(1, maxPartitionParallelism);
        this.defaultCallMillis = Math.max(1, defaultCallMillis);
        this.slots = new TaskSlots(maxConcurrentTasks);
        this.workers = Executors.newCachedThreadPool(named("task-worker"));

        this.submittedMeter = metrics.meter("task.submitted");
        this.completedMeter = metrics.meter("task.completed");
        this.failedMeter = metrics.meter("task.failed");
        this.cancelledMeter = metrics.meter("task.cancelled");
        this.partitionSucceededMeter = metrics.meter("partition.succeeded");
        this.partitionFailedMeter = metrics.meter("partition.failed");
        this.partitionRetriedMeter = metrics.meter("partition.retried");
        this.taskTimer = metrics.timer("task.time");
        this.partitionTimer = metrics.timer("partition.time");
        metrics.gauge("tasks.running", this::runningCount);
        metrics.gauge("tasks.pending", this::pendingCount);
        metrics.gauge("tasks.limit", slots::limit);
    }

    public static TaskEngineBuilder builder(PluginRegistry registry) {
        return new TaskEngineBuilder(registry);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        Thread t = new Thread(this::dispatchLoop, "task-dispatcher");
        t.setDaemon(true);
        dispatcher = t;
        t.start();
        log.info("Task engine started: maxConcurrentTasks={} maxPartitionParallelism={}", slots.limit(), maxPartitionParallelism);
    }

    /**
     * Queues a task and returns its id. Blocks only when dependency auto-resolution is requested
     * and some dependency has no data yet.
     *
     * @throws io.marketsync.core.UnknownUnitException if the unit is not registered
     * @throws DependencyNotSatisfiedException if a direct dependency has no data and cannot be resolved
     */
    public String submit(TaskRequest request) {
        ensureAccepting();
        UnitDescriptor unit = registry.unit(request.unitName());
        DependencyCheckResult check = registry.checkDependencies(unit.name());
        if (!check.satisfied()) {
            if (!request.autoResolveDependencies() || check.hasUnregistered()) {
                throw new DependencyNotSatisfiedException(unit.name(), check.missing());
            }
            resolve(unit.name(), check.missing());
            DependencyCheckResult recheck = registry.checkDependencies(unit.name());
            if (!recheck.satisfied()) throw new DependencyNotSatisfiedException(unit.name(), recheck.missing());
        }
        return enqueue(unit, request.kind(), request.partitions());
    }

    private void resolve(String unitName, List<MissingDependency> missing) {
        for (MissingDependency m : missing) {
            if (m.reason() == MissingDependency.Reason.NOT_REGISTERED) {
                throw new DependencyNotSatisfiedException(unitName, List.of(m));
            }
            DependencyCheckResult depCheck = registry.checkDependencies(m.name());
            if (!depCheck.satisfied()) {
                if (depCheck.hasUnregistered()) throw new DependencyNotSatisfiedException(m.name(), depCheck.missing());
                resolve(m.name(), depCheck.missing());
            }
            String taskId = liveTaskFor(m.name())
                    .orElseGet(() -> enqueue(registry.unit(m.name()), TaskKind.FULL, List.of(Partition.ALL_HISTORY)));
            log.info("Resolving dependency {} of {} via task {}", m.name(), unitName, taskId);
            TaskSnapshot result = await(taskId);
            if (result.status() != TaskStatus.COMPLETED) {
                throw new DependencyNotSatisfiedException(unitName, List.of(new MissingDependency(m.name(),
                        MissingDependency.Reason.NO_DATA, "task " + taskId + " ended " + result.status())));
            }
        }
    }

    private Optional<String> liveTaskFor(String unitName) {
        return live.values().stream()
                .filter(t -> t.unitName().equals(unitName) && !t.status().isTerminal())
                .min(Comparator.comparing(t -> t.snapshot().createdAt()))
                .map(Task::id);
    }

    private TaskSnapshot await(String taskId) {
        try {
            return completion(taskId).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncException("Interrupted while waiting for task " + taskId, e);
        } catch (ExecutionException e) {
            throw new SyncException("Task " + taskId + " did not complete", e.getCause());
        }
    }

    private String enqueue(UnitDescriptor unit, TaskKind kind, List<Partition> partitions) {
        Task t = new Task(UUID.randomUUID().toString(), unit, kind, partitions, clock.instant());
        live.put(t.id(), t);
        pending.add(t);
        submittedMeter.mark();
        log.info("Task {} submitted: unit={} kind={} partitions={}", t.id(), unit.name(), kind, describe(partitions));
        return t.id();
    }

    /** Live tasks first, then history. Never blocks on a running task. */
    public Optional<TaskSnapshot> status(String taskId) {
        Task t = live.get(taskId);
        if (t != null) return Optional.of(t.snapshot());
        TaskSnapshot kept = unrecorded.get(taskId);
        if (kept != null) return Optional.of(kept);
        return history.find(taskId).map(ExecutionRecord::toSnapshot);
    }

    /**
     * Pending tasks are dropped and end CANCELLED at once. Running tasks stop before their next
     * partition starts. Returns false for unknown or already terminated tasks.
     */
    public boolean cancel(String taskId) {
        Task t = live.get(taskId);
        if (t == null) return false;
        if (t.cancelPending(clock.instant(), "cancelled before start")) {
            pending.remove(t);
            onTerminal(t);
            return true;
        }
        if (t.requestCancel()) {
            log.info("Task {} cancel requested after {}/{} partitions", t.id(), t.processed(), t.total());
            return true;
        }
        return false;
    }

    /** Completes with the terminal snapshot of the task. */
    public CompletableFuture<TaskSnapshot> completion(String taskId) {
        Task t = live.get(taskId);
        if (t != null) return t.done().copy();
        TaskSnapshot kept = unrecorded.get(taskId);
        if (kept != null) return CompletableFuture.completedFuture(kept);
        Optional<ExecutionRecord> rec = history.find(taskId);
        if (rec.isPresent()) return CompletableFuture.completedFuture(rec.get().toSnapshot());
        throw new IllegalArgumentException("Unknown task: " + taskId);
    }

    public List<TaskSnapshot> liveTasks() {
        List<TaskSnapshot> out = new ArrayList<>();
        for (Task t : live.values()) out.add(t.snapshot());
        out.sort(Comparator.comparing(TaskSnapshot::createdAt).thenComparing(TaskSnapshot::id));
        return out;
    }

    public int runningCount() { return countLive(TaskStatus.RUNNING); }
    public int pendingCount() { return countLive(TaskStatus.PENDING); }
    public int maxConcurrentTasks() { return slots.limit(); }

    private int countLive(TaskStatus s) {
        int n = 0;
        for (Task t : live.values()) if (t.status() == s) n++;
        return n;
    }

    /** Resizes the running-task cap. Running tasks keep their slots. */
    public void setMaxConcurrentTasks(int k) {
        int before = slots.limit();
        slots.resize(k);
        if (before != slots.limit()) log.info("maxConcurrentTasks {} -> {}", before, slots.limit());
    }

    public TaskHistoryStore history() { return history; }

    private void dispatchLoop() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                Task t = pending.take();
                if (t.status() != TaskStatus.PENDING) continue;
                slots.acquire();
                if (!t.start(clock.instant())) {
                    slots.release();
                    continue;
                }
                try {
                    workers.execute(() -> {
                        try {
                            runTask(t);
                        } finally {
                            slots.release();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    slots.release();
                    finish(t, TaskStatus.FAILED, SHUTDOWN_MESSAGE);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Task dispatcher stopped");
    }

    private void runTask(Task t) {
        UnitDescriptor unit = t.unit();
        long callMillis = unit.estimatedCallMillis() > 0 ? unit.estimatedCallMillis() : defaultCallMillis;
        int parallelism = Math.min(t.total(), PartitionParallelism.of(unit.rateLimitPerMinute(), callMillis, maxPartitionParallelism));
        UnitRateLimiter limiter = limiters.computeIfAbsent(unit.name(), n -> new UnitRateLimiter(unit.rateLimitPerMinute()));
        log.info("Task {} running: unit={} kind={} partitions={} parallelism={}",
                t.id(), unit.name(), t.kind(), t.total(), parallelism);

        ExecutorService partitionPool = Executors.newFixedThreadPool(parallelism, named("task-" + t.id().substring(0, 8)));
        try (Timer.Context ignored = taskTimer.time()) {
            List<Future<?>> futures = new ArrayList<>(t.total());
            for (Partition p : t.partitions()) {
                futures.add(partitionPool.submit(() -> runPartition(t, p, limiter)));
            }
            for (Future<?> f : futures) f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish(t, TaskStatus.FAILED, SHUTDOWN_MESSAGE);
            return;
        } catch (ExecutionException e) {
            log.error("Task {} partition worker crashed", t.id(), e.getCause());
            finish(t, TaskStatus.FAILED, "partition worker crashed: " + e.getCause());
            return;
        } finally {
            partitionPool.shutdownNow();
        }

        int failed = t.failed();
        if (t.isCancelRequested() && t.processed() < t.total()) {
            finish(t, TaskStatus.CANCELLED, "cancelled after " + t.processed() + " of " + t.total() + " partitions");
        } else if (failed == t.total()) {
            finish(t, TaskStatus.FAILED, "all " + failed + " partitions failed");
        } else {
            finish(t, TaskStatus.COMPLETED, failed == 0 ? null : failed + " of " + t.total() + " partitions failed");
        }
    }

    private void runPartition(Task t, Partition p, UnitRateLimiter limiter) {
        if (t.isCancelRequested()) return;
        UnitDescriptor unit = t.unit();
        try (Timer.Context ignored = partitionTimer.time()) {
            for (int attempt = 1; ; attempt++) {
                PartitionFetchException failure;
                try {
                    limiter.acquire();
                    FetchResult r = unit.fetcher().fetch(unit.name(), p);
                    if (r.isSuccess()) {
                        t.partitionSucceeded(r.rowsWritten());
                        partitionSucceededMeter.mark();
                        return;
                    }
                    failure = new PartitionFetchException(p, r.error(), r.isTransientFailure());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    partitionFailed(t, new PartitionError(p.key(), "interrupted", false, attempt));
                    return;
                } catch (PartitionFetchException e) {
                    failure = e;
                } catch (Exception e) {
                    failure = new PartitionFetchException(p, e.toString(), e);
                }

                if (!retryPolicy.shouldRetry(attempt, failure)) {
                    log.warn("Task {} partition {} failed after {} attempt(s): {}", t.id(), p, attempt, failure.getMessage());
                    partitionFailed(t, new PartitionError(p.key(), failure.getMessage(), failure.isTransient(), attempt));
                    return;
                }
                long backoff = retryPolicy.backoffMillis(attempt);
                partitionRetriedMeter.mark();
                log.debug("Task {} partition {} attempt {} failed ({}), retrying in {} ms", t.id(), p, attempt, failure.getMessage(), backoff);
                try {
                    Thread.sleep(backoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    partitionFailed(t, new PartitionError(p.key(), "interrupted", true, attempt));
                    return;
                }
            }
        }
    }

    private void partitionFailed(Task t, PartitionError error) {
        t.partitionFailed(error);
        partitionFailedMeter.mark();
    }

    private void finish(Task t, TaskStatus to, String message) {
        if (t.finish(to, message, clock.instant())) onTerminal(t);
    }

    private void onTerminal(Task t) {
        TaskSnapshot s = t.snapshot();
        switch (s.status()) {
            case COMPLETED -> completedMeter.mark();
            case FAILED -> failedMeter.mark();
            case CANCELLED -> cancelledMeter.mark();
            default -> throw new IllegalStateException("not terminal: " + s.status());
        }
        if (s.status() == TaskStatus.FAILED) {
            log.warn("Task {} {} FAILED: {} ({}/{} partitions, {} rows)", s.id(), s.unitName(), s.message(), s.processed(), s.total(), s.rowsWritten());
        } else {
            log.info("Task {} {} {}: {}/{} partitions, {} rows, {} errors{}", s.id(), s.unitName(), s.status(),
                    s.processed(), s.total(), s.rowsWritten(), s.errors().size(), s.message() == null ? "" : " (" + s.message() + ")");
        }
        if (record(s)) {
            flushUnrecorded();
        } else {
            unrecorded.put(s.id(), s);
        }
        live.remove(s.id());
        t.done().complete(s);
    }

    private boolean record(TaskSnapshot s) {
        try {
            history.record(ExecutionRecord.of(s));
            return true;
        } catch (RuntimeException e) {
            log.error("Could not record task {} in history; keeping it in memory", s.id(), e);
            return false;
        }
    }

    /** Retries snapshots the store refused earlier, oldest first, stopping at the first failure. */
    private void flushUnrecorded() {
        List<TaskSnapshot> waiting;
        synchronized (unrecorded) {
            if (unrecorded.isEmpty()) return;
            waiting = new ArrayList<>(unrecorded.values());
        }
        for (TaskSnapshot s : waiting) {
            if (!record(s)) return;
            unrecorded.remove(s.id());
        }
    }

    private void ensureAccepting() {
        if (!accepting.get()) throw new IllegalStateException("Task engine is shut down");
    }

    /**
     * Stops dispatching and cancels pending tasks, then gives running tasks up to {@code grace} to
     * finish. Tasks still running after that end FAILED with message {@value #SHUTDOWN_MESSAGE}.
     */
    public void shutdown(Duration grace) {
        if (!accepting.compareAndSet(true, false)) return;
        log.info("Task engine shutting down: {} running, {} pending, grace {}", runningCount(), pendingCount(), grace);
        Thread d = dispatcher;
        if (d != null) {
            d.interrupt();
            try { d.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
        }
        pending.clear();
        for (Task t : live.values()) {
            if (t.cancelPending(clock.instant(), SHUTDOWN_MESSAGE)) onTerminal(t);
        }
        workers.shutdown();
        boolean drained = false;
        try {
            drained = workers.awaitTermination(Math.max(0, grace.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        if (!drained) {
            for (Task t : live.values()) {
                t.requestCancel();
                finish(t, TaskStatus.FAILED, SHUTDOWN_MESSAGE);
            }
            workers.shutdownNow();
        }
        running.set(false);
        log.info("Task engine stopped");
    }

    public boolean isAccepting() { return accepting.get(); }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(30));
    }

    private static String describe(List<Partition> partitions) {
        if (partitions.size() <= 3) return partitions.toString();
        return "[" + partitions.get(0) + " .. " + partitions.get(partitions.size() - 1) + "] (" + partitions.size() + ")";
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
