package io.marketsync.schedule;

import com.codahale.metrics.Counter;
import io.marketsync.calendar.TradeCalendarService;
import io.marketsync.detect.MissingDataDetector;
import io.marketsync.detect.MissingDataReport;
import io.marketsync.history.TaskHistoryStore;
import io.marketsync.metrics.Metrics;
import io.marketsync.registry.PluginRegistry;
import io.marketsync.runtime.TaskExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Drives the calendar refresh, the missing-data check, the sync tick and history cleanup on their
 * timers.
 *
 * <p>One scheduling thread owns the settings, the fire times and the latest report. Everything
 * that changes them arrives as a message on its mailbox, and the thread sleeps on the mailbox
 * until the next timer is due. Tick work runs on a separate executor; a tick that fires while the
 * previous one of the same kind is still working is skipped, never overlapped.
 */
public class SchedulerCore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SchedulerCore.class);

    private final Ticker ticker;
    private final TaskExecutionEngine engine;
    private final PluginRegistry registry;
    private final TradeCalendarService calendar;
    private final MissingDataDetector detector;
    private final TaskHistoryStore history;
    private final SyncRunner runner;
    private final SyncRunLog runs = new SyncRunLog();
    private final ExecutorService tickExecutor;
    private final Duration shutdownGrace;

    private final LinkedBlockingQueue<Runnable> mailbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean calendarRefreshBusy = new AtomicBoolean(false);
    private final AtomicBoolean missingCheckBusy = new AtomicBoolean(false);
    private final AtomicBoolean syncBusy = new AtomicBoolean(false);
    private final AtomicBoolean cleanupBusy = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Counter overlapSkips;
    private final Counter calendarRefreshFailures;

    // Written only by the scheduling thread.
    private volatile ScheduleSettings settings;
    private volatile MissingDataReport latestReport;
    private volatile FireSchedule.NextFires nextFires;
    private volatile boolean running;
    private volatile Thread thread;

    public SchedulerCore(Ticker ticker,
                         TaskExecutionEngine engine,
                         PluginRegistry registry,
                         TradeCalendarService calendar,
                         MissingDataDetector detector,
                         TaskHistoryStore history,
                         Metrics metrics,
                         ScheduleSettings settings,
                         Duration shutdownGrace) {
        this.ticker = ticker;
        this.engine = engine;
        this.registry = registry;
        this.calendar = calendar;
        this.detector = detector;
        this.history = history;
        this.settings = settings;
        this.shutdownGrace = shutdownGrace;
        AtomicInteger n = new AtomicInteger();
        this.tickExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "scheduler-tick-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.runner = new SyncRunner(registry, engine, calendar, tickExecutor, ticker, metrics);
        this.overlapSkips = metrics.counter("tick.skipped.overlap");
        this.calendarRefreshFailures = metrics.counter("calendar.refresh.failed");
        this.nextFires = FireSchedule.compute(now(), settings);
        metrics.gauge("runs.retained", runs::size);
        engine.setMaxConcurrentTasks(settings.maxConcurrentTasks());
    }

    public void start() {
        if (!started.compareAndSet(false, true)) return;
        running = true;
        Thread t = new Thread(this::loop, "scheduler");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    private void loop() {
        recompute();
        log.info("Scheduler started; next fires {}", nextFires);
        try {
            while (running) {
                Runnable cmd = ticker.poll(mailbox, nextFires.earliest().toInstant());
                if (cmd != null) {
                    cmd.run();
                } else {
                    fireDue();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler stopped");
    }

    private ZonedDateTime now() {
        return ticker.now().atZone(ticker.zone());
    }

    private void recompute() {
        nextFires = FireSchedule.compute(now(), settings);
    }

    private void fireDue() {
        ZonedDateTime now = now();
        FireSchedule.NextFires due = nextFires;
        CompletableFuture<?> refreshed = CompletableFuture.completedFuture(null);
        if (!now.isBefore(due.calendarRefresh())) {
            refreshed = startCalendarRefresh();
        }
        if (due.missingCheck() != null && !now.isBefore(due.missingCheck())) {
            startMissingCheck(true, refreshed);
        }
        if (due.sync() != null && !now.isBefore(due.sync())) {
            startSync(TriggerType.SCHEDULED);
        }
        if (!now.isBefore(due.cleanup())) {
            startCleanup();
        }
        recompute();
    }

    /** Runs {@code action} on the scheduling thread. */
    private <T> CompletableFuture<T> ask(Supplier<T> action) {
        CompletableFuture<T> f = new CompletableFuture<>();
        if (!running) {
            f.completeExceptionally(new IllegalStateException("Scheduler is not running"));
            return f;
        }
        mailbox.add(() -> {
            try {
                f.complete(action.get());
            } catch (RuntimeException e) {
                f.completeExceptionally(e);
            }
        });
        return f;
    }

    /** Reloads the trade calendar off the scheduling thread. A failure keeps the previous snapshot. */
    private CompletableFuture<TradeCalendarService.Coverage> startCalendarRefresh() {
        if (!calendarRefreshBusy.compareAndSet(false, true)) {
            overlapSkips.inc();
            log.warn("Calendar refresh skipped: previous refresh still running");
            return CompletableFuture.failedFuture(new IllegalStateException("calendar refresh already running"));
        }
        return CompletableFuture.supplyAsync(() -> {
            calendar.refresh();
            return calendar.coverage();
        }, tickExecutor).whenComplete((coverage, ex) -> {
            calendarRefreshBusy.set(false);
            if (ex != null) {
                calendarRefreshFailures.inc();
                log.error("Calendar refresh failed, keeping the loaded calendar: {}", ex.getMessage());
            }
        });
    }

    /** Runs after {@code after} completes, whether or not it succeeded. */
    private CompletableFuture<MissingDataReport> startMissingCheck(boolean scheduled, CompletableFuture<?> after) {
        if (!missingCheckBusy.compareAndSet(false, true)) {
            overlapSkips.inc();
            log.warn("Missing-data check skipped: previous check still running");
            return CompletableFuture.failedFuture(new IllegalStateException("missing-data check already running"));
        }
        int lookback = settings.lookbackDays();
        LocalDate today = ticker.today();
        return after.handle((v, ex) -> null).thenApplyAsync(ignored -> {
            if (scheduled && !calendar.isTradingDay(today)) {
                log.info("Missing-data check skipped: {} is not a trading day", today);
                return null;
            }
            MissingDataReport report = detector.detect(lookback, calendar.previousTradingDay(today));
            report.missing().forEach((unit, days) -> {
                if (!days.isEmpty()) log.warn("{} is missing {} trading days: {}", unit, days.size(), days);
            });
            return report;
        }, tickExecutor).thenCompose(report -> report == null
                ? CompletableFuture.<MissingDataReport>completedFuture(null)
                : ask(() -> latestReport = report)
        ).whenComplete((r, ex) -> {
            missingCheckBusy.set(false);
            if (ex != null) log.error("Missing-data check failed: {}", ex.getMessage(), ex);
        });
    }

    private SyncRun startSync(TriggerType trigger) {
        SyncRun run = new SyncRun(UUID.randomUUID().toString(), trigger, ticker.now(), null);
        runs.add(run);
        if (!syncBusy.compareAndSet(false, true)) {
            overlapSkips.inc();
            log.warn("Sync run {} skipped: previous sync still running", run.id());
            run.finish(SyncRun.Status.SKIPPED, "previous sync still running", ticker.now());
            return run;
        }
        run.onFinish(() -> syncBusy.set(false));
        ScheduleSettings s = settings;
        MissingDataReport report = latestReport;
        LocalDate today = ticker.today();
        tickExecutor.execute(() -> {
            try {
                runner.sync(run, s, report, today);
            } catch (RuntimeException e) {
                log.error("Sync run {} failed: {}", run.id(), e.getMessage(), e);
                run.finish(SyncRun.Status.FAILED, e.getMessage(), ticker.now());
            }
        });
        return run;
    }

    private void startCleanup() {
        if (!cleanupBusy.compareAndSet(false, true)) {
            overlapSkips.inc();
            log.warn("History cleanup skipped: previous cleanup still running");
            return;
        }
        int days = settings.retentionDays();
        tickExecutor.execute(() -> {
            try {
                int removed = history.cleanupOlderThan(days);
                log.info("History cleanup removed {} records older than {} days", removed, days);
            } catch (RuntimeException e) {
                log.error("History cleanup failed", e);
            } finally {
                cleanupBusy.set(false);
            }
        });
    }

    public ScheduleSettings settings() { return settings; }

    /** Applies new settings, recomputes the fire times and resizes the task cap. */
    public CompletableFuture<ScheduleSettings> updateSettings(ScheduleSettings next) {
        return ask(() -> {
            ScheduleSettings prev = settings;
            settings = next;
            engine.setMaxConcurrentTasks(next.maxConcurrentTasks());
            recompute();
            log.info("Schedule settings updated: {} -> {}; next fires {}", prev, next, nextFires);
            return next;
        });
    }

    /** Starts a manual sync run, ignoring the trading-day filter. */
    public CompletableFuture<SyncRun> triggerSync() {
        return ask(() -> startSync(TriggerType.MANUAL));
    }

    /** Runs the missing-data check now; completes with its report. */
    public CompletableFuture<MissingDataReport> triggerMissingCheck() {
        return ask(() -> startMissingCheck(false, CompletableFuture.completedFuture(null))).thenCompose(f -> f);
    }

    /** Reloads the trade calendar now; completes with the new coverage or the load failure. */
    public CompletableFuture<TradeCalendarService.Coverage> refreshCalendar() {
        return ask(this::startCalendarRefresh).thenCompose(f -> f);
    }

    /** Marks a running run STOPPED and cancels its live tasks. */
    public CompletableFuture<SyncRun> stopRun(String runId) {
        return ask(() -> {
            SyncRun run = runs.find(runId).orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
            if (!run.finish(SyncRun.Status.STOPPED, "stopped by operator", ticker.now())) {
                throw new IllegalStateException("Run " + runId + " already ended " + run.status());
            }
            int cancelled = 0;
            for (UnitOutcome o : run.outcomes()) {
                if (o.taskId() != null && engine.cancel(o.taskId())) cancelled++;
            }
            log.info("Sync run {} stopped, {} tasks cancelled", runId, cancelled);
            return run;
        });
    }

    /** Starts a RETRY run resubmitting the failed units of an ended run. */
    public CompletableFuture<SyncRun> retryFailed(String runId) {
        return ask(() -> {
            SyncRun original = runs.find(runId).orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
            if (!original.status().isTerminal()) throw new IllegalStateException("Run " + runId + " is still running");
            List<UnitOutcome> failed = original.outcomes().stream().filter(UnitOutcome::isRetryable).toList();
            if (failed.isEmpty()) throw new IllegalStateException("Run " + runId + " has no failed units");
            if (!syncBusy.compareAndSet(false, true)) throw new IllegalStateException("A sync run is in progress");
            SyncRun retry = new SyncRun(UUID.randomUUID().toString(), TriggerType.RETRY, ticker.now(), runId);
            runs.add(retry);
            retry.onFinish(() -> syncBusy.set(false));
            LocalDate today = ticker.today();
            tickExecutor.execute(() -> {
                try {
                    runner.retry(retry, failed, today);
                } catch (RuntimeException e) {
                    log.error("Retry run {} failed: {}", retry.id(), e.getMessage(), e);
                    retry.finish(SyncRun.Status.FAILED, e.getMessage(), ticker.now());
                }
            });
            return retry;
        });
    }

    public Optional<MissingDataReport> latestReport() { return Optional.ofNullable(latestReport); }

    public FireSchedule.NextFires nextFireTimes() { return nextFires; }

    public List<SyncRun> runs() { return runs.recent(SyncRunLog.DEFAULT_CAPACITY); }

    public Optional<SyncRun> run(String id) { return runs.find(id); }

    public PluginRegistry registry() { return registry; }

    public TaskExecutionEngine engine() { return engine; }

    public boolean isRunning() { return running; }

    /** Stops firing timers, then shuts the engine down with the configured grace period. */
    public void shutdown() {
        if (running) {
            try {
                ask(() -> running = false).get(5, TimeUnit.SECONDS);
            } catch (Exception e) {
                log.warn("Scheduler thread did not acknowledge shutdown: {}", e.toString());
                running = false;
            }
            Thread t = thread;
            if (t != null) {
                t.interrupt();
                try { t.join(5000); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
            }
        }
        engine.shutdown(shutdownGrace);
        tickExecutor.shutdownNow();
    }

    @Override
    public void close() { shutdown(); }
}
