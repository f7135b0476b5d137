package io.marketsync.schedule;

import com.codahale.metrics.Counter;
import io.marketsync.calendar.TradeCalendarService;
import io.marketsync.core.Partition;
import io.marketsync.core.TaskKind;
import io.marketsync.core.UnitDescriptor;
import io.marketsync.detect.MissingDataReport;
import io.marketsync.metrics.Metrics;
import io.marketsync.policy.BackfillDecision;
import io.marketsync.policy.SmartBackfillPolicy;
import io.marketsync.registry.DependencyNotSatisfiedException;
import io.marketsync.registry.PluginRegistry;
import io.marketsync.runtime.TaskExecutionEngine;
import io.marketsync.runtime.TaskRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Turns one sync run into engine submissions. Units go in dependency order and each unit waits
 * until the tasks of its direct dependencies in the same run have ended.
 */
final class SyncRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncRunner.class);

    private final PluginRegistry registry;
    private final TaskExecutionEngine engine;
    private final TradeCalendarService calendar;
    private final Executor executor;
    private final Ticker ticker;
    private final Counter alerts;

    private record UnitPlan(TaskKind kind, List<Partition> partitions, int missingCount, boolean alert) {}

    SyncRunner(PluginRegistry registry, TaskExecutionEngine engine, TradeCalendarService calendar,
               Executor executor, Ticker ticker, Metrics metrics) {
        this.registry = registry;
        this.engine = engine;
        this.calendar = calendar;
        this.executor = executor;
        this.ticker = ticker;
        this.alerts = metrics.counter("unit.alert");
    }

    /**
     * Plans every enabled unit against the latest report and submits it. Scheduled runs on a
     * non-trading day end SKIPPED when the settings say so. Every trigger needs a calendar covering
     * {@code today}; without one this throws {@link io.marketsync.calendar.CalendarUnavailableException}
     * before anything is submitted.
     */
    void sync(SyncRun run, ScheduleSettings s, MissingDataReport report, LocalDate today) {
        boolean tradingDay = calendar.isTradingDay(today);
        if (run.trigger() == TriggerType.SCHEDULED && s.skipNonTradingDays() && !tradingDay) {
            log.info("Sync run {} skipped: {} is not a trading day", run.id(), today);
            run.finish(SyncRun.Status.SKIPPED, "non-trading day", ticker.now());
            return;
        }
        List<String> enabled = registry.enabledUnits().stream().map(UnitDescriptor::name).toList();
        if (enabled.isEmpty()) {
            run.finish(SyncRun.Status.COMPLETED, "no enabled units", ticker.now());
            return;
        }
        List<String> plan = registry.executionPlan(enabled, s.includeOptionalDependencies());
        SmartBackfillPolicy policy = s.smartBackfillEnabled() ? new SmartBackfillPolicy(s.backfillThreshold()) : null;
        if (policy == null) log.info("Sync run {}: smart backfill off, every unit syncs {} only", run.id(), today);
        log.info("Sync run {} ({}) planning {} units for {}: {}", run.id(), run.trigger(), plan.size(), today, plan);
        execute(run, plan, unit -> planUnit(unit, policy, report, today));
    }

    /** Resubmits the given outcomes with their original kind and partitions. */
    void retry(SyncRun run, List<UnitOutcome> failed, LocalDate today) {
        // Same calendar requirement as a sync; throws when nothing covers today.
        calendar.isTradingDay(today);
        Map<String, UnitOutcome> byUnit = new LinkedHashMap<>();
        for (UnitOutcome o : failed) byUnit.put(o.unitName(), o);
        List<String> plan = new ArrayList<>();
        for (String name : registry.topologicalOrder(byUnit.keySet())) {
            if (byUnit.containsKey(name)) plan.add(name);
        }
        log.info("Sync run {} retrying {} units: {}", run.id(), plan.size(), plan);
        execute(run, plan, unit -> {
            UnitOutcome o = byUnit.get(unit.name());
            return new UnitPlan(o.taskKind(), o.partitions(), o.missingCount(), false);
        });
    }

    /** A null policy means smart backfill is off: only today is synced, whatever the report says. */
    private UnitPlan planUnit(UnitDescriptor unit, SmartBackfillPolicy policy, MissingDataReport report, LocalDate today) {
        if (unit.isFullScan()) return new UnitPlan(TaskKind.FULL, List.of(Partition.ALL_HISTORY), 0, false);
        Optional<List<LocalDate>> missing = report == null || policy == null ? Optional.empty() : report.missingFor(unit.name());
        if (missing.isEmpty()) return new UnitPlan(TaskKind.INCREMENTAL, List.of(Partition.of(today)), 0, false);
        BackfillDecision d = policy.decide(missing.get(), today);
        if (d.isSkip()) return new UnitPlan(null, List.of(), d.missingCount(), true);
        return new UnitPlan(d.taskKind(), d.partitions(), d.missingCount(), false);
    }

    private void execute(SyncRun run, List<String> plan, Function<UnitDescriptor, UnitPlan> planner) {
        Map<String, CompletableFuture<Void>> done = new HashMap<>();
        for (String name : plan) {
            UnitDescriptor unit = registry.unit(name);
            CompletableFuture<?>[] deps = unit.dependencies().stream()
                    .filter(done::containsKey)
                    .map(done::get)
                    .toArray(CompletableFuture[]::new);
            CompletableFuture<Void> mine = CompletableFuture.allOf(deps)
                    .handle((v, ex) -> null)
                    .thenComposeAsync(v -> runUnit(run, unit, planner), executor);
            done.put(name, mine);
        }
        CompletableFuture.allOf(done.values().toArray(new CompletableFuture[0])).whenComplete((v, ex) -> {
            if (ex != null) {
                log.error("Sync run {} failed", run.id(), ex);
                run.finish(SyncRun.Status.FAILED, String.valueOf(ex.getMessage()), ticker.now());
            } else if (run.finish(SyncRun.Status.COMPLETED, null, ticker.now())) {
                log.info("Sync run {} completed: {}", run.id(), summarize(run.outcomes()));
            }
        });
    }

    private CompletableFuture<Void> runUnit(SyncRun run, UnitDescriptor unit, Function<UnitDescriptor, UnitPlan> planner) {
        String name = unit.name();
        if (run.status() == SyncRun.Status.STOPPED) {
            run.outcome(UnitOutcome.skipped(name, UnitOutcome.Kind.SKIPPED_STOPPED, 0, "run stopped"));
            return CompletableFuture.completedFuture(null);
        }
        if (!unit.isEnabled()) {
            log.warn("Sync run {}: {} is disabled, not syncing it", run.id(), name);
            run.outcome(UnitOutcome.skipped(name, UnitOutcome.Kind.SKIPPED_DISABLED, 0, "unit disabled"));
            return CompletableFuture.completedFuture(null);
        }
        UnitPlan p = planner.apply(unit);
        if (p.alert()) {
            alerts.inc();
            log.error("Sync run {}: {} is missing {} trading days, more than the backfill threshold; skipped, needs a manual backfill",
                    run.id(), name, p.missingCount());
            run.outcome(UnitOutcome.skipped(name, UnitOutcome.Kind.SKIPPED_ALERT, p.missingCount(),
                    p.missingCount() + " days missing"));
            return CompletableFuture.completedFuture(null);
        }
        String taskId;
        try {
            taskId = engine.submit(TaskRequest.of(name, p.kind(), p.partitions()));
        } catch (DependencyNotSatisfiedException e) {
            log.warn("Sync run {}: {} skipped, {}", run.id(), name, e.getMessage());
            run.outcome(new UnitOutcome(name, UnitOutcome.Kind.SKIPPED_DEPENDENCY, null, p.kind(), p.partitions(),
                    p.missingCount(), null, e.getMessage()));
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            log.error("Sync run {}: could not submit {}", run.id(), name, e);
            run.outcome(new UnitOutcome(name, UnitOutcome.Kind.SUBMIT_FAILED, null, p.kind(), p.partitions(),
                    p.missingCount(), null, e.toString()));
            return CompletableFuture.completedFuture(null);
        }
        run.outcome(new UnitOutcome(name, UnitOutcome.Kind.SUBMITTED, taskId, p.kind(), p.partitions(),
                p.missingCount(), null, null));
        // A stop that landed while submitting found no task id to cancel.
        if (run.status() == SyncRun.Status.STOPPED && engine.cancel(taskId)) {
            log.info("Sync run {}: cancelled task {} of {}, run stopped during submission", run.id(), taskId, name);
        }
        return engine.completion(taskId).handle((snap, ex) -> {
            if (snap != null) run.taskFinished(name, snap.status(), snap.message());
            else run.taskFinished(name, null, String.valueOf(ex));
            return null;
        });
    }

    private static String summarize(List<UnitOutcome> outcomes) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (UnitOutcome o : outcomes) {
            String key = o.taskStatus() != null ? o.taskStatus().name() : o.kind().name();
            counts.merge(key, 1, Integer::sum);
        }
        return counts.toString();
    }
}
