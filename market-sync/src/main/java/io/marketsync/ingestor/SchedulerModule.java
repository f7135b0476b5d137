package io.marketsync.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.marketsync.admin.AdminServer;
import io.marketsync.calendar.CalendarSource;
import io.marketsync.calendar.CsvCalendarSource;
import io.marketsync.calendar.RuleCalendarSource;
import io.marketsync.calendar.TradeCalendarService;
import io.marketsync.config.SchedulerConfig;
import io.marketsync.detect.MissingDataDetector;
import io.marketsync.history.InMemoryTaskHistoryStore;
import io.marketsync.history.JdbcTaskHistoryStore;
import io.marketsync.history.TaskHistoryStore;
import io.marketsync.metrics.Metrics;
import io.marketsync.registry.PluginRegistry;
import io.marketsync.retry.ExponentialBackoffRetryPolicy;
import io.marketsync.runtime.TaskExecutionEngine;
import io.marketsync.schedule.SchedulerCore;
import io.marketsync.schedule.SystemTicker;
import io.marketsync.schedule.Ticker;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

public class SchedulerModule extends AbstractModule {
    private final SchedulerConfig config;

    public SchedulerModule(SchedulerConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(SchedulerConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Clock clock() { return Clock.system(config.zone()); }

    @Provides @Singleton Ticker ticker() { return new SystemTicker(config.zone()); }

    @Provides @Singleton CalendarSource calendarSource() {
        if (config.calendarFile() != null) return new CsvCalendarSource(config.calendarFile());
        return new RuleCalendarSource(config.market(), config.calendarFromYear(), config.calendarToYear());
    }

    @Provides @Singleton TradeCalendarService calendar(CalendarSource source) { return new TradeCalendarService(source); }

    @Provides @Singleton PluginRegistry registry() { return new PluginRegistry(); }

    @Provides @Singleton TaskHistoryStore history(Clock clock) {
        if (config.historyJdbcUrl() == null) return new InMemoryTaskHistoryStore(clock);
        return new JdbcTaskHistoryStore(config.historyJdbcUrl(), config.historyJdbcUser(), config.historyJdbcPassword(),
                "task_history", clock);
    }

    @Provides @Singleton TaskExecutionEngine engine(PluginRegistry registry, TaskHistoryStore history, MetricRegistry metrics, Clock clock) {
        return TaskExecutionEngine.builder(registry)
                .history(history)
                .retry(ExponentialBackoffRetryPolicy.withRetries(config.maxRetries(), config.retryBaseMillis(), config.retryMaxMillis()))
                .metrics(metrics)
                .clock(clock)
                .maxConcurrentTasks(config.maxConcurrentTasks())
                .maxPartitionParallelism(config.maxPartitionParallelism())
                .defaultCallMillis(config.defaultCallMillis())
                .build();
    }

    @Provides @Singleton MissingDataDetector detector(TradeCalendarService calendar, PluginRegistry registry, Clock clock) {
        return new MissingDataDetector(calendar, registry, clock);
    }

    @Provides @Singleton SchedulerCore scheduler(Ticker ticker, TaskExecutionEngine engine, PluginRegistry registry,
                                                 TradeCalendarService calendar, MissingDataDetector detector,
                                                 TaskHistoryStore history, MetricRegistry metrics) {
        return new SchedulerCore(ticker, engine, registry, calendar, detector, history,
                new Metrics(metrics, "scheduler"), config.toSettings(), Duration.ofSeconds(config.shutdownGraceSeconds()));
    }

    @Provides @Singleton AdminServer admin(SchedulerCore scheduler, TradeCalendarService calendar, MetricRegistry metrics) throws IOException {
        return new AdminServer(config.adminPort(), scheduler, calendar, metrics);
    }
}
