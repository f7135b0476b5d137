package io.marketsync.runtime;

import com.codahale.metrics.MetricRegistry;
import io.marketsync.history.InMemoryTaskHistoryStore;
import io.marketsync.history.TaskHistoryStore;
import io.marketsync.metrics.Metrics;
import io.marketsync.registry.PluginRegistry;
import io.marketsync.retry.ExponentialBackoffRetryPolicy;
import io.marketsync.retry.RetryPolicy;

import java.time.Clock;
import java.util.Objects;

public class TaskEngineBuilder {
    private final PluginRegistry registry;
    private TaskHistoryStore history;
    private RetryPolicy retryPolicy = ExponentialBackoffRetryPolicy.withRetries(3, 500, 30_000);
    private MetricRegistry metricRegistry = new MetricRegistry();
    private Clock clock = Clock.systemUTC();
    private int maxConcurrentTasks = 3;
    private int maxPartitionParallelism = 10;
    private long defaultCallMillis = 1000;

    TaskEngineBuilder(PluginRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public TaskEngineBuilder history(TaskHistoryStore h) { this.history = h; return this; }
    public TaskEngineBuilder retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public TaskEngineBuilder metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public TaskEngineBuilder clock(Clock c) { this.clock = c; return this; }
    public TaskEngineBuilder maxConcurrentTasks(int k) { this.maxConcurrentTasks = Math.max(1, k); return this; }
    public TaskEngineBuilder maxPartitionParallelism(int m) { this.maxPartitionParallelism = Math.max(1, m); return this; }
    public TaskEngineBuilder defaultCallMillis(long ms) { this.defaultCallMillis = Math.max(1, ms); return this; }

    /** Builds and starts the engine. */
    public TaskExecutionEngine build() {
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(clock, "clock");
        TaskHistoryStore h = history != null ? history : new InMemoryTaskHistoryStore(clock);
        TaskExecutionEngine engine = new TaskExecutionEngine(registry, h, retryPolicy, new Metrics(metricRegistry, "engine"),
                clock, maxConcurrentTasks, maxPartitionParallelism, defaultCallMillis);
        engine.start();
        return engine;
    }
}
