package io.marketsync.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

/**
 * Thin facade over a shared {@link MetricRegistry}; every name is scoped under one prefix
 * ("engine", "scheduler", ...).
 */
public class Metrics {
    private final MetricRegistry registry;
    private final String prefix;

    public Metrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
    }

    public MetricRegistry registry() { return registry; }

    public Counter counter(String name) { return registry.counter(name(name)); }
    public Meter meter(String name) { return registry.meter(name(name)); }
    public Timer timer(String name) { return registry.timer(name(name)); }

    public <T> void gauge(String name, Gauge<T> gauge) {
        registry.gauge(name(name), () -> gauge);
    }

    private String name(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
