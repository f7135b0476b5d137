package io.marketsync.ingestor;

import io.marketsync.core.Cadence;
import io.marketsync.core.UnitDescriptor;
import io.marketsync.core.UnitRole;
import io.marketsync.registry.PluginRegistry;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * A small market-data catalog backed by {@link CsvPartitionStore}s: reference data, two daily
 * primaries and a derived daily unit.
 */
public final class DemoUnitCatalog {
    private DemoUnitCatalog() {}

    /** Registers the catalog and returns the store behind each unit, keyed by unit name. */
    public static Map<String, CsvPartitionStore> register(PluginRegistry registry, Path dataDir, Clock clock) {
        Map<String, CsvPartitionStore> stores = new LinkedHashMap<>();
        add(registry, stores, dataDir, clock, "stock_basic",
                b -> b.cadence(Cadence.WEEKLY).role(UnitRole.BASIC).rateLimitPerMinute(60));
        add(registry, stores, dataDir, clock, "trade_calendar",
                b -> b.cadence(Cadence.OTHER).role(UnitRole.BASIC).rateLimitPerMinute(60));
        add(registry, stores, dataDir, clock, "daily",
                b -> b.dependsOn("stock_basic").rateLimitPerMinute(500));
        add(registry, stores, dataDir, clock, "adj_factor",
                b -> b.dependsOn("stock_basic").rateLimitPerMinute(500));
        add(registry, stores, dataDir, clock, "daily_basic",
                b -> b.dependsOn("daily").optionallyDependsOn("adj_factor").role(UnitRole.DERIVED).rateLimitPerMinute(200));
        return stores;
    }

    private static void add(PluginRegistry registry, Map<String, CsvPartitionStore> stores, Path dataDir, Clock clock,
                            String name, UnaryOperator<UnitDescriptor.Builder> config) {
        CsvPartitionStore store = new CsvPartitionStore(dataDir, name, clock);
        registry.register(config.apply(UnitDescriptor.builder(name)).probe(store).fetcher(store).build());
        stores.put(name, store);
    }
}
