package io.marketsync;

import io.marketsync.core.ExistenceProbe;
import io.marketsync.core.FetchResult;
import io.marketsync.core.Partition;
import io.marketsync.core.PartitionFetcher;
import io.marketsync.core.UnitDescriptor;

import java.util.concurrent.atomic.AtomicBoolean;

/** Unit descriptors with in-memory probes and fetchers for tests. */
public final class FakeUnits {
    private FakeUnits() {}

    public static final PartitionFetcher ONE_ROW = (unit, p) -> FetchResult.success(1);

    public static ExistenceProbe probe(boolean hasData) {
        return new ExistenceProbe() {
            @Override public boolean hasData(Partition partition) { return hasData; }
            @Override public boolean hasAnyData() { return hasData; }
        };
    }

    public static ExistenceProbe probe(AtomicBoolean hasData) {
        return new ExistenceProbe() {
            @Override public boolean hasData(Partition partition) { return hasData.get(); }
            @Override public boolean hasAnyData() { return hasData.get(); }
        };
    }

    /** A unit with data and a fetcher writing one row per partition. */
    public static UnitDescriptor unit(String name, String... deps) {
        return UnitDescriptor.builder(name)
                .dependsOn(deps)
                .rateLimitPerMinute(0)
                .probe(probe(true))
                .fetcher(ONE_ROW)
                .build();
    }

    public static UnitDescriptor.Builder builder(String name, String... deps) {
        return UnitDescriptor.builder(name)
                .dependsOn(deps)
                .rateLimitPerMinute(0)
                .probe(probe(true))
                .fetcher(ONE_ROW);
    }
}
