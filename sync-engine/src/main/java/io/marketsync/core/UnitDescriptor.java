package io.marketsync.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One ingestible unit of work. Everything except the enabled and full-scan flags is fixed at
 * registration time.
 */
public final class UnitDescriptor {
    private final String name;
    private final List<String> dependencies;
    private final List<String> optionalDependencies;
    private final Cadence cadence;
    private final UnitRole role;
    private final int rateLimitPerMinute;
    private final long estimatedCallMillis; // 0 = use engine default
    private final ExistenceProbe probe;
    private final PartitionFetcher fetcher;
    private final AtomicBoolean enabled;
    private final AtomicBoolean fullScan;

    private UnitDescriptor(Builder b) {
        this.name = b.name;
        this.dependencies = List.copyOf(b.dependencies);
        this.optionalDependencies = List.copyOf(b.optionalDependencies);
        this.cadence = b.cadence;
        this.role = b.role;
        this.rateLimitPerMinute = b.rateLimitPerMinute;
        this.estimatedCallMillis = b.estimatedCallMillis;
        this.probe = b.probe;
        this.fetcher = b.fetcher;
        this.enabled = new AtomicBoolean(b.enabled);
        this.fullScan = new AtomicBoolean(b.fullScan);
    }

    public static Builder builder(String name) { return new Builder(name); }

    public String name() { return name; }
    public List<String> dependencies() { return dependencies; }
    public List<String> optionalDependencies() { return optionalDependencies; }
    public Cadence cadence() { return cadence; }
    public UnitRole role() { return role; }
    public int rateLimitPerMinute() { return rateLimitPerMinute; }
    public long estimatedCallMillis() { return estimatedCallMillis; }
    public ExistenceProbe probe() { return probe; }
    public PartitionFetcher fetcher() { return fetcher; }

    public boolean isEnabled() { return enabled.get(); }
    public void setEnabled(boolean value) { enabled.set(value); }

    public boolean isFullScan() { return fullScan.get(); }
    public void setFullScan(boolean value) { fullScan.set(value); }

    @Override
    public String toString() {
        return "UnitDescriptor{" +
                "name='" + name + '\'' +
                ", dependencies=" + dependencies +
                ", cadence=" + cadence +
                ", enabled=" + enabled.get() +
                ", rateLimitPerMinute=" + rateLimitPerMinute +
                '}';
    }

    public static final class Builder {
        private final String name;
        private final List<String> dependencies = new ArrayList<>();
        private final List<String> optionalDependencies = new ArrayList<>();
        private Cadence cadence = Cadence.DAILY;
        private UnitRole role = UnitRole.PRIMARY;
        private int rateLimitPerMinute = 120;
        private long estimatedCallMillis = 0;
        private ExistenceProbe probe;
        private PartitionFetcher fetcher;
        private boolean enabled = true;
        private boolean fullScan = false;

        private Builder(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("unit name must not be blank");
            this.name = name;
        }

        public Builder dependsOn(String... names) { dependencies.addAll(List.of(names)); return this; }
        public Builder optionallyDependsOn(String... names) { optionalDependencies.addAll(List.of(names)); return this; }
        public Builder cadence(Cadence c) { this.cadence = Objects.requireNonNull(c); return this; }
        public Builder role(UnitRole r) { this.role = Objects.requireNonNull(r); return this; }
        public Builder rateLimitPerMinute(int n) { this.rateLimitPerMinute = Math.max(0, n); return this; }
        public Builder estimatedCallMillis(long ms) { this.estimatedCallMillis = Math.max(0, ms); return this; }
        public Builder probe(ExistenceProbe p) { this.probe = p; return this; }
        public Builder fetcher(PartitionFetcher f) { this.fetcher = f; return this; }
        public Builder enabled(boolean e) { this.enabled = e; return this; }
        public Builder fullScan(boolean f) { this.fullScan = f; return this; }

        public UnitDescriptor build() {
            Objects.requireNonNull(probe, "probe");
            Objects.requireNonNull(fetcher, "fetcher");
            return new UnitDescriptor(this);
        }
    }
}
