package io.marketsync.schedule;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Runtime-mutable scheduler settings. Immutable value; changes go through
 * {@link SchedulerCore#updateSettings(ScheduleSettings)}.
 */
public record ScheduleSettings(
        boolean enabled,
        LocalTime calendarRefreshTime,
        LocalTime missingCheckTime,
        LocalTime syncTime,
        LocalTime cleanupTime,
        Frequency frequency,
        boolean skipNonTradingDays,
        boolean includeOptionalDependencies,
        boolean smartBackfillEnabled,
        int backfillThreshold,
        int lookbackDays,
        int maxConcurrentTasks,
        int retentionDays
) {
    public ScheduleSettings {
        Objects.requireNonNull(calendarRefreshTime, "calendarRefreshTime");
        Objects.requireNonNull(missingCheckTime, "missingCheckTime");
        Objects.requireNonNull(syncTime, "syncTime");
        Objects.requireNonNull(cleanupTime, "cleanupTime");
        Objects.requireNonNull(frequency, "frequency");
        if (backfillThreshold < 0) throw new IllegalArgumentException("backfillThreshold must be >= 0");
        if (lookbackDays < 1) throw new IllegalArgumentException("lookbackDays must be >= 1");
        if (maxConcurrentTasks < 1) throw new IllegalArgumentException("maxConcurrentTasks must be >= 1");
        if (retentionDays < 1) throw new IllegalArgumentException("retentionDays must be >= 1");
    }

    public static ScheduleSettings defaults() {
        return new ScheduleSettings(true, LocalTime.of(15, 30), LocalTime.of(16, 0), LocalTime.of(18, 0), LocalTime.of(3, 0),
                Frequency.WEEKDAYS, true, false, true, 3, 5, 3, 30);
    }

    public Builder toBuilder() { return new Builder(this); }

    public static final class Builder {
        private boolean enabled;
        private LocalTime calendarRefreshTime;
        private LocalTime missingCheckTime;
        private LocalTime syncTime;
        private LocalTime cleanupTime;
        private Frequency frequency;
        private boolean skipNonTradingDays;
        private boolean includeOptionalDependencies;
        private boolean smartBackfillEnabled;
        private int backfillThreshold;
        private int lookbackDays;
        private int maxConcurrentTasks;
        private int retentionDays;

        private Builder(ScheduleSettings s) {
            this.enabled = s.enabled;
            this.calendarRefreshTime = s.calendarRefreshTime;
            this.missingCheckTime = s.missingCheckTime;
            this.syncTime = s.syncTime;
            this.cleanupTime = s.cleanupTime;
            this.frequency = s.frequency;
            this.skipNonTradingDays = s.skipNonTradingDays;
            this.includeOptionalDependencies = s.includeOptionalDependencies;
            this.smartBackfillEnabled = s.smartBackfillEnabled;
            this.backfillThreshold = s.backfillThreshold;
            this.lookbackDays = s.lookbackDays;
            this.maxConcurrentTasks = s.maxConcurrentTasks;
            this.retentionDays = s.retentionDays;
        }

        public Builder enabled(boolean v) { this.enabled = v; return this; }
        public Builder calendarRefreshTime(LocalTime v) { this.calendarRefreshTime = v; return this; }
        public Builder missingCheckTime(LocalTime v) { this.missingCheckTime = v; return this; }
        public Builder syncTime(LocalTime v) { this.syncTime = v; return this; }
        public Builder cleanupTime(LocalTime v) { this.cleanupTime = v; return this; }
        public Builder frequency(Frequency v) { this.frequency = v; return this; }
        public Builder skipNonTradingDays(boolean v) { this.skipNonTradingDays = v; return this; }
        public Builder includeOptionalDependencies(boolean v) { this.includeOptionalDependencies = v; return this; }
        public Builder smartBackfillEnabled(boolean v) { this.smartBackfillEnabled = v; return this; }
        public Builder backfillThreshold(int v) { this.backfillThreshold = v; return this; }
        public Builder lookbackDays(int v) { this.lookbackDays = v; return this; }
        public Builder maxConcurrentTasks(int v) { this.maxConcurrentTasks = v; return this; }
        public Builder retentionDays(int v) { this.retentionDays = v; return this; }

        public ScheduleSettings build() {
            return new ScheduleSettings(enabled, calendarRefreshTime, missingCheckTime, syncTime, cleanupTime, frequency,
                    skipNonTradingDays, includeOptionalDependencies, smartBackfillEnabled, backfillThreshold, lookbackDays,
                    maxConcurrentTasks, retentionDays);
        }
    }
}
