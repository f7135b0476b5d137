package io.marketsync.config;

import io.marketsync.calendar.Market;
import io.marketsync.schedule.Frequency;
import io.marketsync.schedule.ScheduleSettings;

import java.nio.file.Path;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Process-level settings. {@code calendarFile} null means the calendar comes from the
 * {@code market} rules; {@code historyJdbcUrl} null keeps task history in memory.
 */
public record SchedulerConfig(
        Path calendarFile,
        Market market,
        int calendarFromYear,
        int calendarToYear,
        Path dataDir,
        int adminPort,
        int maxConcurrentTasks,
        int maxPartitionParallelism,
        long defaultCallMillis,
        long retryBaseMillis,
        long retryMaxMillis,
        int maxRetries,
        int backfillThreshold,
        int lookbackDays,
        LocalTime calendarRefreshTime,
        LocalTime missingCheckTime,
        LocalTime syncTime,
        LocalTime cleanupTime,
        Frequency frequency,
        boolean skipNonTradingDays,
        boolean includeOptionalDependencies,
        boolean smartBackfillEnabled,
        int retentionDays,
        String historyJdbcUrl,
        String historyJdbcUser,
        String historyJdbcPassword,
        ZoneId zone,
        int shutdownGraceSeconds
) {
    public static SchedulerConfig fromEnv() {
        String cal = get("calendar.file", "CALENDAR_FILE", "");
        Market market = Market.valueOf(get("market", "MARKET", "NYSE").toUpperCase());
        int fromYear = Integer.parseInt(get("calendar.from", "CALENDAR_FROM", "2015"));
        int toYear = Integer.parseInt(get("calendar.to", "CALENDAR_TO", "2030"));
        Path data = Path.of(get("data", "DATA", "./market-data"));
        int port = Integer.parseInt(get("port", "PORT", "8080"));
        int k = Integer.parseInt(get("tasks", "TASKS", "3"));
        int m = Integer.parseInt(get("partitions", "PARTITIONS", "10"));
        long call = Long.parseLong(get("call.millis", "CALL_MILLIS", "1000"));
        long base = Long.parseLong(get("retry.base.millis", "RETRY_BASE_MILLIS", "500"));
        long max = Long.parseLong(get("retry.max.millis", "RETRY_MAX_MILLIS", "30000"));
        int retries = Integer.parseInt(get("retries", "RETRIES", "3"));
        int threshold = Integer.parseInt(get("backfill.threshold", "BACKFILL_THRESHOLD", "3"));
        int lookback = Integer.parseInt(get("lookback.days", "LOOKBACK_DAYS", "5"));
        LocalTime refresh = LocalTime.parse(get("calendar.refresh.time", "CALENDAR_REFRESH_TIME", "15:30"));
        LocalTime check = LocalTime.parse(get("check.time", "CHECK_TIME", "16:00"));
        LocalTime sync = LocalTime.parse(get("sync.time", "SYNC_TIME", "18:00"));
        LocalTime cleanup = LocalTime.parse(get("cleanup.time", "CLEANUP_TIME", "03:00"));
        Frequency freq = Frequency.valueOf(get("frequency", "FREQUENCY", "WEEKDAYS").toUpperCase());
        boolean skip = Boolean.parseBoolean(get("skip.non.trading", "SKIP_NON_TRADING", "true"));
        boolean optional = Boolean.parseBoolean(get("include.optional", "INCLUDE_OPTIONAL", "false"));
        boolean smart = Boolean.parseBoolean(get("smart.backfill", "SMART_BACKFILL", "true"));
        int retention = Integer.parseInt(get("retention.days", "RETENTION_DAYS", "30"));
        String jdbc = get("history.jdbc", "HISTORY_JDBC", "");
        String jdbcUser = get("history.user", "HISTORY_USER", "sa");
        String jdbcPassword = get("history.password", "HISTORY_PASSWORD", "");
        ZoneId zone = ZoneId.of(get("zone", "ZONE", "America/New_York"));
        int grace = Integer.parseInt(get("shutdown.grace.seconds", "SHUTDOWN_GRACE_SECONDS", "30"));
        return new SchedulerConfig(cal.isBlank() ? null : Path.of(cal), market, fromYear, toYear, data, port,
                k, m, call, base, max, retries, threshold, lookback, refresh, check, sync, cleanup, freq, skip, optional,
                smart, retention, jdbc.isBlank() ? null : jdbc, jdbcUser, jdbcPassword, zone, grace);
    }

    private static String get(String property, String env, String def) {
        return System.getProperty("marketsync." + property, System.getenv().getOrDefault("MARKETSYNC_" + env, def));
    }

    /** The initial runtime-mutable settings. */
    public ScheduleSettings toSettings() {
        return new ScheduleSettings(true, calendarRefreshTime, missingCheckTime, syncTime, cleanupTime, frequency,
                skipNonTradingDays, includeOptionalDependencies, smartBackfillEnabled, backfillThreshold, lookbackDays,
                maxConcurrentTasks, retentionDays);
    }
}
