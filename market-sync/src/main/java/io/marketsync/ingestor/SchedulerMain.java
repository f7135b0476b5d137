package io.marketsync.ingestor;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.marketsync.admin.AdminServer;
import io.marketsync.calendar.Market;
import io.marketsync.config.SchedulerConfig;
import io.marketsync.history.TaskHistoryStore;
import io.marketsync.registry.PluginRegistry;
import io.marketsync.schedule.Frequency;
import io.marketsync.schedule.SchedulerCore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalTime;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Runs the scheduler over the demo catalog with the admin server in front of it. Options default
 * to the {@code marketsync.*} system properties and {@code MARKETSYNC_*} environment variables.
 */
@CommandLine.Command(name = "market-sync", mixinStandardHelpOptions = true, description = "Scheduled market data synchronization")
public final class SchedulerMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SchedulerMain.class);
    private static final SchedulerConfig ENV = SchedulerConfig.fromEnv();

    @CommandLine.Option(names = {"-c", "--calendar"}, description = "Trade calendar CSV (cal_date,is_open); default: market rules")
    Path calendarFile = ENV.calendarFile();

    @CommandLine.Option(names = {"-m", "--market"}, description = "Calendar rules when no file is given: ${COMPLETION-CANDIDATES}")
    Market market = ENV.market();

    @CommandLine.Option(names = {"-d", "--data"}, description = "Directory of the per-unit CSV files")
    Path dataDir = ENV.dataDir();

    @CommandLine.Option(names = {"-p", "--port"}, description = "Admin HTTP port")
    int adminPort = ENV.adminPort();

    @CommandLine.Option(names = {"-k", "--max-tasks"}, description = "Tasks running at once")
    int maxConcurrentTasks = ENV.maxConcurrentTasks();

    @CommandLine.Option(names = {"-t", "--threshold"}, description = "Most missing days filled automatically")
    int backfillThreshold = ENV.backfillThreshold();

    @CommandLine.Option(names = "--calendar-refresh-time", description = "Daily trade calendar reload (HH:mm)")
    LocalTime calendarRefreshTime = ENV.calendarRefreshTime();

    @CommandLine.Option(names = "--check-time", description = "Daily missing-data check (HH:mm)")
    LocalTime missingCheckTime = ENV.missingCheckTime();

    @CommandLine.Option(names = "--sync-time", description = "Sync time (HH:mm)")
    LocalTime syncTime = ENV.syncTime();

    @CommandLine.Option(names = "--cleanup-time", description = "History cleanup time (HH:mm)")
    LocalTime cleanupTime = ENV.cleanupTime();

    @CommandLine.Option(names = "--frequency", description = "Sync days: ${COMPLETION-CANDIDATES}")
    Frequency frequency = ENV.frequency();

    @CommandLine.Option(names = "--history-jdbc", description = "JDBC URL of the task history table; default in memory")
    String historyJdbcUrl = ENV.historyJdbcUrl();

    public static void main(String[] args) {
        int code = new CommandLine(new SchedulerMain()).execute(args);
        System.exit(code);
    }

    SchedulerConfig config() {
        return new SchedulerConfig(calendarFile, market, ENV.calendarFromYear(), ENV.calendarToYear(), dataDir, adminPort,
                maxConcurrentTasks, ENV.maxPartitionParallelism(), ENV.defaultCallMillis(), ENV.retryBaseMillis(),
                ENV.retryMaxMillis(), ENV.maxRetries(), backfillThreshold, ENV.lookbackDays(), calendarRefreshTime,
                missingCheckTime, syncTime, cleanupTime, frequency, ENV.skipNonTradingDays(),
                ENV.includeOptionalDependencies(), ENV.smartBackfillEnabled(), ENV.retentionDays(),
                historyJdbcUrl, ENV.historyJdbcUser(), ENV.historyJdbcPassword(), ENV.zone(), ENV.shutdownGraceSeconds());
    }

    @Override
    public Integer call() throws Exception {
        SchedulerConfig cfg;
        try {
            cfg = config();
            cfg.toSettings();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid settings: " + e.getMessage());
            return 2;
        }
        Injector injector = Guice.createInjector(new SchedulerModule(cfg));
        PluginRegistry registry = injector.getInstance(PluginRegistry.class);
        DemoUnitCatalog.register(registry, cfg.dataDir(), injector.getInstance(Clock.class));

        SchedulerCore scheduler = injector.getInstance(SchedulerCore.class);
        AdminServer admin = injector.getInstance(AdminServer.class);
        TaskHistoryStore history = injector.getInstance(TaskHistoryStore.class);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            admin.close();
            scheduler.shutdown();
            try {
                history.close();
            } catch (Exception e) {
                log.warn("Closing task history failed: {}", e.toString());
            }
            stopped.countDown();
        }, "shutdown"));

        scheduler.start();
        admin.start();
        log.info("market-sync running: {} units, admin on port {}", registry.units().size(), admin.port());
        stopped.await();
        return 0;
    }
}
