package io.marketsync.ingestor;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.marketsync.admin.AdminServer;
import io.marketsync.calendar.Market;
import io.marketsync.calendar.TradeCalendarService;
import io.marketsync.config.SchedulerConfig;
import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskStatus;
import io.marketsync.history.HistoryQuery;
import io.marketsync.history.JdbcTaskHistoryStore;
import io.marketsync.history.TaskHistoryStore;
import io.marketsync.registry.PluginRegistry;
import io.marketsync.runtime.TaskExecutionEngine;
import io.marketsync.runtime.TaskRequest;
import io.marketsync.schedule.Frequency;
import io.marketsync.schedule.SchedulerCore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class SchedulerModuleTest {
    @TempDir
    Path dir;

    private SchedulerConfig config(String jdbcUrl) {
        return new SchedulerConfig(null, Market.NYSE, 2023, 2025, dir, 0, 2, 4, 1, 1, 5, 1, 3, 5,
                LocalTime.of(15, 30), LocalTime.of(16, 0), LocalTime.of(18, 0), LocalTime.of(3, 0), Frequency.WEEKDAYS,
                true, false, true, 30,
                jdbcUrl, "sa", "", ZoneId.of("America/New_York"), 2);
    }

    @Test
    void wires_one_engine_behind_scheduler_and_admin() throws Exception {
        Injector injector = Guice.createInjector(new SchedulerModule(config(null)));
        SchedulerCore scheduler = injector.getInstance(SchedulerCore.class);
        AdminServer admin = injector.getInstance(AdminServer.class);
        try {
            assertSame(injector.getInstance(TaskExecutionEngine.class), scheduler.engine());
            assertSame(injector.getInstance(PluginRegistry.class), scheduler.registry());
            assertEquals(2, scheduler.engine().maxConcurrentTasks());
            assertTrue(injector.getInstance(TradeCalendarService.class).isLoaded());
            assertFalse(injector.getInstance(TaskHistoryStore.class) instanceof JdbcTaskHistoryStore);
            assertTrue(admin.port() > 0);
        } finally {
            admin.close();
            scheduler.shutdown();
        }
    }

    @Test
    void jdbc_history_records_tasks_of_the_demo_catalog() throws Exception {
        Injector injector = Guice.createInjector(new SchedulerModule(config("jdbc:h2:mem:module-test;DB_CLOSE_DELAY=-1")));
        TaskHistoryStore history = injector.getInstance(TaskHistoryStore.class);
        assertTrue(history instanceof JdbcTaskHistoryStore);
        SchedulerCore scheduler = injector.getInstance(SchedulerCore.class);
        try {
            DemoUnitCatalog.register(scheduler.registry(), dir, injector.getInstance(java.time.Clock.class));
            TaskExecutionEngine engine = scheduler.engine();
            String id = engine.submit(TaskRequest.of("stock_basic", TaskKind.FULL, List.of()));

            assertEquals(TaskStatus.COMPLETED, engine.completion(id).get(10, TimeUnit.SECONDS).status());
            assertEquals(1, history.count(HistoryQuery.builder().unitName("stock_basic").build()));
        } finally {
            scheduler.shutdown();
            history.close();
        }
    }
}
