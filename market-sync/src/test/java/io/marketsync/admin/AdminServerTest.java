package io.marketsync.admin;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketsync.FakeTicker;
import io.marketsync.MemoryUnits;
import io.marketsync.SwitchableCalendarSource;
import io.marketsync.calendar.Market;
import io.marketsync.calendar.RuleCalendarSource;
import io.marketsync.calendar.TradeCalendarService;
import io.marketsync.core.TaskStatus;
import io.marketsync.detect.MissingDataDetector;
import io.marketsync.history.InMemoryTaskHistoryStore;
import io.marketsync.metrics.Metrics;
import io.marketsync.registry.PluginRegistry;
import io.marketsync.retry.ExponentialBackoffRetryPolicy;
import io.marketsync.runtime.TaskExecutionEngine;
import io.marketsync.schedule.ScheduleSettings;
import io.marketsync.schedule.SchedulerCore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class AdminServerTest {
    private static final ZonedDateTime NOW = ZonedDateTime.of(2024, 3, 28, 12, 0, 0, 0, ZoneId.of("America/New_York"));

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private final PluginRegistry registry = new PluginRegistry();
    private final MetricRegistry metrics = new MetricRegistry();
    private TaskExecutionEngine engine;
    private SchedulerCore scheduler;
    private AdminServer http;
    private int port;

    @AfterEach
    void tearDown() {
        if (http != null) http.close();
        if (scheduler != null) scheduler.shutdown();
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket s = new java.net.ServerSocket(0)) { return s.getLocalPort(); }
    }

    private void start(TradeCalendarService calendar) throws Exception {
        engine = TaskExecutionEngine.builder(registry)
                .history(new InMemoryTaskHistoryStore())
                .retry(ExponentialBackoffRetryPolicy.withRetries(1, 1, 5))
                .metrics(metrics)
                .build();
        scheduler = new SchedulerCore(new FakeTicker(NOW), engine, registry, calendar,
                new MissingDataDetector(calendar, registry, Clock.fixed(NOW.toInstant(), NOW.getZone())),
                engine.history(), new Metrics(metrics, "scheduler"), ScheduleSettings.defaults(), Duration.ofSeconds(2));
        scheduler.start();
        port = freePort();
        http = new AdminServer(port, scheduler, calendar, metrics);
        http.start();
    }

    private void start() throws Exception {
        registry.register(MemoryUnits.builder("a", MemoryUnits.store(LocalDate.of(2024, 3, 27))).build());
        registry.register(MemoryUnits.builder("b", MemoryUnits.store(LocalDate.of(2024, 3, 27)), "a").build());
        registry.register(MemoryUnits.builder("x", MemoryUnits.store()).build());
        registry.register(MemoryUnits.builder("y", MemoryUnits.store(), "x").build());
        start(new TradeCalendarService(new RuleCalendarSource(Market.NYSE, 2024, 2024)));
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(json)).build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> r) throws Exception {
        return mapper.readTree(r.body());
    }

    private static List<String> toDates(JsonNode array) {
        List<String> out = new java.util.ArrayList<>();
        array.forEach(n -> out.add(n.asText()));
        return out;
    }

    @Test
    void serves_status_and_metrics() throws Exception {
        start();

        HttpResponse<String> status = get("/status");
        assertEquals(200, status.statusCode());
        JsonNode s = json(status);
        assertTrue(s.get("running").asBoolean());
        assertTrue(s.get("calendarLoaded").asBoolean());
        assertEquals(4, s.get("units").asInt());
        assertEquals(3, s.get("maxConcurrentTasks").asInt());

        HttpResponse<String> m = get("/metrics");
        assertEquals(200, m.statusCode());
        JsonNode mj = json(m);
        assertTrue(mj.has("engine.task.submitted"), m.body());
        assertTrue(mj.has("engine.tasks.running"), m.body());
    }

    @Test
    void config_updates_are_merged_and_validated() throws Exception {
        start();

        assertEquals(200, get("/config").statusCode());
        HttpResponse<String> ok = post("/config", "{\"syncTime\":\"19:30\",\"maxConcurrentTasks\":5}");
        assertEquals(200, ok.statusCode(), ok.body());
        assertEquals(LocalTime.of(19, 30), scheduler.settings().syncTime());
        assertEquals(5, scheduler.settings().maxConcurrentTasks());
        assertEquals(3, scheduler.settings().backfillThreshold());
        assertEquals(5, engine.maxConcurrentTasks());
        assertEquals(200, post("/config", "{\"smartBackfillEnabled\":false}").statusCode());
        assertFalse(scheduler.settings().smartBackfillEnabled());

        assertEquals(400, post("/config", "{\"bogus\":1}").statusCode());
        assertEquals(400, post("/config", "{\"maxConcurrentTasks\":0}").statusCode());
        assertEquals(400, post("/config", "{\"frequency\":\"HOURLY\"}").statusCode());
        assertEquals(5, scheduler.settings().maxConcurrentTasks());
    }

    @Test
    void units_can_be_listed_and_toggled() throws Exception {
        start();

        JsonNode units = json(get("/units"));
        assertEquals(4, units.size());
        JsonNode a = json(get("/units/a"));
        assertEquals("[\"b\"]", a.get("reverseDependencies").toString());
        assertFalse(json(get("/units/y")).get("dependenciesSatisfied").asBoolean());

        assertEquals(200, post("/units/b/enabled", "{\"enabled\":false}").statusCode());
        assertFalse(registry.unit("b").isEnabled());
        assertEquals(200, post("/units/a/full-scan", "{\"fullScan\":true}").statusCode());
        assertTrue(registry.unit("a").isFullScan());

        assertEquals(404, post("/units/zzz/enabled", "{\"enabled\":true}").statusCode());
        assertEquals(400, post("/units/a/full-scan", "{}").statusCode());
        assertEquals(404, get("/units/zzz").statusCode());
    }

    @Test
    void tasks_are_submitted_polled_and_recorded() throws Exception {
        start();

        HttpResponse<String> submitted = post("/tasks",
                "{\"unitName\":\"a\",\"kind\":\"INCREMENTAL\",\"partitions\":[\"2024-03-28\"]}");
        assertEquals(202, submitted.statusCode(), submitted.body());
        String id = json(submitted).get("taskId").asText();
        assertEquals(TaskStatus.COMPLETED, engine.completion(id).get(10, TimeUnit.SECONDS).status());

        JsonNode task = json(get("/tasks/" + id));
        assertEquals("COMPLETED", task.get("status").asText());
        assertEquals("[\"2024-03-28\"]", task.get("partitions").toString());

        JsonNode history = json(get("/history?unit=a"));
        assertEquals(1, history.get("total").asInt());
        assertEquals(id, history.get("items").get(0).get("taskId").asText());
        assertEquals(200, get("/history/" + id).statusCode());
        assertEquals(400, get("/history?kind=bogus").statusCode());

        assertEquals(409, post("/tasks/" + id + "/cancel", "").statusCode());
        assertEquals(404, get("/tasks/nope").statusCode());
        assertEquals(400, post("/tasks", "{\"unitName\":\"a\",\"kind\":\"INCREMENTAL\"}").statusCode());
        assertEquals(404, post("/tasks", "{\"unitName\":\"zzz\",\"kind\":\"FULL\"}").statusCode());
    }

    @Test
    void unsatisfied_dependency_is_a_conflict_listing_what_is_missing() throws Exception {
        start();

        HttpResponse<String> r = post("/tasks", "{\"unitName\":\"y\",\"kind\":\"FULL\"}");

        assertEquals(409, r.statusCode());
        JsonNode missing = json(r).get("missing");
        assertEquals(1, missing.size());
        assertEquals("x", missing.get(0).get("name").asText());
        assertEquals("NO_DATA", missing.get(0).get("reason").asText());
    }

    @Test
    void runs_can_be_triggered_inspected_and_retried() throws Exception {
        start();

        HttpResponse<String> triggered = post("/sync", "");
        assertEquals(202, triggered.statusCode(), triggered.body());
        String runId = json(triggered).get("id").asText();
        scheduler.run(runId).orElseThrow().completion().get(10, TimeUnit.SECONDS);

        JsonNode run = json(get("/runs/" + runId));
        assertEquals("COMPLETED", run.get("status").asText());
        assertEquals("MANUAL", run.get("trigger").asText());
        assertEquals(4, run.get("outcomes").size());
        assertEquals(1, json(get("/runs")).size());
        assertEquals(404, get("/runs/nope").statusCode());
        assertEquals(409, post("/runs/" + runId + "/stop", "").statusCode());

        // nothing failed, so there is nothing to retry
        assertEquals(409, post("/runs/" + runId + "/retry", "").statusCode());
        assertEquals(404, post("/runs/nope/retry", "").statusCode());
    }

    @Test
    void missing_report_is_served_after_a_check() throws Exception {
        start();

        assertEquals(404, get("/missing").statusCode());
        HttpResponse<String> checked = post("/missing/check", "");
        assertEquals(200, checked.statusCode(), checked.body());
        JsonNode report = json(checked);
        assertEquals("2024-03-27", report.get("windowEnd").asText());
        JsonNode missing = report.get("missing");
        assertEquals(4, missing.size());
        assertFalse(toDates(missing.get("a")).contains("2024-03-27"));
        assertTrue(toDates(missing.get("x")).contains("2024-03-27"));
        assertTrue(missing.get("x").size() > missing.get("a").size());

        HttpResponse<String> latest = get("/missing");
        assertEquals(200, latest.statusCode());
        assertEquals(report.get("checkedAt"), json(latest).get("checkedAt"));
    }

    @Test
    void calendar_outage_is_service_unavailable() throws Exception {
        start(new TradeCalendarService(List::of));

        assertEquals(503, post("/missing/check", "").statusCode());
        assertFalse(json(get("/status")).get("calendarLoaded").asBoolean());
    }

    @Test
    void calendar_can_be_inspected_and_reloaded() throws Exception {
        SwitchableCalendarSource source = new SwitchableCalendarSource().down(true);
        start(new TradeCalendarService(source));

        assertFalse(json(get("/calendar")).get("loaded").asBoolean());
        assertEquals(503, post("/calendar/refresh", "").statusCode());
        assertEquals(503, post("/missing/check", "").statusCode());

        source.down(false).throughYear(2025);
        HttpResponse<String> refreshed = post("/calendar/refresh", "");
        assertEquals(200, refreshed.statusCode(), refreshed.body());
        assertEquals("2025-12-31", json(refreshed).get("coverage").get("last").asText());

        JsonNode c = json(get("/calendar"));
        assertTrue(c.get("loaded").asBoolean());
        assertEquals("2024-01-01", c.get("coverage").get("first").asText());
        assertTrue(c.get("totalTradingDays").asInt() > 400, c.toString());
        assertEquals(200, post("/missing/check", "").statusCode());
        assertEquals(405, get("/calendar/refresh").statusCode());
    }
}
