package io.marketsync.admin;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.marketsync.calendar.CalendarUnavailableException;
import io.marketsync.calendar.TradeCalendarService;
import io.marketsync.core.Partition;
import io.marketsync.core.TaskKind;
import io.marketsync.core.TaskStatus;
import io.marketsync.core.UnitDescriptor;
import io.marketsync.core.UnknownUnitException;
import io.marketsync.history.HistoryQuery;
import io.marketsync.history.TaskHistoryStore;
import io.marketsync.registry.DependencyCheckResult;
import io.marketsync.registry.DependencyNotSatisfiedException;
import io.marketsync.registry.PluginRegistry;
import io.marketsync.runtime.TaskExecutionEngine;
import io.marketsync.runtime.TaskRequest;
import io.marketsync.schedule.ScheduleSettings;
import io.marketsync.schedule.SchedulerCore;
import io.marketsync.schedule.SyncRun;
import io.marketsync.schedule.SyncRunView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * JSON control plane over the scheduler: status, metrics, settings, trade calendar, units, runs,
 * tasks and history.
 */
public class AdminServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);
    private static final long WAIT_SECONDS = 60;

    private final HttpServer server;
    private final ExecutorService executor;
    private final SchedulerCore scheduler;
    private final PluginRegistry registry;
    private final TaskExecutionEngine engine;
    private final TaskHistoryStore history;
    private final TradeCalendarService calendar;
    private final MetricRegistry metrics;
    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public AdminServer(int port, SchedulerCore scheduler, TradeCalendarService calendar, MetricRegistry metrics) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.scheduler = scheduler;
        this.registry = scheduler.registry();
        this.engine = scheduler.engine();
        this.history = engine.history();
        this.calendar = calendar;
        this.metrics = metrics;
        server.createContext("/status", new StatusHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/config", new ConfigHandler());
        server.createContext("/calendar", new CalendarHandler());
        server.createContext("/units", new UnitsHandler());
        server.createContext("/missing", new MissingHandler());
        server.createContext("/sync", new SyncHandler());
        server.createContext("/runs", new RunsHandler());
        server.createContext("/tasks", new TasksHandler());
        server.createContext("/history", new HistoryHandler());
        this.executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("Admin server listening on {}", port());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    /** Status code plus body; thrown from handlers to short-circuit. */
    private static final class HttpError extends RuntimeException {
        final int code;
        final Object body;

        HttpError(int code, String message) { this(code, message, null); }

        HttpError(int code, String message, Object body) {
            super(message);
            this.code = code;
            this.body = body;
        }
    }

    private record Response(int code, Object body) {
        static Response ok(Object body) { return new Response(200, body); }
        static Response accepted(Object body) { return new Response(202, body); }
    }

    /**
     * Splits the path below the context, dispatches, and maps exceptions to status codes.
     */
    private abstract class JsonHandler implements HttpHandler {
        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            Response r;
            try {
                String ctx = exchange.getHttpContext().getPath();
                String rest = exchange.getRequestURI().getPath().substring(ctx.length());
                List<String> segments = new ArrayList<>();
                for (String s : rest.split("/")) if (!s.isEmpty()) segments.add(URLDecoder.decode(s, StandardCharsets.UTF_8));
                r = route(exchange.getRequestMethod().toUpperCase(), segments, exchange);
            } catch (Exception t) {
                r = toResponse(unwrap(t));
            }
            send(exchange, r);
        }

        abstract Response route(String method, List<String> path, HttpExchange exchange) throws Exception;
    }

    private Response toResponse(Throwable t) {
        if (t instanceof HttpError e) return new Response(e.code, e.body != null ? e.body : error(e.getMessage()));
        if (t instanceof DependencyNotSatisfiedException e) {
            Map<String, Object> body = error(e.getMessage());
            body.put("unit", e.unitName());
            body.put("missing", e.missing());
            return new Response(409, body);
        }
        if (t instanceof UnknownUnitException e) return new Response(404, error(e.getMessage()));
        if (t instanceof CalendarUnavailableException e) return new Response(503, error(e.getMessage()));
        if (t instanceof IllegalArgumentException || t instanceof JsonProcessingException
                || t instanceof DateTimeParseException) {
            return new Response(400, error(t.getMessage()));
        }
        if (t instanceof IllegalStateException) return new Response(409, error(t.getMessage()));
        if (t instanceof TimeoutException) return new Response(504, error("timed out"));
        log.error("Admin request failed", t);
        return new Response(500, error(String.valueOf(t.getMessage())));
    }

    private static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", message);
        return m;
    }

    private void send(HttpExchange exchange, Response r) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(r.body());
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(r.code(), bytes.length);
        try (OutputStream os = exchange.getResponseBody()) { os.write(bytes); }
    }

    private <T> T read(HttpExchange exchange, Class<T> type) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        if (body.length == 0) throw new IllegalArgumentException("Request body required");
        return mapper.readValue(body, type);
    }

    private static <T> T await(CompletableFuture<T> f) throws Exception {
        return f.get(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    private static Map<String, String> query(HttpExchange exchange) {
        Map<String, String> out = new LinkedHashMap<>();
        String q = exchange.getRequestURI().getRawQuery();
        if (q == null) return out;
        for (String part : q.split("&")) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2) out.put(URLDecoder.decode(kv[0], StandardCharsets.UTF_8), URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
        }
        return out;
    }

    private static HttpError methodNotAllowed() { return new HttpError(405, "method not allowed"); }

    private static HttpError notFound(String what) { return new HttpError(404, what + " not found"); }

    private class StatusHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) {
            if (!method.equals("GET")) throw methodNotAllowed();
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("running", scheduler.isRunning());
            s.put("accepting", engine.isAccepting());
            s.put("calendarLoaded", calendar.isLoaded());
            if (calendar.isLoaded()) s.put("calendarCoverage", calendar.coverage());
            s.put("units", registry.units().size());
            s.put("runningTasks", engine.runningCount());
            s.put("pendingTasks", engine.pendingCount());
            s.put("maxConcurrentTasks", engine.maxConcurrentTasks());
            s.put("nextFires", scheduler.nextFireTimes());
            List<SyncRun> recent = scheduler.runs();
            if (!recent.isEmpty()) s.put("latestRun", recent.get(0).view());
            return Response.ok(s);
        }
    }

    private class MetricsHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) {
            if (!method.equals("GET")) throw methodNotAllowed();
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, Counter> e : metrics.getCounters().entrySet()) {
                out.put(e.getKey(), e.getValue().getCount());
            }
            for (Map.Entry<String, Meter> e : metrics.getMeters().entrySet()) {
                Meter m = e.getValue();
                out.put(e.getKey(), Map.of("count", m.getCount(), "rate1m", m.getOneMinuteRate()));
            }
            for (Map.Entry<String, Timer> e : metrics.getTimers().entrySet()) {
                var snap = e.getValue().getSnapshot();
                out.put(e.getKey(), Map.of("count", e.getValue().getCount(),
                        "meanMs", snap.getMean() / 1_000_000.0,
                        "p95Ms", snap.get95thPercentile() / 1_000_000.0));
            }
            for (Map.Entry<String, Gauge> e : metrics.getGauges().entrySet()) {
                out.put(e.getKey(), e.getValue().getValue());
            }
            return Response.ok(out);
        }
    }

    private class ConfigHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) throws Exception {
            if (method.equals("GET")) return Response.ok(scheduler.settings());
            if (!method.equals("POST")) throw methodNotAllowed();
            // Overlay the given fields on the current settings.
            ObjectNode current = mapper.valueToTree(scheduler.settings());
            ObjectNode patch = read(exchange, ObjectNode.class);
            patch.fieldNames().forEachRemaining(f -> {
                if (!current.has(f)) throw new IllegalArgumentException("Unknown setting: " + f);
            });
            current.setAll(patch);
            ScheduleSettings next;
            try {
                next = mapper.treeToValue(current, ScheduleSettings.class);
            } catch (JsonProcessingException e) {
                Throwable cause = e.getCause();
                throw new IllegalArgumentException(cause != null ? cause.getMessage() : e.getOriginalMessage(), e);
            }
            return Response.ok(await(scheduler.updateSettings(next)));
        }
    }

    private class CalendarHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) throws Exception {
            if (path.isEmpty()) {
                if (!method.equals("GET")) throw methodNotAllowed();
                Map<String, Object> c = new LinkedHashMap<>();
                c.put("loaded", calendar.isLoaded());
                if (calendar.isLoaded()) {
                    c.put("coverage", calendar.coverage());
                    c.put("totalTradingDays", calendar.totalTradingDays());
                }
                return Response.ok(c);
            }
            if (path.size() == 1 && path.get(0).equals("refresh")) {
                if (!method.equals("POST")) throw methodNotAllowed();
                TradeCalendarService.Coverage coverage = await(scheduler.refreshCalendar());
                Map<String, Object> c = new LinkedHashMap<>();
                c.put("coverage", coverage);
                c.put("totalTradingDays", calendar.totalTradingDays());
                return Response.ok(c);
            }
            throw notFound("Endpoint");
        }
    }

    record EnabledRequest(Boolean enabled) {}

    record FullScanRequest(Boolean fullScan) {}

    private class UnitsHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) throws Exception {
            if (path.isEmpty()) {
                if (!method.equals("GET")) throw methodNotAllowed();
                List<UnitDescriptor> units = new ArrayList<>(registry.units());
                units.sort(Comparator.comparing(UnitDescriptor::role));
                List<Map<String, Object>> out = new ArrayList<>();
                for (UnitDescriptor u : units) out.add(describe(u));
                return Response.ok(out);
            }
            UnitDescriptor unit = registry.unit(path.get(0));
            if (path.size() == 1) {
                if (!method.equals("GET")) throw methodNotAllowed();
                Map<String, Object> d = describe(unit);
                DependencyCheckResult check = registry.checkDependencies(unit.name());
                d.put("dependenciesSatisfied", check.satisfied());
                d.put("missingDependencies", check.missing());
                return Response.ok(d);
            }
            if (path.size() == 2 && method.equals("POST")) {
                switch (path.get(1)) {
                    case "enabled" -> {
                        EnabledRequest req = read(exchange, EnabledRequest.class);
                        if (req.enabled() == null) throw new IllegalArgumentException("'enabled' is required");
                        registry.setEnabled(unit.name(), req.enabled());
                        return Response.ok(describe(unit));
                    }
                    case "full-scan" -> {
                        FullScanRequest req = read(exchange, FullScanRequest.class);
                        if (req.fullScan() == null) throw new IllegalArgumentException("'fullScan' is required");
                        registry.setFullScan(unit.name(), req.fullScan());
                        return Response.ok(describe(unit));
                    }
                    default -> throw notFound("Endpoint");
                }
            }
            throw notFound("Endpoint");
        }

        private Map<String, Object> describe(UnitDescriptor u) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", u.name());
            m.put("role", u.role());
            m.put("cadence", u.cadence());
            m.put("dependencies", u.dependencies());
            m.put("optionalDependencies", u.optionalDependencies());
            m.put("reverseDependencies", registry.reverseDependenciesOf(u.name()));
            m.put("rateLimitPerMinute", u.rateLimitPerMinute());
            m.put("enabled", u.isEnabled());
            m.put("fullScan", u.isFullScan());
            return m;
        }
    }

    private class MissingHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) throws Exception {
            if (path.isEmpty()) {
                if (!method.equals("GET")) throw methodNotAllowed();
                return Response.ok(scheduler.latestReport().orElseThrow(() -> notFound("Missing-data report")));
            }
            if (path.size() == 1 && path.get(0).equals("check")) {
                if (!method.equals("POST")) throw methodNotAllowed();
                return Response.ok(await(scheduler.triggerMissingCheck()));
            }
            throw notFound("Endpoint");
        }
    }

    private class SyncHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) throws Exception {
            if (!path.isEmpty()) throw notFound("Endpoint");
            if (!method.equals("POST")) throw methodNotAllowed();
            return Response.accepted(await(scheduler.triggerSync()).view());
        }
    }

    private class RunsHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) throws Exception {
            if (path.isEmpty()) {
                if (!method.equals("GET")) throw methodNotAllowed();
                int limit = Integer.parseInt(query(exchange).getOrDefault("limit", "20"));
                List<SyncRunView> out = new ArrayList<>();
                for (SyncRun r : scheduler.runs()) {
                    if (out.size() >= limit) break;
                    out.add(r.view());
                }
                return Response.ok(out);
            }
            String id = path.get(0);
            if (path.size() == 1) {
                if (!method.equals("GET")) throw methodNotAllowed();
                return Response.ok(scheduler.run(id).orElseThrow(() -> notFound("Run " + id)).view());
            }
            if (path.size() == 2 && method.equals("POST")) {
                if (scheduler.run(id).isEmpty()) throw notFound("Run " + id);
                switch (path.get(1)) {
                    case "stop" -> { return Response.ok(await(scheduler.stopRun(id)).view()); }
                    case "retry" -> { return Response.accepted(await(scheduler.retryFailed(id)).view()); }
                    default -> throw notFound("Endpoint");
                }
            }
            throw notFound("Endpoint");
        }
    }

    record SubmitRequest(String unitName, TaskKind kind, List<String> partitions, boolean autoResolveDependencies) {}

    private class TasksHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) throws Exception {
            if (path.isEmpty()) {
                if (method.equals("GET")) return Response.ok(engine.liveTasks());
                if (!method.equals("POST")) throw methodNotAllowed();
                SubmitRequest req = read(exchange, SubmitRequest.class);
                if (req.unitName() == null || req.kind() == null) throw new IllegalArgumentException("'unitName' and 'kind' are required");
                List<Partition> parts = new ArrayList<>();
                if (req.partitions() != null) for (String p : req.partitions()) parts.add(Partition.parse(p));
                String id = engine.submit(new TaskRequest(req.unitName(), req.kind(), parts, req.autoResolveDependencies()));
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("taskId", id);
                body.put("task", engine.status(id).orElse(null));
                return Response.accepted(body);
            }
            String id = path.get(0);
            if (path.size() == 1) {
                if (!method.equals("GET")) throw methodNotAllowed();
                return Response.ok(engine.status(id).orElseThrow(() -> notFound("Task " + id)));
            }
            if (path.size() == 2 && path.get(1).equals("cancel")) {
                if (!method.equals("POST")) throw methodNotAllowed();
                if (engine.status(id).isEmpty()) throw notFound("Task " + id);
                if (!engine.cancel(id)) throw new IllegalStateException("Task " + id + " already ended");
                return Response.ok(engine.status(id).orElse(null));
            }
            throw notFound("Endpoint");
        }
    }

    private class HistoryHandler extends JsonHandler {
        @Override
        Response route(String method, List<String> path, HttpExchange exchange) {
            if (!path.isEmpty()) {
                if (!method.equals("GET") || path.size() != 1) throw notFound("Endpoint");
                return Response.ok(history.find(path.get(0)).orElseThrow(() -> notFound("Task " + path.get(0))));
            }
            if (!method.equals("GET")) throw methodNotAllowed();
            Map<String, String> q = query(exchange);
            HistoryQuery.Builder b = HistoryQuery.builder();
            if (q.containsKey("unit")) b.unitName(q.get("unit"));
            if (q.containsKey("kind")) b.kind(TaskKind.valueOf(q.get("kind").toUpperCase()));
            if (q.containsKey("status")) b.status(TaskStatus.valueOf(q.get("status").toUpperCase()));
            if (q.containsKey("after")) b.completedAfter(Instant.parse(q.get("after")));
            if (q.containsKey("before")) b.completedBefore(Instant.parse(q.get("before")));
            if (q.containsKey("sort")) {
                boolean asc = "asc".equalsIgnoreCase(q.getOrDefault("order", "desc"));
                b.sortBy(HistoryQuery.SortField.valueOf(q.get("sort").toUpperCase()), asc);
            }
            b.page(Integer.parseInt(q.getOrDefault("page", "1")),
                    Integer.parseInt(q.getOrDefault("size", String.valueOf(HistoryQuery.DEFAULT_PAGE_SIZE))));
            HistoryQuery query = b.build();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("total", history.count(query));
            body.put("page", query.page());
            body.put("pageSize", query.pageSize());
            body.put("items", history.query(query));
            return Response.ok(body);
        }
    }
}
