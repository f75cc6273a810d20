package io.minicron.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.minicron.core.cron.CronDescriber;
import io.minicron.core.error.MinicronException;
import io.minicron.core.error.NotFoundException;
import io.minicron.core.error.ValidationException;
import io.minicron.core.job.JobDraft;
import io.minicron.core.job.JobPatch;
import io.minicron.core.job.JobRecord;
import io.minicron.core.job.JobStore;
import io.minicron.core.log.ExecutionLogEntry;
import io.minicron.core.log.ExecutionLogStore;
import io.minicron.core.scheduler.JobScheduler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final String JOBS_PATH = "/api/cronjobs";
    private static final int DEFAULT_LOG_LIMIT = 50;
    private static final int MAX_LOG_LIMIT = 200;
    private static final int MAX_WAIT_SECONDS = 60;
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final List<String> allowedOrigins;
    private final JobStore store;
    private final ExecutionLogStore logStore;
    private final JobScheduler scheduler;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(
        String host,
        int port,
        List<String> allowedOrigins,
        JobStore store,
        ExecutionLogStore logStore,
        JobScheduler scheduler
    ) {
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.requestedPort = port;
        this.allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", dispatching(this::handleHealth))
            .addExactPath("/api/scheduler", dispatching(this::handleSchedulerStatus))
            .addExactPath(JOBS_PATH, dispatching(this::handleJobs))
            .addPrefixPath(JOBS_PATH, dispatching(this::handleJob));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on http://{}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
        }
        LOG.info("Gateway stopped");
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = header(exchange, "Origin");
        if (origin.isBlank() || !isAllowedCorsOrigin(origin)) {
            return;
        }
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,PUT,DELETE,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        exchange.getResponseHeaders().put(Headers.VARY, "Origin");
    }

    private boolean isAllowedCorsOrigin(String origin) {
        try {
            URI uri = URI.create(origin);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return false;
            }
            for (String allowed : allowedOrigins) {
                URI candidate = URI.create(allowed.trim());
                boolean sameHost = uri.getScheme().equalsIgnoreCase(candidate.getScheme())
                    && uri.getHost().equalsIgnoreCase(candidate.getHost());
                if (sameHost && (candidate.getPort() == -1 || candidate.getPort() == uri.getPort())) {
                    return true;
                }
            }
            return false;
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejecting malformed origin {}", origin);
            return false;
        }
    }

    private HttpHandler dispatching(Route route) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> respond(exchange, route));
                return;
            }
            respond(exchange, route);
        };
    }

    private void respond(HttpServerExchange exchange, Route route) {
        try {
            route.handle(exchange);
        } catch (MinicronException e) {
            sendError(exchange, e.kind().httpStatus(), e.kind().wireName(), e.getMessage());
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "validation_error", "malformed JSON body: " + e.getOriginalMessage());
        } catch (Exception e) {
            LOG.error("Unhandled error on {} {}", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendError(exchange, 500, "internal_error", e.getMessage() == null ? "internal error" : e.getMessage());
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendMethodNotAllowed(exchange);
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleSchedulerStatus(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendMethodNotAllowed(exchange);
            return;
        }
        sendJson(exchange, 200, scheduler.status());
    }

    private void handleJobs(HttpServerExchange exchange) throws IOException {
        if (isMethod(exchange, "GET")) {
            String enabledFilter = queryParam(exchange, "enabled");
            List<Map<String, Object>> jobs = store.list().stream()
                .filter(job -> enabledFilter.isBlank() || job.enabled() == Boolean.parseBoolean(enabledFilter))
                .map(this::toJobResponse)
                .toList();
            sendJson(exchange, 200, jobs);
            return;
        }
        if (isMethod(exchange, "POST")) {
            JsonNode body = readJsonObject(exchange);
            JobDraft draft = new JobDraft(
                readText(body, "id"),
                readText(body, "name"),
                readExpression(body),
                readText(body, "command"),
                readText(body, "description"),
                readBoolean(body, "enabled"),
                readInt(body, "timeout_seconds")
            );
            JobRecord created = store.create(draft);
            exchange.getResponseHeaders().put(Headers.LOCATION, JOBS_PATH + "/" + created.id());
            sendJson(exchange, 201, toJobResponse(created));
            return;
        }
        sendMethodNotAllowed(exchange);
    }

    private void handleJob(HttpServerExchange exchange) throws Exception {
        String relative = exchange.getRelativePath();
        String[] segments = relative.startsWith("/") ? relative.substring(1).split("/", -1) : relative.split("/", -1);
        if (segments.length == 0 || segments[0].isBlank() || segments.length > 2) {
            throw new NotFoundException("no route for " + exchange.getRequestPath());
        }
        String id = segments[0];
        if (segments.length == 1) {
            handleJobResource(exchange, id);
            return;
        }
        switch (segments[1]) {
            case "run" -> handleRun(exchange, id);
            case "logs" -> handleLogs(exchange, id);
            default -> throw new NotFoundException("no route for " + exchange.getRequestPath());
        }
    }

    private void handleJobResource(HttpServerExchange exchange, String id) throws IOException {
        if (isMethod(exchange, "GET")) {
            sendJson(exchange, 200, toJobResponse(store.get(id)));
            return;
        }
        if (isMethod(exchange, "PUT")) {
            JsonNode body = readJsonObject(exchange);
            String bodyId = readText(body, "id");
            if (bodyId != null && !bodyId.equals(id)) {
                throw new ValidationException("id cannot be changed");
            }
            JobPatch patch = new JobPatch(
                readText(body, "name"),
                readExpression(body),
                readText(body, "command"),
                readText(body, "description"),
                readBoolean(body, "enabled"),
                readInt(body, "timeout_seconds")
            );
            sendJson(exchange, 200, toJobResponse(store.update(id, patch)));
            return;
        }
        if (isMethod(exchange, "DELETE")) {
            boolean purgeLogs = Boolean.parseBoolean(queryParam(exchange, "purge_logs"));
            if (purgeLogs && store.find(id).isEmpty() && logStore.count(id) > 0) {
                // Leftover history of a job deleted earlier without purging.
                LOG.info("Purged {} log entries of deleted cron job {}", logStore.purge(id), id);
            } else {
                store.delete(id);
                if (purgeLogs) {
                    logStore.purge(id);
                }
            }
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        sendMethodNotAllowed(exchange);
    }

    private void handleRun(HttpServerExchange exchange, String id) throws Exception {
        if (!isMethod(exchange, "POST")) {
            sendMethodNotAllowed(exchange);
            return;
        }
        int waitSeconds = parseQueryInt(exchange, "wait_seconds", 0, 0, MAX_WAIT_SECONDS);
        CompletableFuture<ExecutionLogEntry> execution = scheduler.runNow(id);
        if (waitSeconds > 0) {
            try {
                ExecutionLogEntry entry = execution.get(waitSeconds, TimeUnit.SECONDS);
                sendJson(exchange, 200, entry);
                return;
            } catch (TimeoutException e) {
                LOG.debug("Manual run of {} still in progress after {}s", id, waitSeconds);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof MinicronException minicronException) {
                    throw minicronException;
                }
                throw e;
            }
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", id);
        payload.put("status", "accepted");
        sendJson(exchange, 202, payload);
    }

    private void handleLogs(HttpServerExchange exchange, String id) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendMethodNotAllowed(exchange);
            return;
        }
        int total = logStore.count(id);
        if (total == 0 && store.find(id).isEmpty()) {
            throw NotFoundException.job(id);
        }
        int offset = parseQueryInt(exchange, "offset", 0, 0, Integer.MAX_VALUE);
        int limit = parseQueryInt(exchange, "limit", DEFAULT_LOG_LIMIT, 1, MAX_LOG_LIMIT);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", id);
        payload.put("total", total);
        payload.put("offset", offset);
        payload.put("limit", limit);
        payload.put("entries", logStore.list(id, offset, limit));
        sendJson(exchange, 200, payload);
    }

    private Map<String, Object> toJobResponse(JobRecord job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", job.id());
        payload.put("name", job.name());
        payload.put("cron_expression", job.cronExpression());
        payload.put("schedule_description", CronDescriber.describe(job.cronExpression()));
        payload.put("command", job.command());
        payload.put("description", job.description());
        payload.put("enabled", job.enabled());
        payload.put("timeout_seconds", job.timeoutSeconds());
        payload.put("created_at", job.createdAt());
        payload.put("updated_at", job.updatedAt());
        payload.put("last_run_at", job.lastRunAt());
        payload.put("last_status", job.lastStatus());
        payload.put("next_run_at", job.nextRunAt());
        payload.put("state", scheduler.stateOf(job));
        payload.put("running", scheduler.isRunning(job.id()));
        payload.put("consecutive_failures", job.consecutiveFailures());
        return payload;
    }

    private void sendJson(HttpServerExchange exchange, int status, Object payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendError(HttpServerExchange exchange, int status, String kind, String message) {
        if (exchange.isResponseStarted()) {
            LOG.warn("Cannot report {} after the response started: {}", kind, message);
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error_kind", kind);
        payload.put("message", message);
        try {
            sendJson(exchange, status, payload);
        } catch (IOException e) {
            LOG.warn("Failed to send error response: {}", e.getMessage());
        }
    }

    private void sendMethodNotAllowed(HttpServerExchange exchange) {
        sendError(exchange, 405, "method_not_allowed", exchange.getRequestMethod() + " is not supported on " + exchange.getRequestPath());
    }

    private JsonNode readJsonObject(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            throw new ValidationException("request body is required");
        }
        JsonNode body = mapper.readTree(bytes);
        if (body == null || !body.isObject()) {
            throw new ValidationException("request body must be a JSON object");
        }
        return body;
    }

    private String readExpression(JsonNode body) {
        String expression = readText(body, "cron_expression");
        return expression != null ? expression : readText(body, "expression");
    }

    private String readText(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ValidationException(field + " must be a string");
        }
        return node.asText();
    }

    private Boolean readBoolean(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isBoolean()) {
            throw new ValidationException(field + " must be a boolean");
        }
        return node.booleanValue();
    }

    private Integer readInt(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ValidationException(field + " must be an integer");
        }
        return node.intValue();
    }

    private int parseQueryInt(HttpServerExchange exchange, String key, int fallback, int min, int max) {
        String raw = queryParam(exchange, key);
        if (raw.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return Math.max(min, Math.min(max, parsed));
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " must be an integer");
        }
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        String value = values == null || values.isEmpty() ? null : values.getFirst();
        return value == null ? "" : value;
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}
