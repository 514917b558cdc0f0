package io.mnemo.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mnemo.core.error.CollaboratorException;
import io.mnemo.core.error.CollaboratorTimeoutException;
import io.mnemo.core.error.ConcurrencyConflictException;
import io.mnemo.core.error.ValidationException;
import io.mnemo.core.evolution.MaintenanceReport;
import io.mnemo.core.pipeline.QueryRequest;
import io.mnemo.core.pipeline.QueryResult;
import io.mnemo.core.profile.SymptomProgression;
import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.record.RecordFilter;
import io.mnemo.core.service.IngestRequest;
import io.mnemo.core.service.MemoryService;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front for {@link MemoryService}.
 *
 * <pre>
 * GET    /healthz
 * POST   /owners/{id}/records     ingest
 * GET    /owners/{id}/records     timeline (?from, ?to, ?category, ?tag)
 * POST   /owners/{id}/query       query
 * POST   /owners/{id}/maintain    decay pass (?as_of or body)
 * GET    /owners/{id}/profile     profile and health
 * GET    /owners/{id}/patterns    recurring categories (?window_days)
 * GET    /owners/{id}/progression symptom progression (?symptom, ?window_days, ?as_of)
 * DELETE /owners/{id}             purge
 * GET    /dashboard/summary
 * GET    /audit/events            (?limit)
 * </pre>
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final String OWNERS_PREFIX = "/owners";

    private final MemoryService service;
    private final ResponseMapper responses;
    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, String host, MemoryService service) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.responses = new ResponseMapper();
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
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/dashboard/summary", blocking(this::handleDashboardSummary))
            .addExactPath("/audit/events", blocking(this::handleAuditEvents))
            .addPrefixPath(OWNERS_PREFIX, blocking(this::handleOwner));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok", "embedding_model", service.embeddingModel()));
    }

    private void handleOwner(HttpServerExchange exchange) throws IOException {
        String relative = exchange.getRelativePath();
        List<String> segments = new ArrayList<>();
        for (String segment : relative.split("/")) {
            if (!segment.isBlank()) {
                segments.add(segment);
            }
        }
        if (segments.isEmpty() || segments.size() > 2) {
            sendJson(exchange, 404, Map.of("error", "not_found"));
            return;
        }
        String ownerId = segments.get(0);
        String action = segments.size() == 2 ? segments.get(1) : "";

        switch (action) {
            case "" -> {
                if (!requireMethod(exchange, "DELETE")) {
                    return;
                }
                int deleted = service.purge(ownerId);
                sendJson(exchange, 200, Map.of("owner_id", ownerId, "deleted_count", deleted));
            }
            case "records" -> handleRecords(exchange, ownerId);
            case "query" -> {
                if (!requireMethod(exchange, "POST")) {
                    return;
                }
                JsonNode body = readJsonBody(exchange);
                QueryRequest request = new QueryRequest(
                    ownerId,
                    readString(body, "query", null),
                    readInt(body, "limit"),
                    readDouble(body, "similarity_floor"),
                    readDouble(body, "time_weight"),
                    parseInstant("as_of", readString(body, "as_of", null))
                );
                QueryResult result = service.query(request);
                sendJson(exchange, 200, responses.queryResult(result));
            }
            case "maintain" -> {
                if (!requireMethod(exchange, "POST")) {
                    return;
                }
                JsonNode body = readJsonBody(exchange);
                String asOf = firstNonBlank(queryParam(exchange, "as_of"), readString(body, "as_of", null));
                MaintenanceReport report = service.maintain(ownerId, parseInstant("as_of", asOf));
                sendJson(exchange, 200, responses.maintenance(report));
            }
            case "profile" -> {
                if (!requireMethod(exchange, "GET")) {
                    return;
                }
                Instant asOf = parseInstant("as_of", queryParam(exchange, "as_of"));
                sendJson(exchange, 200, responses.profile(service.profile(ownerId, asOf)));
            }
            case "patterns" -> {
                if (!requireMethod(exchange, "GET")) {
                    return;
                }
                int window = parseQueryInt(exchange, "window_days", 30);
                Instant asOf = parseInstant("as_of", queryParam(exchange, "as_of"));
                sendJson(exchange, 200, Map.of(
                    "owner_id", ownerId,
                    "patterns", service.patterns(ownerId, window, asOf).stream().map(responses::pattern).toList()
                ));
            }
            case "progression" -> {
                if (!requireMethod(exchange, "GET")) {
                    return;
                }
                int window = parseQueryInt(exchange, "window_days", 365);
                Instant asOf = parseInstant("as_of", queryParam(exchange, "as_of"));
                SymptomProgression progression = service.progression(ownerId, queryParam(exchange, "symptom"), window, asOf);
                sendJson(exchange, 200, responses.progression(progression));
            }
            default -> sendJson(exchange, 404, Map.of("error", "not_found"));
        }
    }

    private void handleRecords(HttpServerExchange exchange, String ownerId) throws IOException {
        if (isMethod(exchange, "POST")) {
            JsonNode body = readJsonBody(exchange);
            MemoryRecord record = service.ingest(new IngestRequest(
                ownerId,
                readString(body, "text", null),
                readString(body, "category", null),
                readStringList(body, "tags"),
                parseInstant("created_at", readString(body, "created_at", null))
            ));
            sendJson(exchange, 201, responses.record(record));
            return;
        }
        if (isMethod(exchange, "GET")) {
            RecordFilter filter = new RecordFilter(
                emptyToNull(queryParam(exchange, "category")),
                emptyToNull(queryParam(exchange, "tag")),
                parseInstant("from", queryParam(exchange, "from")),
                parseInstant("to", queryParam(exchange, "to"))
            );
            sendJson(exchange, 200, Map.of(
                "owner_id", ownerId,
                "records", service.timeline(ownerId, filter).stream().map(responses::timelineEntry).toList()
            ));
            return;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
    }

    private void handleDashboardSummary(HttpServerExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        if (service.observability() == null) {
            sendJson(exchange, 503, Map.of("error", "observability_not_configured"));
            return;
        }
        sendJson(exchange, 200, responses.dashboard(service.observability().summary()));
    }

    private void handleAuditEvents(HttpServerExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        if (service.observability() == null) {
            sendJson(exchange, 503, Map.of("error", "observability_not_configured"));
            return;
        }
        int limit = Math.max(1, Math.min(1000, parseQueryInt(exchange, "limit", 100)));
        sendJson(exchange, 200, Map.of("events", service.observability().recent(limit)));
    }

    private HttpHandler blocking(ExchangeHandler handler) {
        return exchange -> {
            if (exchange.isInIoThread()) {
                exchange.dispatch(() -> runHandler(handler, exchange));
                return;
            }
            runHandler(handler, exchange);
        };
    }

    private void runHandler(ExchangeHandler handler, HttpServerExchange exchange) {
        try {
            handler.handle(exchange);
        } catch (ValidationException e) {
            sendQuietly(exchange, 400, Map.of("error", "invalid_request", "field", e.field(), "message", e.getMessage()));
        } catch (ConcurrencyConflictException e) {
            sendQuietly(exchange, 409, Map.of("error", "conflict", "message", e.getMessage()));
        } catch (CollaboratorTimeoutException e) {
            sendQuietly(exchange, 504, Map.of("error", "collaborator_timeout", "collaborator", e.collaborator()));
        } catch (CollaboratorException e) {
            sendQuietly(exchange, 502, Map.of("error", "collaborator_failed", "collaborator", e.collaborator()));
        } catch (CancellationException e) {
            sendQuietly(exchange, 503, Map.of("error", "cancelled"));
        } catch (JsonProcessingException e) {
            sendQuietly(exchange, 400, Map.of("error", "invalid_json"));
        } catch (Exception e) {
            LOG.error("Gateway request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendQuietly(exchange, 500, Map.of("error", "internal_error"));
        }
    }

    private boolean requireMethod(HttpServerExchange exchange, String method) throws IOException {
        if (isMethod(exchange, method)) {
            return true;
        }
        sendJson(exchange, 405, Map.of("error", "method_not_allowed"));
        return false;
    }

    private boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendQuietly(HttpServerExchange exchange, int status, Map<String, ?> payload) {
        try {
            sendJson(exchange, status, payload);
        } catch (IOException e) {
            LOG.debug("Could not send {} response: {}", status, e.getMessage());
        }
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.peekFirst();
        return value == null ? "" : value.trim();
    }

    private int parseQueryInt(HttpServerExchange exchange, String key, int fallback) {
        String raw = queryParam(exchange, key);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(key, key + " must be an integer");
        }
    }

    private Instant parseInstant(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(field, field + " must be an ISO-8601 instant");
        }
    }

    private String readString(JsonNode body, String field, String fallback) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        return node.asText();
    }

    private Integer readInt(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ValidationException(field, field + " must be an integer");
        }
        return node.intValue();
    }

    private Double readDouble(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new ValidationException(field, field + " must be a number");
        }
        return node.doubleValue();
    }

    private List<String> readStringList(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText("")));
        } else {
            for (String value : node.asText("").split(",")) {
                values.add(value);
            }
        }
        return values.stream().map(String::trim).filter(value -> !value.isBlank()).toList();
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}
