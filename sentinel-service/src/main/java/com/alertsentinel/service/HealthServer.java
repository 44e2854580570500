package com.alertsentinel.service;

import com.alertsentinel.core.HealthReport;
import com.alertsentinel.core.SentinelCore;
import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.IncidentSeverity;
import com.alertsentinel.core.model.IncidentStatus;
import com.alertsentinel.core.snapshot.SnapshotCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server exposing health probes and read-only views of the
 * core.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200} with {@code "status":"UP"} and the
 * health figures, or {@code 503} with {@code "status":"DOWN"}</li>
 * <li>{@code GET /readiness} – {@code 200} once the core workers run,
 * {@code 503} before</li>
 * <li>{@code GET /alerts} – active alerts</li>
 * <li>{@code GET /stats} – alert statistics</li>
 * <li>{@code GET /incidents} – incidents, filtered by optional
 * {@code status} and {@code severity}; with {@code subject} the per-subject
 * summary instead</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external server dependency
 * is required.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final SentinelCore core;
    private final ObjectMapper mapper = SnapshotCodec.newObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    public HealthServer(SentinelCore core) {
        this.core = Objects.requireNonNull(core, "core must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", get(this::handleHealth));
            server.createContext("/readiness", get(this::handleReadiness));
            server.createContext("/alerts", get(exchange -> writeJson(exchange, 200, core.getActiveAlerts())));
            server.createContext("/stats", get(exchange -> writeJson(exchange, 200, core.getAlertStats())));
            server.createContext("/incidents", get(this::handleIncidents));

            executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} if the server was never started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        HealthReport report = core.health();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", report.isHealthy() ? "UP" : "DOWN");
        body.put("callbackErrors", report.getCallbackErrors());
        body.put("activeCriticalAlerts", report.getActiveCriticalAlerts());
        body.put("openIncidents", report.getOpenIncidents());
        body.put("paused", report.isPaused());
        body.put("workersRunning", report.isWorkersRunning());
        writeJson(exchange, report.isHealthy() ? 200 : 503, body);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        boolean ready = core.health().isWorkersRunning();
        writeJson(exchange, ready ? 200 : 503, Map.of("status", ready ? "UP" : "DOWN"));
    }

    private void handleIncidents(HttpExchange exchange) throws IOException {
        Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
        try {
            String subject = query.get("subject");
            if (subject != null) {
                writeJson(exchange, 200, core.getIncidentSummary(subject));
                return;
            }
            IncidentStatus status = query.containsKey("status") ? IncidentStatus.parse(query.get("status")) : null;
            IncidentSeverity severity = query.containsKey("severity")
                    ? IncidentSeverity.parse(query.get("severity"))
                    : null;
            writeJson(exchange, 200, core.listIncidents(status, severity));
        } catch (ValidationException e) {
            writeJson(exchange, 400, Map.of("error", e.getMessage()));
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static HttpHandler get(HttpHandler delegate) {
        return exchange -> {
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", "GET");
                    exchange.sendResponseHeaders(405, -1);
                    return;
                }
                delegate.handle(exchange);
            } finally {
                exchange.close();
            }
        };
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }
}
