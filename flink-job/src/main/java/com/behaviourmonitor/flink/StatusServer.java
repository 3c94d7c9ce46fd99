package com.behaviourmonitor.flink;

import com.behaviourmonitor.core.engine.RuleEngine;
import com.behaviourmonitor.core.model.MonitoringRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server exposing health and status endpoints for the job.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200 OK} with {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness}: same, Kubernetes readiness probe target</li>
 * <li>{@code GET /api/v1/status}: status, rule count, enabled rule names
 * and registered subject count</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class StatusServer {

    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    private final RuleEngine engine;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;

    public StatusServer(RuleEngine engine) {
        this.engine = Objects.requireNonNull(engine, "RuleEngine must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; must be in range [1, 65535]
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Status port must be in range [1, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", StatusServer::handleHealthCheck);
            server.createContext("/readiness", StatusServer::handleHealthCheck);
            server.createContext("/api/v1/status", this::handleStatus);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "status-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Status server started on port {}", port);
        } catch (IOException e) {
            LOG.error("Failed to start status server on port {}: {}", port, e.getMessage(), e);
        }
    }

    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Status server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Body of the status endpoint.
     */
    Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("rules", engine.getRules().size());
        body.put("ruleNames", engine.getRules().stream().map(MonitoringRule::getName).toList());
        body.put("subjects", engine.getRegistry().size());
        return body;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleStatus(HttpExchange exchange) throws IOException {
        byte[] response;
        try {
            response = mapper.writeValueAsBytes(status());
        } catch (JsonProcessingException e) {
            LOG.error("Failed to render status: {}", e.getMessage(), e);
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
            return;
        }
        write(exchange, response);
    }

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        write(exchange, HEALTH_RESPONSE);
    }

    private static void write(HttpExchange exchange, byte[] response) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }
}
