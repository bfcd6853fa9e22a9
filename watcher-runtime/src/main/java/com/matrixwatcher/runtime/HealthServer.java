package com.matrixwatcher.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Probe and status endpoints for a running {@link MatrixWatcher}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - Returns {@code 200 OK} with body
 * {@code {"status":"UP"}} while the process is alive</li>
 * <li>{@code GET /readiness} - {@code 200} once the watcher is ready,
 * {@code 503} with {@code {"status":"NOT_READY"}} before</li>
 * <li>{@code GET /status} - JSON snapshot of pipeline, scheduler, bus and
 * calibration statistics</li>
 * </ul>
 *
 * <p>
 * Backed by the JDK {@link HttpServer}; requests are served one at a time on a
 * daemon thread named {@code watcher-health}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final String JSON = "application/json";
    private static final byte[] UP = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NOT_READY = "{\"status\":\"NOT_READY\"}".getBytes(StandardCharsets.UTF_8);

    private final BooleanSupplier readiness;
    private final Supplier<Map<String, Object>> status;
    private final ObjectMapper mapper;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer httpServer;
    private ExecutorService requestThread;

    /**
     * @param readiness answers {@code /readiness}
     * @param status    produces the {@code /status} body
     */
    public HealthServer(BooleanSupplier readiness, Supplier<Map<String, Object>> status) {
        this.readiness = Objects.requireNonNull(readiness, "readiness must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Bind and start serving. A bind failure is logged and leaves the server
     * stopped; the watcher keeps running without probes.
     *
     * @param port TCP port in [1, 65535]
     * @throws IllegalArgumentException if the port is out of range
     */
    public void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("Health port must be in [1, 65535], got: " + port);
        }
        if (running.get()) {
            LOG.warn("Health endpoints already served, ignoring start on port {}", port);
            return;
        }
        HttpServer created;
        try {
            created = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            LOG.error("Cannot bind health endpoints to port {}: {}", port, e.getMessage(), e);
            return;
        }
        created.createContext("/health", exchange -> respond(exchange, 200, UP));
        created.createContext("/readiness", this::handleReadiness);
        created.createContext("/status", this::handleStatus);
        requestThread = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "watcher-health");
            thread.setDaemon(true);
            return thread;
        });
        created.setExecutor(requestThread);
        created.start();
        httpServer = created;
        running.set(true);
        LOG.info("Serving /health, /readiness and /status on port {}", port);
    }

    /**
     * Stop serving. Safe to call more than once.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        httpServer.stop(0);
        requestThread.shutdownNow();
        LOG.info("Health endpoints stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (readiness.getAsBoolean()) {
            respond(exchange, 200, UP);
        } else {
            respond(exchange, 503, NOT_READY);
        }
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        byte[] body;
        try {
            body = mapper.writeValueAsBytes(status.get());
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.warn("Failed to build status response: {}", e.getMessage(), e);
            respond(exchange, 500, "{\"status\":\"ERROR\"}".getBytes(StandardCharsets.UTF_8));
            return;
        }
        respond(exchange, 200, body);
    }

    private static void respond(HttpExchange exchange, int code, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", JSON);
        exchange.sendResponseHeaders(code, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
}
