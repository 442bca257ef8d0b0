package fr.lapetina.primaryserver.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.primaryserver.domain.model.LifecycleState;
import fr.lapetina.primaryserver.infrastructure.codec.WireCodec;
import fr.lapetina.primaryserver.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Status channel, answered on its own {@code status-responder} thread.
 * Reads the server state and never changes it.
 *
 * Endpoints:
 * - GET /primary-status - Lifecycle state wire code as a decimal integer
 * - GET /health - JSON snapshot of state, cursor and run configuration
 * - GET /metrics - Prometheus metrics endpoint
 */
public final class StatusResponder implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StatusResponder.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final JobServer jobServer;
    private final MetricsRegistry metricsRegistry;
    private final WireCodec codec;

    public StatusResponder(
            String host,
            int port,
            int backlog,
            JobServer jobServer,
            MetricsRegistry metricsRegistry,
            WireCodec codec
    ) throws IOException {
        this.jobServer = jobServer;
        this.metricsRegistry = metricsRegistry;
        this.codec = codec;

        this.server = HttpServer.create(new InetSocketAddress(host, port), backlog);
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "status-responder");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/primary-status", new StatusHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
    }

    public void start() {
        server.start();
        log.info("Status responder started on port {}", getPort());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
        log.info("Status responder stopped");
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendText(exchange, 405, "Method Not Allowed");
                return;
            }
            sendText(exchange, 200, Integer.toString(jobServer.getState().getCode()));
        }
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendText(exchange, 405, "Method Not Allowed");
                return;
            }

            LifecycleState state = jobServer.getState();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", state.name());
            health.put("stateCode", state.getCode());
            health.put("timestamp", System.currentTimeMillis());
            health.put("eventCounter", jobServer.getEventCounter());
            health.put("partCounter", jobServer.getPartCounter());
            health.put("seed", jobServer.getInitialSeed());
            health.put("service", jobServer.isAsService());
            health.put("failed", jobServer.hasFailed());
            health.put("config", jobServer.getRunConfig());

            byte[] bytes = codec.encode(health);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendText(exchange, 405, "Method Not Allowed");
                return;
            }
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metricsRegistry.scrape().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    private static void sendText(HttpExchange exchange, int statusCode, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
