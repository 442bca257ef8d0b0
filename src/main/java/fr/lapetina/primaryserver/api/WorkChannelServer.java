package fr.lapetina.primaryserver.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.primaryserver.disruptor.WorkRequestPipeline;
import fr.lapetina.primaryserver.disruptor.exception.BackpressureException;
import fr.lapetina.primaryserver.domain.model.ErrorReply;
import fr.lapetina.primaryserver.domain.model.ErrorType;
import fr.lapetina.primaryserver.infrastructure.codec.WireCodec;
import fr.lapetina.primaryserver.infrastructure.control.ControlChannel;
import fr.lapetina.primaryserver.server.ServeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Work and control channels, on the JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /primary-get - config-request or work-request
 * - POST /control - Deliver a control command to an idle service
 * - GET /control/notifications - Recent control notifications
 */
public final class WorkChannelServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkChannelServer.class);

    private static final Duration CONTROL_HANDOFF_TIMEOUT = Duration.ofSeconds(1);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final WorkRequestPipeline pipeline;
    private final ControlChannel controlChannel;
    private final WireCodec codec;
    private final long replyTimeoutMs;

    public WorkChannelServer(
            String host,
            int port,
            int backlog,
            long replyTimeoutMs,
            WorkRequestPipeline pipeline,
            ControlChannel controlChannel,
            WireCodec codec
    ) throws IOException {
        this.pipeline = pipeline;
        this.controlChannel = controlChannel;
        this.codec = codec;
        this.replyTimeoutMs = replyTimeoutMs;

        this.server = com.sun.net.httpserver.HttpServer.create(new InetSocketAddress(host, port), backlog);

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "work-channel-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/primary-get", new PrimaryGetHandler());
        server.createContext("/control", new ControlHandler());
        server.createContext("/control/notifications", new NotificationsHandler());

        log.info("Work channel configured on port {}", getPort());
    }

    public void start() {
        server.start();
        log.info("Work channel started on port {}", getPort());
    }

    /**
     * Bound port; differs from the configured one when port 0 was requested.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("Work channel stopped");
    }

    // ==================== WORK CHANNEL ====================

    private class PrimaryGetHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                String payload = readBody(exchange);

                CompletableFuture<ServeResult> future;
                try {
                    future = pipeline.submit(requestId, payload);
                } catch (BackpressureException e) {
                    log.warn("Backpressure: {}", e.getMessage());
                    sendErrorReply(exchange, new ErrorReply(ErrorType.UNAVAILABLE, e.getMessage()));
                    return;
                }

                ServeResult result;
                try {
                    result = future.get(replyTimeoutMs, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    // Cancelled requests are skipped by the serving thread
                    future.cancel(false);
                    log.warn("No reply within {} ms, request abandoned", replyTimeoutMs);
                    sendErrorReply(exchange, new ErrorReply(ErrorType.TIMEOUT, "No reply within " + replyTimeoutMs + " ms"));
                    return;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.cancel(false);
                    sendErrorReply(exchange, new ErrorReply(ErrorType.UNAVAILABLE, "Interrupted"));
                    return;
                } catch (ExecutionException e) {
                    log.error("Error serving work channel request", e.getCause());
                    sendError(exchange, 500, "Internal server error: " + e.getCause().getMessage());
                    return;
                }

                if (result.isError()) {
                    sendErrorReply(exchange, result.error());
                } else if (result.isConfig()) {
                    sendBytes(exchange, 200, codec.encode(result.config()));
                } else {
                    sendBytes(exchange, 200, codec.encode(result.chunk()));
                }

            } catch (IOException e) {
                log.warn("Failed to write work channel reply: {}", e.getMessage());
                throw e;
            } finally {
                MDC.remove("requestId");
            }
        }
    }

    // ==================== CONTROL CHANNEL ====================

    private class ControlHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            String command = readBody(exchange).trim();
            boolean accepted;
            try {
                accepted = controlChannel.deliver(command, CONTROL_HANDOFF_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                accepted = false;
            }
            if (accepted) {
                log.info("Control command accepted: {}", command);
                sendJson(exchange, 202, Map.of("accepted", true, "command", command));
            } else {
                sendError(exchange, 409, "No listener waiting for control input");
            }
        }
    }

    private class NotificationsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            sendJson(exchange, 200, controlChannel.recentNotifications());
        }
    }

    // ==================== HELPER METHODS ====================

    private static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private void sendErrorReply(HttpExchange exchange, ErrorReply error) throws IOException {
        sendBytes(exchange, error.type().getHttpStatus(), codec.encode(error));
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        sendBytes(exchange, statusCode, codec.encode(body));
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, Map.of("error", message));
    }

    private static void sendBytes(HttpExchange exchange, int statusCode, byte[] bytes) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
