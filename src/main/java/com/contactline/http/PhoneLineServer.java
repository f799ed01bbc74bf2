package com.contactline.http;

import com.contactline.error.PhoneLineException;
import com.contactline.line.PhoneLineService;
import com.contactline.model.PhoneUpdateRequest;
import com.contactline.namespace.RequestContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front end for the phone line.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET <path>}: public read: {@code {phone, message, changeCount}}.</li>
 *   <li>{@code POST <path>}: administrator update, or counter reset when the
 *       body has {@code "reset": true}.</li>
 *   <li>{@code OPTIONS <path>}: CORS preflight, empty 200.</li>
 *   <li>{@code GET /health}: 200 while serving, 503 during shutdown.</li>
 *   <li>{@code GET /health/live}: liveness probe (always 200 if the JVM is alive).</li>
 *   <li>{@code GET /health/ready}: readiness probe.</li>
 * </ul>
 *
 * <p>Failures are returned as {@code {"error": "..."}} with the status carried
 * by the {@link PhoneLineException}: 401 bad password, 400 bad input, 500 store failure.
 */
public class PhoneLineServer {

    private static final Logger LOG = LoggerFactory.getLogger(PhoneLineServer.class);

    private static final String JSON = "application/json";

    private final HttpServer       server;
    private final ExecutorService  executor;
    private final PhoneLineService service;
    private final String           path;
    private final ObjectMapper     mapper = new ObjectMapper();
    private final AtomicBoolean    ready  = new AtomicBoolean(false);

    public PhoneLineServer(final int port, final String path, final PhoneLineService service) throws IOException {
        this.service = service;
        this.path    = path;

        final AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(4, r -> {
            final Thread t = new Thread(r, "phone-line-http-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(executor);

        server.createContext(path,            this::handlePhone);
        server.createContext("/health",       this::handleHealth);
        server.createContext("/health/live",  this::handleLive);
        server.createContext("/health/ready", this::handleReady);
    }

    public void start() {
        server.start();
        LOG.info("Phone line server started on port {} (path {})", getPort(), path);
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int getPort() {
        return server.getAddress().getPort();
    }

    public void markReady() {
        ready.set(true);
        LOG.info("Phone line marked as ready");
    }

    public void markNotReady() {
        ready.set(false);
    }

    public void stop() {
        markNotReady();
        server.stop(1);
        executor.shutdown();
        LOG.info("Phone line server stopped");
    }

    // ── Phone ─────────────────────────────────────────────────────────────────

    private void handlePhone(final HttpExchange exchange) throws IOException {
        try {
            addCorsHeaders(exchange);

            if (!path.equals(exchange.getRequestURI().getPath())) {
                respondError(exchange, 404, "Not found");
                return;
            }

            final RequestContext context = RequestContext.ofHost(exchange.getRequestHeaders().getFirst("Host"));
            switch (exchange.getRequestMethod().toUpperCase()) {
                case "OPTIONS" -> respondEmpty(exchange, 200);
                case "GET"     -> respondJson(exchange, 200, service.read(context));
                case "POST"    -> {
                    final PhoneUpdateRequest request = PhoneUpdateRequest.fromJson(readBody(exchange));
                    respondJson(exchange, 200, service.apply(context, request));
                }
                default        -> respondError(exchange, 405, "Method not allowed");
            }
        } catch (PhoneLineException e) {
            LOG.debug("Request failed with {}: {}", e.httpStatus(), e.getMessage());
            respondError(exchange, e.httpStatus(), e.getMessage());
        } catch (Exception e) {
            LOG.error("Unexpected error handling {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            respondError(exchange, 500, "Error processing the phone number request");
        } finally {
            exchange.close();
        }
    }

    private static void addCorsHeaders(final HttpExchange exchange) {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type, Authorization");
    }

    private static String readBody(final HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // ── Health ────────────────────────────────────────────────────────────────

    private void handleHealth(final HttpExchange exchange) throws IOException {
        respond(exchange, ready.get() ? 200 : 503,
                ready.get() ? "{\"status\":\"UP\"}" : "{\"status\":\"DOWN\"}");
    }

    private void handleLive(final HttpExchange exchange) throws IOException {
        respond(exchange, 200, "{\"status\":\"ALIVE\"}");
    }

    private void handleReady(final HttpExchange exchange) throws IOException {
        respond(exchange, ready.get() ? 200 : 503,
                ready.get() ? "{\"status\":\"READY\"}" : "{\"status\":\"NOT_READY\"}");
    }

    // ── Responses ─────────────────────────────────────────────────────────────

    private void respondJson(final HttpExchange exchange, final int statusCode, final Object body) throws IOException {
        respond(exchange, statusCode, mapper.writeValueAsString(body));
    }

    private void respondError(final HttpExchange exchange, final int statusCode, final String message) throws IOException {
        respondJson(exchange, statusCode, Map.of("error", message));
    }

    private static void respondEmpty(final HttpExchange exchange, final int statusCode) throws IOException {
        exchange.sendResponseHeaders(statusCode, -1);
    }

    private static void respond(final HttpExchange exchange,
                                final int statusCode,
                                final String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", JSON);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
