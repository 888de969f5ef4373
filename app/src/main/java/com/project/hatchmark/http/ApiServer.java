package com.project.hatchmark.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.project.hatchmark.core.DuplicateException;
import com.project.hatchmark.core.FlagRequest;
import com.project.hatchmark.core.HatchmarkException;
import com.project.hatchmark.core.RegisterRequest;
import com.project.hatchmark.core.ResolveRequest;
import com.project.hatchmark.core.TransactionRequestService;
import com.project.hatchmark.core.ValidationException;
import com.project.hatchmark.core.VerificationService;
import com.project.hatchmark.store.StoreException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON endpoints over the JDK HTTP server.
 *
 * <pre>
 * POST /api/verify   {hash}                                               -> verification result
 * POST /api/register {hash, title, description, sender}                   -> unsigned transaction
 * POST /api/flag     {cert_id, flagged_hash, similarity | hammingDistance, stake, sender}
 * POST /api/resolve  {dispute_id, cert_id, resolution, sender}
 * GET  /api/*        request documentation
 * GET  /api/health
 * </pre>
 *
 * Failures are answered with {@code {"error": message, "code": name}}.
 */
public class ApiServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    static final int MAX_BODY_BYTES = 64 * 1024;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final VerificationService verification;
    private final TransactionRequestService requests;
    private final HttpServer server;
    private final ExecutorService executor;

    @FunctionalInterface
    private interface Route {
        Object handle(byte[] body);
    }

    public ApiServer(VerificationService verification, TransactionRequestService requests,
                     InetSocketAddress address) throws IOException {
        this.verification = Objects.requireNonNull(verification, "verification must not be null");
        this.requests = Objects.requireNonNull(requests, "requests must not be null");
        this.server = HttpServer.create(address, 0);
        AtomicInteger threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(4, runnable -> {
            Thread thread = new Thread(runnable, "api-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(executor);

        // catch-all for unknown routes
        server.createContext("/api/", exchange -> {
            if (handlePreflight(exchange)) {
                return;
            }
            sendError(exchange, 404, "NOT_FOUND", "No route for " + exchange.getRequestURI().getPath());
        });
        server.createContext("/api/health", exchange -> {
            if (handlePreflight(exchange)) {
                return;
            }
            sendJson(exchange, 200, Map.of("status", "ok"));
        });

        route("/api/verify", this::verify, documentation("/api/verify",
                "Find registered images similar to a fingerprint",
                Map.of("hash", "string (hex perceptual hash)"),
                Map.of("matches", "[{cert_id, creator, title, similarity, hammingDistance, created_at}]",
                        "isOriginal", "boolean",
                        "exactMatch", "match or null")));
        route("/api/register", this::register, documentation("/api/register",
                "Build an unsigned registration transaction",
                Map.of("hash", "string (hex perceptual hash)",
                        "title", "string (1-200 characters)",
                        "description", "string (optional)",
                        "sender", "string (0x address that will sign)"),
                transactionReturns()));
        route("/api/flag", this::flag, documentation("/api/flag",
                "Build an unsigned dispute transaction against a certificate",
                Map.of("cert_id", "string (certificate object id)",
                        "flagged_hash", "string (hex perceptual hash of the copy)",
                        "similarity", "number 0-100 (used when hammingDistance is absent)",
                        "hammingDistance", "number 0-255",
                        "stake", "number (base units, at least the minimum stake)",
                        "sender", "string (0x address that will sign)"),
                transactionReturns()));
        route("/api/resolve", this::resolve, documentation("/api/resolve",
                "Build an unsigned transaction resolving a dispute; certificate creator only",
                Map.of("dispute_id", "string (dispute object id)",
                        "cert_id", "string (certificate object id)",
                        "resolution", "VALID | INVALID",
                        "sender", "string (certificate creator)"),
                transactionReturns()));
    }

    public void start() {
        server.start();
        log.info("API listening on http://{}:{}/api", server.getAddress().getHostString(), port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("API stopped");
    }

    // ----- Routes -----

    private Object verify(byte[] body) {
        VerifyRequest request = read(body, VerifyRequest.class);
        if (request.hash() == null) {
            throw new ValidationException("hash is required");
        }
        return verification.verify(request.hash());
    }

    private Object register(byte[] body) {
        return requests.buildRegister(read(body, RegisterRequest.class));
    }

    private Object flag(byte[] body) {
        return requests.buildFlag(read(body, FlagRequest.class));
    }

    private Object resolve(byte[] body) {
        return requests.buildResolve(read(body, ResolveRequest.class));
    }

    private void route(String path, Route route, Map<String, Object> documentation) {
        server.createContext(path, exchange -> {
            if (handlePreflight(exchange)) {
                return;
            }
            if (!exchange.getRequestURI().getPath().equals(path)) {
                sendError(exchange, 404, "NOT_FOUND", "No route for " + exchange.getRequestURI().getPath());
                return;
            }
            String method = exchange.getRequestMethod();
            if ("GET".equalsIgnoreCase(method)) {
                sendJson(exchange, 200, documentation);
                return;
            }
            if (!"POST".equalsIgnoreCase(method)) {
                sendError(exchange, 405, "METHOD_NOT_ALLOWED", "POST only");
                return;
            }
            try {
                Object result = route.handle(readBody(exchange));
                sendJson(exchange, 200, result);
            } catch (HatchmarkException e) {
                log.debug("{} rejected: {}", path, e.getMessage());
                sendError(exchange, e.code().httpStatus(), e.code().name(), e.getMessage(), details(e));
            } catch (StoreException e) {
                log.warn("{} failed on the off-chain store: {}", path, e.getMessage());
                sendError(exchange, 503, "STORE_UNAVAILABLE", e.getMessage());
            } catch (RuntimeException e) {
                log.error("{} failed: {}", path, e.getMessage(), e);
                sendError(exchange, 500, "INTERNAL", "Internal error");
            }
        });
    }

    private static Map<String, Object> details(HatchmarkException e) {
        if (e instanceof DuplicateException && ((DuplicateException) e).bestMatch() != null) {
            DuplicateException duplicate = (DuplicateException) e;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("cert_id", duplicate.bestMatch().id());
            details.put("similarity", duplicate.bestMatch().similarity());
            details.put("hammingDistance", duplicate.bestMatch().distance());
            return details;
        }
        return null;
    }

    private static Map<String, Object> documentation(String endpoint, String description,
                                                     Map<String, Object> body, Map<String, Object> returns) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("endpoint", endpoint);
        doc.put("method", "POST");
        doc.put("description", description);
        doc.put("body", body);
        doc.put("returns", returns);
        return doc;
    }

    private static Map<String, Object> transactionReturns() {
        return Map.of(
                "target", "string (<package>::registry::<function>)",
                "arguments", "object (call arguments in order)",
                "sender", "string",
                "nonce", "string",
                "annotations", "object");
    }

    // ----- I/O -----

    private static <T> T read(byte[] body, Class<T> type) {
        if (body.length == 0) {
            throw new ValidationException("request body is required");
        }
        try {
            T value = MAPPER.readValue(body, type);
            if (value == null) {
                throw new ValidationException("request body must be a JSON object");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new ValidationException("malformed JSON body: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new ValidationException("unreadable request body: " + e.getMessage());
        }
    }

    private static byte[] readBody(HttpExchange exchange) {
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readNBytes(MAX_BODY_BYTES + 1);
        } catch (IOException e) {
            throw new ValidationException("unreadable request body: " + e.getMessage());
        }
        if (body.length > MAX_BODY_BYTES) {
            throw new ValidationException("request body exceeds " + MAX_BODY_BYTES + " bytes");
        }
        return body;
    }

    private static boolean handlePreflight(HttpExchange exchange) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            commonHeaders(exchange);
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return true;
        }
        return false;
    }

    private static void commonHeaders(HttpExchange exchange) {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
    }

    private static void sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        sendError(exchange, status, code, message, null);
    }

    private static void sendError(HttpExchange exchange, int status, String code, String message,
                                  Map<String, Object> details) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        if (details != null) {
            body.put("details", details);
        }
        sendJson(exchange, status, body);
    }

    private static void sendJson(HttpExchange exchange, int status, Object value) throws IOException {
        byte[] bytes;
        try {
            bytes = MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode response: {}", e.getMessage(), e);
            status = 500;
            bytes = "{\"error\":\"Internal error\",\"code\":\"INTERNAL\"}".getBytes(StandardCharsets.UTF_8);
        }
        commonHeaders(exchange);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
