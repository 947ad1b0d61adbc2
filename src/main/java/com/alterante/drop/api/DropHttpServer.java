package com.alterante.drop.api;

import com.alterante.drop.blob.LocalBlobStore;
import com.alterante.drop.error.DropException;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.error.ValidationException;
import com.alterante.drop.identity.IdentityDirectory;
import com.alterante.drop.presence.PeerPresence;
import com.alterante.drop.presence.PresenceTracker;
import com.alterante.drop.queue.DeliveryQueue;
import com.alterante.drop.queue.TransferRecord;
import com.alterante.drop.router.OfflineStaging;
import com.alterante.drop.router.Outcome;
import com.alterante.drop.router.StagingRequest;
import com.alterante.drop.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * JSON API over the JDK HTTP server.
 *
 * <pre>
 * POST /api/share/offline?senderPeerId&amp;senderDisplayName&amp;receiverPeerId&amp;fileName   (body = file bytes)
 * GET  /api/messages/pending/{peerId}
 * POST /api/messages/delivered/{transferId}     {"peerId"}
 * POST /api/user/heartbeat                       {"peerId","displayName","contact","directEndpoint"?}
 * POST /api/user/mark-offline                    {"peerId"}
 * GET  /api/user/status/{peerId}
 * GET  /blobs/{hash}
 * GET  /health
 * </pre>
 *
 * Failures answer {@code {"success":false,"error":...}} with the status of the
 * {@link DropException}; anything unexpected is a logged 500.
 */
public class DropHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DropHttpServer.class);

    public static final String SHARE_OFFLINE_PATH = "/api/share/offline";
    public static final String PENDING_PATH = "/api/messages/pending/";
    public static final String DELIVERED_PATH = "/api/messages/delivered/";
    public static final String HEARTBEAT_PATH = "/api/user/heartbeat";
    public static final String MARK_OFFLINE_PATH = "/api/user/mark-offline";
    public static final String STATUS_PATH = "/api/user/status/";
    public static final String BLOBS_PATH = "/blobs/";
    public static final String HEALTH_PATH = "/health";

    private static final int COPY_BUFFER = 64 * 1024;

    /** Produces the JSON body for a request; the status is always 200. */
    @FunctionalInterface
    private interface Route {
        Object handle(HttpExchange exchange) throws DropException, IOException;
    }

    private final int port;
    private final long maxUploadBytes;
    private final Path spoolDir;
    private final PresenceTracker presence;
    private final DeliveryQueue queue;
    private final IdentityDirectory identities;
    private final OfflineStaging staging;
    private final LocalBlobStore localBlobs;

    private HttpServer server;
    private ExecutorService executor;

    /**
     * @param localBlobs store served under {@code /blobs}, or null when blobs live elsewhere
     */
    public DropHttpServer(int port, long maxUploadBytes, Path spoolDir, PresenceTracker presence,
                          DeliveryQueue queue, IdentityDirectory identities, OfflineStaging staging,
                          LocalBlobStore localBlobs) {
        this.port = port;
        this.maxUploadBytes = maxUploadBytes;
        this.spoolDir = spoolDir;
        this.presence = presence;
        this.queue = queue;
        this.identities = identities;
        this.staging = staging;
        this.localBlobs = localBlobs;
    }

    public synchronized int start() throws IOException {
        Files.createDirectories(spoolDir);
        server = HttpServer.create(new InetSocketAddress(port), 0);
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "drop-http");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext(SHARE_OFFLINE_PATH, json("POST", this::shareOffline));
        server.createContext(PENDING_PATH, json("GET", this::pending));
        server.createContext(DELIVERED_PATH, json("POST", this::delivered));
        server.createContext(HEARTBEAT_PATH, json("POST", this::heartbeat));
        server.createContext(MARK_OFFLINE_PATH, json("POST", this::markOffline));
        server.createContext(STATUS_PATH, json("GET", this::status));
        server.createContext(HEALTH_PATH, json("GET", this::health));
        server.createContext(BLOBS_PATH, this::blob);

        server.start();
        log.info("HTTP API listening on port {}", localPort());
        return localPort();
    }

    public int localPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop(1);
            executor.shutdownNow();
            server = null;
            log.info("HTTP API stopped");
        }
    }

    // --- routes ---

    private Object shareOffline(HttpExchange exchange) throws DropException, IOException {
        Map<String, String> query = queryParams(exchange);
        String sender = required(query, "senderPeerId");
        String senderName = required(query, "senderDisplayName");
        String receiver = required(query, "receiverPeerId");
        String fileName = required(query, "fileName");

        String declared = exchange.getRequestHeaders().getFirst("Content-Length");
        if (declared != null && parseLong(declared) > maxUploadBytes) {
            throw new ValidationException("File exceeds the " + maxUploadBytes + " byte limit");
        }

        Path spooled = Files.createTempFile(spoolDir, "upload-", ".part");
        try {
            long size = spool(exchange.getRequestBody(), spooled);
            if (size == 0) {
                throw new ValidationException("No file uploaded");
            }
            Outcome.Queued queued = staging.stage(new StagingRequest(sender, senderName, receiver, spooled, fileName));
            Map<String, Object> body = success();
            body.put("transferId", queued.transferId());
            body.put("blobReference", queued.blobReference());
            body.put("blobUrl", queued.blobUrl());
            body.put("receiverDisplayName", queued.receiverDisplayName());
            return body;
        } finally {
            Files.deleteIfExists(spooled);
        }
    }

    private Object pending(HttpExchange exchange) throws DropException {
        String peerId = pathTail(exchange, PENDING_PATH, "peerId");
        List<TransferRecord> records = queue.listPending(peerId);
        Map<String, Object> body = success();
        body.put("count", records.size());
        body.put("records", records);
        return body;
    }

    private Object delivered(HttpExchange exchange) throws DropException, IOException {
        String transferId = pathTail(exchange, DELIVERED_PATH, "transferId");
        PeerRequest request = readBody(exchange, PeerRequest.class);
        requireText(request.peerId(), "peerId");
        TransferRecord record = queue.markDelivered(transferId, request.peerId());
        Map<String, Object> body = success();
        body.put("transfer", record);
        return body;
    }

    private Object heartbeat(HttpExchange exchange) throws DropException, IOException {
        HeartbeatRequest request = readBody(exchange, HeartbeatRequest.class);
        PeerPresence updated = presence.markOnline(request.peerId(), request.displayName(),
                request.contact(), blankToNull(request.directEndpoint()));
        Map<String, Object> body = success();
        body.put("presence", updated);
        return body;
    }

    private Object markOffline(HttpExchange exchange) throws DropException, IOException {
        PeerRequest request = readBody(exchange, PeerRequest.class);
        requireText(request.peerId(), "peerId");
        presence.markOffline(request.peerId());
        return success();
    }

    private Object status(HttpExchange exchange) throws DropException {
        return presence.query(pathTail(exchange, STATUS_PATH, "peerId"));
    }

    private Object health(HttpExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("peers", identities.count());
        body.put("pending", queue.listAllPending().size());
        return body;
    }

    private void blob(HttpExchange exchange) throws IOException {
        try (exchange) {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendJson(exchange, 405, error("Method not allowed"));
                return;
            }
            String hash = exchange.getRequestURI().getPath().substring(BLOBS_PATH.length());
            Optional<Path> path = localBlobs == null ? Optional.empty() : localBlobs.locate(hash);
            if (path.isEmpty()) {
                sendJson(exchange, 404, error("Blob not found"));
                return;
            }
            exchange.getResponseHeaders().set("Content-Type", "application/octet-stream");
            exchange.sendResponseHeaders(200, Files.size(path.get()));
            try (OutputStream out = exchange.getResponseBody()) {
                Files.copy(path.get(), out);
            }
        }
    }

    // --- plumbing ---

    private HttpHandler json(String method, Route route) {
        return exchange -> {
            try (exchange) {
                if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendJson(exchange, 405, error("Method not allowed"));
                    return;
                }
                Object body;
                try {
                    body = route.handle(exchange);
                } catch (DropException e) {
                    log.debug("{} {} -> {}: {}", exchange.getRequestMethod(), exchange.getRequestURI().getPath(),
                            e.status(), e.getMessage());
                    sendJson(exchange, e.status(), error(e.getMessage()));
                    return;
                } catch (IOException | RuntimeException e) {
                    log.error("{} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
                    sendJson(exchange, 500, error("Internal server error"));
                    return;
                }
                sendJson(exchange, 200, body);
            }
        };
    }

    private long spool(InputStream in, Path target) throws IOException, ValidationException {
        long total = 0;
        byte[] buf = new byte[COPY_BUFFER];
        try (OutputStream out = Files.newOutputStream(target)) {
            int n;
            while ((n = in.read(buf)) > 0) {
                total += n;
                if (total > maxUploadBytes) {
                    throw new ValidationException("File exceeds the " + maxUploadBytes + " byte limit");
                }
                out.write(buf, 0, n);
            }
        }
        return total;
    }

    private static <T> T readBody(HttpExchange exchange, Class<T> type) throws ValidationException, IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        if (raw.length == 0) {
            throw new ValidationException("Missing request body");
        }
        T value;
        try {
            value = Json.mapper().readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed JSON: " + e.getOriginalMessage());
        }
        if (value == null) {
            throw new ValidationException("Request body must be a JSON object");
        }
        return value;
    }

    private static void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = Json.toBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static Map<String, Object> success() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        return body;
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return body;
    }

    private static String pathTail(HttpExchange exchange, String prefix, String name) throws NotFoundException {
        String path = exchange.getRequestURI().getPath();
        String tail = path.length() > prefix.length() ? path.substring(prefix.length()) : "";
        if (tail.isBlank() || tail.contains("/")) {
            throw new NotFoundException("Missing " + name + " in path");
        }
        return URLDecoder.decode(tail, StandardCharsets.UTF_8);
    }

    static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new HashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return params;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static String required(Map<String, String> params, String name) throws ValidationException {
        String value = params.get(name);
        requireText(value, name);
        return value;
    }

    private static void requireText(String value, String name) throws ValidationException {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Missing required field: " + name);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static long parseLong(String value) throws ValidationException {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid Content-Length");
        }
    }
}
