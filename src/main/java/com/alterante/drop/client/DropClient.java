package com.alterante.drop.client;

import com.alterante.drop.api.HeartbeatRequest;
import com.alterante.drop.api.PeerRequest;
import com.alterante.drop.error.ConnectionException;
import com.alterante.drop.error.DropException;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.error.UnauthorizedException;
import com.alterante.drop.error.UpstreamException;
import com.alterante.drop.error.ValidationException;
import com.alterante.drop.presence.PresenceView;
import com.alterante.drop.queue.TransferRecord;
import com.alterante.drop.router.Outcome;
import com.alterante.drop.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed client for the drop HTTP API. HTTP error statuses come back as the
 * matching {@link DropException}; an unreachable server is a
 * {@link ConnectionException}.
 */
public class DropClient {

    private static final Logger log = LoggerFactory.getLogger(DropClient.class);

    private final HttpClient http;
    private final URI base;
    private final Duration timeout;

    public DropClient(HttpClient http, URI base, Duration timeout) {
        this.http = http;
        String s = base.toString();
        this.base = URI.create(s.endsWith("/") ? s.substring(0, s.length() - 1) : s);
        this.timeout = timeout;
    }

    public static DropClient create(String baseUrl, Duration timeout) {
        HttpClient http = HttpClient.newBuilder().connectTimeout(timeout).build();
        return new DropClient(http, URI.create(baseUrl), timeout);
    }

    /**
     * Upload a file for an unreachable receiver.
     */
    public Outcome.Queued shareOffline(String senderPeerId, String senderDisplayName, String receiverPeerId,
                                       Path file, String fileName) throws DropException {
        URI uri = resolve("/api/share/offline?" + query(Map.of(
                "senderPeerId", senderPeerId,
                "senderDisplayName", senderDisplayName,
                "receiverPeerId", receiverPeerId,
                "fileName", fileName)));
        HttpRequest.BodyPublisher body;
        try {
            body = HttpRequest.BodyPublishers.ofFile(file);
        } catch (FileNotFoundException e) {
            throw new ValidationException("File not found: " + file);
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/octet-stream")
                .POST(body)
                .build();
        JsonNode node = send(request);
        return new Outcome.Queued(text(node, "blobReference"), text(node, "blobUrl"),
                text(node, "receiverDisplayName"), text(node, "transferId"));
    }

    public List<TransferRecord> pending(String peerId) throws DropException {
        JsonNode node = send(get("/api/messages/pending/" + encode(peerId)));
        List<TransferRecord> records = new ArrayList<>();
        for (JsonNode record : node.path("records")) {
            records.add(convert(record, TransferRecord.class));
        }
        return records;
    }

    public TransferRecord acknowledge(String transferId, String peerId) throws DropException {
        JsonNode node = send(post("/api/messages/delivered/" + encode(transferId), new PeerRequest(peerId)));
        return convert(node.path("transfer"), TransferRecord.class);
    }

    public void heartbeat(String peerId, String displayName, String contact, String directEndpoint)
            throws DropException {
        send(post("/api/user/heartbeat", new HeartbeatRequest(peerId, displayName, contact, directEndpoint)));
    }

    public void markOffline(String peerId) throws DropException {
        send(post("/api/user/mark-offline", new PeerRequest(peerId)));
    }

    public PresenceView status(String peerId) throws DropException {
        return convert(send(get("/api/user/status/" + encode(peerId))), PresenceView.class);
    }

    public JsonNode health() throws DropException {
        return send(get("/health"));
    }

    /**
     * Fetch a staged blob into {@code target}. The file only appears once the
     * download completed.
     */
    public Path download(String blobUrl, Path target) throws DropException {
        Path part = target.resolveSibling(target.getFileName() + ".part");
        HttpRequest request = HttpRequest.newBuilder(URI.create(blobUrl)).timeout(timeout).GET().build();
        try {
            HttpResponse<Path> response = http.send(request, HttpResponse.BodyHandlers.ofFile(part));
            if (response.statusCode() / 100 != 2) {
                throw new UpstreamException("Download of " + blobUrl + " returned HTTP " + response.statusCode());
            }
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Downloaded {} to {}", blobUrl, target);
            return target;
        } catch (HttpTimeoutException e) {
            throw new ConnectionException("Download of " + blobUrl + " timed out", e);
        } catch (IOException e) {
            throw new ConnectionException("Download of " + blobUrl + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Download interrupted", e);
        } finally {
            deletePart(part);
        }
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder(resolve(path)).timeout(timeout).GET().build();
    }

    private HttpRequest post(String path, Object body) {
        return HttpRequest.newBuilder(resolve(path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(Json.toBytes(body)))
                .build();
    }

    private JsonNode send(HttpRequest request) throws DropException {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ConnectionException(request.method() + " " + request.uri().getPath() + " timed out", e);
        } catch (IOException e) {
            throw new ConnectionException("Cannot reach " + base + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Request interrupted", e);
        }

        JsonNode node = parse(response.body());
        int status = response.statusCode();
        if (status / 100 == 2) {
            return node;
        }
        String message = node.path("error").asText("HTTP " + status);
        switch (status) {
            case 400 -> throw new ValidationException(message);
            case 403 -> throw new UnauthorizedException(message);
            case 404 -> throw new NotFoundException(message);
            default -> throw new UpstreamException("Server returned HTTP " + status + ": " + message);
        }
    }

    private static JsonNode parse(String body) throws UpstreamException {
        if (body == null || body.isBlank()) {
            return Json.mapper().createObjectNode();
        }
        try {
            return Json.mapper().readTree(body);
        } catch (IOException e) {
            throw new UpstreamException("Unreadable server response: " + e.getMessage(), e);
        }
    }

    private static <T> T convert(JsonNode node, Class<T> type) throws UpstreamException {
        try {
            return Json.mapper().treeToValue(node, type);
        } catch (IOException e) {
            throw new UpstreamException("Unexpected server response: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private URI resolve(String path) {
        return URI.create(base + path);
    }

    private static String query(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(encode(e.getKey())).append('=').append(encode(e.getValue() == null ? "" : e.getValue()));
        }
        return sb.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void deletePart(Path part) {
        try {
            Files.deleteIfExists(part);
        } catch (IOException e) {
            log.debug("Could not remove {}: {}", part, e.getMessage());
        }
    }
}
