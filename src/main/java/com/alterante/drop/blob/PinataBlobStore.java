package com.alterante.drop.blob;

import com.alterante.drop.error.UpstreamException;
import com.alterante.drop.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Pins blobs to IPFS through the Pinata pinning API. The reference is the
 * returned CID; the URL points at the configured gateway.
 */
public class PinataBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(PinataBlobStore.class);

    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.pinata.cloud/pinning/pinFileToIPFS");
    public static final String DEFAULT_GATEWAY = "https://gateway.pinata.cloud/ipfs/";

    private final HttpClient http;
    private final URI endpoint;
    private final String jwt;
    private final String gateway;
    private final Duration timeout;

    public PinataBlobStore(HttpClient http, URI endpoint, String jwt, String gateway, Duration timeout) {
        if (jwt == null || jwt.isBlank()) {
            throw new IllegalArgumentException("Pinata JWT is required");
        }
        this.http = http;
        this.endpoint = endpoint;
        this.jwt = jwt;
        this.gateway = gateway.endsWith("/") ? gateway : gateway + "/";
        this.timeout = timeout;
    }

    @Override
    public BlobReference upload(String fileName, Path content, Map<String, String> metadata) throws UpstreamException {
        String boundary = "----altdrop" + UUID.randomUUID().toString().replace("-", "");
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(endpoint)
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + jwt)
                    .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .POST(multipartBody(boundary, fileName, content, metadata))
                    .build();
        } catch (FileNotFoundException e) {
            throw new UpstreamException("Upload source missing: " + content, e);
        }

        HttpResponse<String> response;
        try {
            log.info("Pinning {} to IPFS", fileName);
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new UpstreamException("Pinata upload timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new UpstreamException("Pinata upload failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException("Pinata upload interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new UpstreamException("Pinata returned HTTP " + response.statusCode() + ": " + response.body());
        }
        String cid = parseCid(response.body());
        log.info("Pinned {} as {}", fileName, cid);
        return new BlobReference(cid, gateway + cid);
    }

    static String parseCid(String body) throws UpstreamException {
        try {
            JsonNode node = Json.mapper().readTree(body);
            JsonNode hash = node == null ? null : node.get("IpfsHash");
            if (hash == null || hash.asText().isBlank()) {
                throw new UpstreamException("Pinata response has no IpfsHash: " + body);
            }
            return hash.asText();
        } catch (IOException e) {
            throw new UpstreamException("Unreadable Pinata response: " + e.getMessage(), e);
        }
    }

    private static HttpRequest.BodyPublisher multipartBody(String boundary, String fileName, Path content,
                                                           Map<String, String> metadata) throws FileNotFoundException {
        String safeName = fileName.replace("\"", "_");
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"" + safeName + "\"\r\n"
                + "Content-Type: application/octet-stream\r\n\r\n";
        String pinataMetadata = Json.toJson(Map.of("name", fileName, "keyvalues", metadata));
        String tail = "\r\n--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"pinataMetadata\"\r\n"
                + "Content-Type: application/json\r\n\r\n"
                + pinataMetadata + "\r\n"
                + "--" + boundary + "--\r\n";
        return HttpRequest.BodyPublishers.concat(
                HttpRequest.BodyPublishers.ofString(head, StandardCharsets.UTF_8),
                HttpRequest.BodyPublishers.ofFile(content),
                HttpRequest.BodyPublishers.ofString(tail, StandardCharsets.UTF_8));
    }
}
