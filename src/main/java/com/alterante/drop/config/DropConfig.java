package com.alterante.drop.config;

import com.alterante.drop.identity.PeerIdentity;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Server configuration. Every setting has a default; a {@code .properties} file
 * overrides them and CLI options override the file.
 *
 * <pre>
 * data.dir=data
 * http.port=8080
 * http.publicUrl=http://localhost:8080
 * presence.port=9700
 * presence.psk=secret
 * presence.stalenessWindow=PT2M
 * presence.sessionTimeout=PT90S
 * reconcile.interval=PT30S
 * reconcile.notifyAckTimeout=PT3S
 * blob.backend=local            # or pinata
 * blob.uploadTimeout=PT60S
 * blob.maxUploadBytes=104857600
 * pinata.jwt=...
 * pinata.endpoint=https://api.pinata.cloud/pinning/pinFileToIPFS
 * pinata.gateway=https://gateway.pinata.cloud/ipfs/
 * peer.alice=Alice,alice@example.com
 * </pre>
 */
public record DropConfig(
        Path dataDir,
        int httpPort,
        String publicUrl,
        int presencePort,
        String psk,
        Duration stalenessWindow,
        Duration sessionTimeout,
        Duration reconcileInterval,
        Duration notifyAckTimeout,
        String blobBackend,
        Duration uploadTimeout,
        long maxUploadBytes,
        String pinataJwt,
        URI pinataEndpoint,
        String pinataGateway,
        List<PeerIdentity> peers
) {

    public static final String DEFAULT_DATA_DIR = "data";
    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final int DEFAULT_PRESENCE_PORT = 9700;
    public static final Duration DEFAULT_STALENESS_WINDOW = Duration.ofMinutes(2);
    public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofSeconds(90);
    public static final Duration DEFAULT_RECONCILE_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_NOTIFY_ACK_TIMEOUT = Duration.ofSeconds(3);
    public static final Duration DEFAULT_UPLOAD_TIMEOUT = Duration.ofSeconds(60);
    public static final long DEFAULT_MAX_UPLOAD_BYTES = 100L * 1024L * 1024L;
    public static final String BACKEND_LOCAL = "local";
    public static final String BACKEND_PINATA = "pinata";

    public DropConfig {
        peers = List.copyOf(peers);
    }

    public static DropConfig defaults() {
        return fromProperties(new Properties());
    }

    /**
     * Load a properties file on top of the defaults.
     */
    public static DropConfig load(Path file) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        return fromProperties(props);
    }

    public static DropConfig fromProperties(Properties props) {
        int httpPort = intValue(props, "http.port", DEFAULT_HTTP_PORT);
        String psk = props.getProperty("presence.psk");
        return new DropConfig(
                Path.of(props.getProperty("data.dir", DEFAULT_DATA_DIR)),
                httpPort,
                props.getProperty("http.publicUrl", "http://localhost:" + httpPort),
                intValue(props, "presence.port", DEFAULT_PRESENCE_PORT),
                psk == null || psk.isBlank() ? null : psk,
                durationValue(props, "presence.stalenessWindow", DEFAULT_STALENESS_WINDOW),
                durationValue(props, "presence.sessionTimeout", DEFAULT_SESSION_TIMEOUT),
                durationValue(props, "reconcile.interval", DEFAULT_RECONCILE_INTERVAL),
                durationValue(props, "reconcile.notifyAckTimeout", DEFAULT_NOTIFY_ACK_TIMEOUT),
                props.getProperty("blob.backend", BACKEND_LOCAL).trim().toLowerCase(),
                durationValue(props, "blob.uploadTimeout", DEFAULT_UPLOAD_TIMEOUT),
                longValue(props, "blob.maxUploadBytes", DEFAULT_MAX_UPLOAD_BYTES),
                props.getProperty("pinata.jwt"),
                URI.create(props.getProperty("pinata.endpoint",
                        "https://api.pinata.cloud/pinning/pinFileToIPFS")),
                props.getProperty("pinata.gateway", "https://gateway.pinata.cloud/ipfs/"),
                peers(props));
    }

    public DropConfig withDataDir(Path dir) {
        return new DropConfig(dir, httpPort, publicUrl, presencePort, psk, stalenessWindow, sessionTimeout,
                reconcileInterval, notifyAckTimeout, blobBackend, uploadTimeout, maxUploadBytes,
                pinataJwt, pinataEndpoint, pinataGateway, peers);
    }

    /** Also moves the public URL when it still points at the default localhost address. */
    public DropConfig withHttpPort(int port) {
        String url = publicUrl.equals("http://localhost:" + httpPort) ? "http://localhost:" + port : publicUrl;
        return new DropConfig(dataDir, port, url, presencePort, psk, stalenessWindow, sessionTimeout,
                reconcileInterval, notifyAckTimeout, blobBackend, uploadTimeout, maxUploadBytes,
                pinataJwt, pinataEndpoint, pinataGateway, peers);
    }

    public DropConfig withPublicUrl(String url) {
        return new DropConfig(dataDir, httpPort, url, presencePort, psk, stalenessWindow, sessionTimeout,
                reconcileInterval, notifyAckTimeout, blobBackend, uploadTimeout, maxUploadBytes,
                pinataJwt, pinataEndpoint, pinataGateway, peers);
    }

    public DropConfig withPresencePort(int port) {
        return new DropConfig(dataDir, httpPort, publicUrl, port, psk, stalenessWindow, sessionTimeout,
                reconcileInterval, notifyAckTimeout, blobBackend, uploadTimeout, maxUploadBytes,
                pinataJwt, pinataEndpoint, pinataGateway, peers);
    }

    public DropConfig withPsk(String key) {
        return new DropConfig(dataDir, httpPort, publicUrl, presencePort, key, stalenessWindow, sessionTimeout,
                reconcileInterval, notifyAckTimeout, blobBackend, uploadTimeout, maxUploadBytes,
                pinataJwt, pinataEndpoint, pinataGateway, peers);
    }

    public DropConfig withReconcileInterval(Duration interval) {
        return new DropConfig(dataDir, httpPort, publicUrl, presencePort, psk, stalenessWindow, sessionTimeout,
                interval, notifyAckTimeout, blobBackend, uploadTimeout, maxUploadBytes,
                pinataJwt, pinataEndpoint, pinataGateway, peers);
    }

    public Path presenceFile() {
        return dataDir.resolve("presence.json");
    }

    public Path transfersFile() {
        return dataDir.resolve("transfers.json");
    }

    public Path identitiesFile() {
        return dataDir.resolve("identities.json");
    }

    public Path blobDir() {
        return dataDir.resolve("blobs");
    }

    public Path spoolDir() {
        return dataDir.resolve("spool");
    }

    private static List<PeerIdentity> peers(Properties props) {
        List<PeerIdentity> peers = new ArrayList<>();
        for (String key : props.stringPropertyNames()) {
            if (!key.startsWith("peer.")) {
                continue;
            }
            String peerId = key.substring("peer.".length()).trim();
            String value = props.getProperty(key);
            int comma = value.indexOf(',');
            if (peerId.isEmpty() || comma < 0) {
                throw new IllegalArgumentException("Expected " + key + "=<display name>,<contact>");
            }
            peers.add(new PeerIdentity(peerId, value.substring(0, comma).trim(), value.substring(comma + 1).trim()));
        }
        peers.sort((a, b) -> a.peerId().compareTo(b.peerId()));
        return peers;
    }

    private static int intValue(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static long longValue(Properties props, String key, long fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, e);
        }
    }

    private static Duration durationValue(Properties props, String key, Duration fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Duration.parse(raw.trim());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 duration for " + key + ": " + raw, e);
        }
    }
}
