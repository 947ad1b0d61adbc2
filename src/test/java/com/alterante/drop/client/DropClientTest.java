package com.alterante.drop.client;

import com.alterante.drop.MutableClock;
import com.alterante.drop.api.DropHttpServer;
import com.alterante.drop.blob.LocalBlobStore;
import com.alterante.drop.error.ConnectionException;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.error.UnauthorizedException;
import com.alterante.drop.error.ValidationException;
import com.alterante.drop.identity.PeerIdentity;
import com.alterante.drop.identity.StoreIdentityDirectory;
import com.alterante.drop.presence.PresenceTracker;
import com.alterante.drop.presence.PresenceView;
import com.alterante.drop.queue.DeliveryQueue;
import com.alterante.drop.queue.TransferRecord;
import com.alterante.drop.queue.TransferStatus;
import com.alterante.drop.router.BlobStaging;
import com.alterante.drop.router.Outcome;
import com.alterante.drop.router.StagingRequest;
import com.alterante.drop.store.InMemoryRecordStore;
import com.alterante.drop.transport.Signaling;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the typed client against a real API server on loopback.
 */
class DropClientTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private PresenceTracker presence;
    private DropHttpServer server;
    private DropClient client;

    @BeforeEach
    void setUp() throws Exception {
        int port = freePort();
        String base = "http://127.0.0.1:" + port;

        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        StoreIdentityDirectory identities = new StoreIdentityDirectory(new InMemoryRecordStore<>());
        identities.register(new PeerIdentity("p1", "Alice", "alice@example.com"));
        identities.register(new PeerIdentity("p2", "Bob", "bob@example.com"));
        presence = new PresenceTracker(new InMemoryRecordStore<>(), identities, clock, Duration.ofMinutes(2));
        DeliveryQueue queue = new DeliveryQueue(new InMemoryRecordStore<>(), identities, clock);
        LocalBlobStore blobs = new LocalBlobStore(tempDir.resolve("blobs"), base);

        server = new DropHttpServer(port, 1024 * 1024, tempDir.resolve("spool"), presence, queue, identities,
                new BlobStaging(blobs, queue, identities, clock), blobs);
        server.start();
        client = DropClient.create(base + "/", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void shareDownloadAcknowledge() throws Exception {
        Path file = Files.writeString(tempDir.resolve("report.pdf"), "quarterly numbers");

        Outcome.Queued queued = client.shareOffline("p1", "Alice", "p2", file, "report.pdf");
        assertEquals("Bob", queued.receiverDisplayName());
        assertNotNull(queued.transferId());

        List<TransferRecord> pending = client.pending("p2");
        assertEquals(1, pending.size());
        TransferRecord record = pending.get(0);
        assertEquals(queued.transferId(), record.id());
        assertEquals(TransferStatus.READY, record.status());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), record.createdAt());

        Path target = tempDir.resolve("inbox").resolve("report.pdf");
        Files.createDirectories(target.getParent());
        client.download(record.blobUrl(), target);
        assertEquals("quarterly numbers", Files.readString(target));
        assertFalse(Files.exists(target.resolveSibling("report.pdf.part")));

        TransferRecord delivered = client.acknowledge(record.id(), "p2");
        assertEquals(TransferStatus.DELIVERED, delivered.status());
        TransferRecord again = client.acknowledge(record.id(), "p2");
        assertEquals(delivered.deliveredAt(), again.deliveredAt());
        assertTrue(client.pending("p2").isEmpty());
    }

    @Test
    void remoteStagingGoesThroughTheServer() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "abc");

        Outcome.Queued queued = new RemoteStaging(client)
                .stage(new StagingRequest("p1", "Alice", "p2", file, "renamed.txt"));

        assertEquals("renamed.txt", client.pending("p2").get(0).fileName());
        assertEquals(queued.transferId(), client.pending("p2").get(0).id());
    }

    @Test
    void statusCodesMapToErrors() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "abc");
        String transferId = client.shareOffline("p1", "Alice", "p2", file, "a.txt").transferId();

        assertThrows(NotFoundException.class, () -> client.shareOffline("p1", "Alice", "ghost", file, "a.txt"));
        assertThrows(UnauthorizedException.class, () -> client.acknowledge(transferId, "p1"));
        assertThrows(NotFoundException.class, () -> client.acknowledge("missing", "p2"));
        assertThrows(ValidationException.class, () -> client.heartbeat("p2", "", "bob@example.com", null));
        assertThrows(NotFoundException.class, () -> client.status("ghost"));
    }

    @Test
    void missingUploadSourceIsValidationError() {
        assertThrows(ValidationException.class,
                () -> client.shareOffline("p1", "Alice", "p2", tempDir.resolve("nope.txt"), "nope.txt"));
    }

    @Test
    void heartbeatAndStatus() throws Exception {
        client.heartbeat("p2", "Bob", "bob@example.com", "127.0.0.1:9701");
        PresenceView view = client.status("p2");
        assertTrue(view.reachable());
        assertEquals("127.0.0.1:9701", view.directEndpoint());

        clock.advance(Duration.ofMinutes(3));
        assertFalse(client.status("p2").reachable());

        client.heartbeat("p2", "Bob", "bob@example.com", null);
        client.markOffline("p2");
        assertFalse(client.status("p2").reachable());
    }

    @Test
    void health() throws Exception {
        assertEquals("ok", client.health().get("status").asText());
    }

    @Test
    void unreachableServerIsConnectionError() throws Exception {
        DropClient dead = DropClient.create("http://127.0.0.1:" + freePort(), Duration.ofSeconds(2));
        assertThrows(ConnectionException.class, () -> dead.pending("p2"));
    }

    @Test
    void signalingReflectsPresence() throws Exception {
        RemoteSignaling signaling = new RemoteSignaling(client);

        assertEquals(Signaling.State.UNKNOWN, signaling.locate("ghost").state());
        assertEquals(Signaling.State.ABSENT, signaling.locate("p2").state());

        client.heartbeat("p2", "Bob", "bob@example.com", "127.0.0.1:9701");
        Signaling.Lookup lookup = signaling.locate("p2");
        assertEquals(Signaling.State.PRESENT, lookup.state());
        assertEquals(9701, lookup.endpoint().getPort());

        client.heartbeat("p1", "Alice", "alice@example.com", null);
        assertEquals(Signaling.State.ABSENT, signaling.locate("p1").state(), "online without an endpoint");
    }

    @Test
    void signalingOutageIsIOException() throws Exception {
        DropClient dead = DropClient.create("http://127.0.0.1:" + freePort(), Duration.ofSeconds(2));
        assertThrows(IOException.class, () -> new RemoteSignaling(dead).locate("p2"));
    }

    private static int freePort() throws IOException {
        try (ServerSocket free = new ServerSocket(0)) {
            return free.getLocalPort();
        }
    }
}
