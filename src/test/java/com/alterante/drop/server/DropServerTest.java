package com.alterante.drop.server;

import com.alterante.drop.client.DropClient;
import com.alterante.drop.client.RemoteSignaling;
import com.alterante.drop.client.RemoteStaging;
import com.alterante.drop.config.DropConfig;
import com.alterante.drop.error.NotFoundException;
import com.alterante.drop.identity.PeerIdentity;
import com.alterante.drop.net.PresenceClient;
import com.alterante.drop.protocol.PresencePayloads;
import com.alterante.drop.queue.TransferRecord;
import com.alterante.drop.router.Outcome;
import com.alterante.drop.router.TransferRouter;
import com.alterante.drop.transport.DirectReceiver;
import com.alterante.drop.transport.TcpLiveTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Whole-system run on loopback: a sender falls back to the queue while the
 * receiver is away, the receiver is notified when it comes online, and the
 * next send goes over the live channel.
 */
class DropServerTest {

    private static final String PSK = "drop-test-key";
    private static final Duration TIMEOUT = Duration.ofSeconds(3);

    @TempDir
    Path tempDir;

    private DropConfig config;
    private DropServer server;
    private DropClient client;

    @BeforeEach
    void setUp() throws Exception {
        int httpPort;
        try (ServerSocket free = new ServerSocket(0)) {
            httpPort = free.getLocalPort();
        }
        int presencePort;
        try (DatagramSocket free = new DatagramSocket(0)) {
            presencePort = free.getLocalPort();
        }

        Properties props = new Properties();
        props.setProperty("peer.alice", "Alice,alice@example.com");
        props.setProperty("peer.bob", "Bob,bob@example.com");
        config = DropConfig.fromProperties(props)
                .withDataDir(tempDir.resolve("server"))
                .withHttpPort(httpPort)
                .withPublicUrl("http://127.0.0.1:" + httpPort)
                .withPresencePort(presencePort)
                .withPsk(PSK)
                .withReconcileInterval(Duration.ofMillis(200));

        server = new DropServer(config, Clock.systemUTC());
        server.start();
        client = DropClient.create("http://127.0.0.1:" + server.httpPort(), TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void queuedWhileAwayThenLiveOnceOnline() throws Exception {
        Path file = Files.writeString(tempDir.resolve("plan.txt"), "the plan");

        try (TcpLiveTransport transport = new TcpLiveTransport("alice", new RemoteSignaling(client));
             TransferRouter router = new TransferRouter("alice", "Alice", transport, new RemoteStaging(client),
                     TIMEOUT, TIMEOUT)) {

            Outcome first = router.send("bob", file);
            Outcome.Queued queued = assertInstanceOf(Outcome.Queued.class, first);
            assertEquals("Bob", queued.receiverDisplayName());
            assertEquals(1, server.queue().listPending("bob").size());

            List<DirectReceiver.ReceivedFile> received = new CopyOnWriteArrayList<>();
            CountDownLatch notified = new CountDownLatch(1);
            List<String> notifiedIds = new CopyOnWriteArrayList<>();

            try (DirectReceiver receiver = new DirectReceiver("bob", 0, tempDir.resolve("bob"), 1024 * 1024,
                    received::add)) {
                int directPort = receiver.start();
                PresenceClient presence = new PresenceClient(
                        new InetSocketAddress("127.0.0.1", server.presencePort()), PSK,
                        new PresencePayloads.Online("bob", "Bob", "bob@example.com", directPort), 500);
                presence.setNotifyListener(n -> {
                    notifiedIds.add(n.transferId());
                    notified.countDown();
                });
                try {
                    presence.connect();
                    assertTrue(notified.await(5, TimeUnit.SECONDS), "pending transfer should be announced");
                    assertEquals(queued.transferId(), notifiedIds.get(0));

                    Outcome second = router.send("bob", file);
                    assertEquals(new Outcome.DeliveredLive("bob", "plan.txt", 8), second);
                    assertEquals(1, received.size());
                    assertEquals("the plan", Files.readString(received.get(0).path()));
                } finally {
                    presence.close();
                }
            }

            assertEquals(1, server.queue().listPending("bob").size(), "live delivery does not touch the queue");
        }
    }

    @Test
    void unknownReceiverIsRejected() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "x");

        try (TcpLiveTransport transport = new TcpLiveTransport("alice", new RemoteSignaling(client));
             TransferRouter router = new TransferRouter("alice", "Alice", transport, new RemoteStaging(client),
                     TIMEOUT, TIMEOUT)) {
            assertThrows(NotFoundException.class, () -> router.send("mallory", file));
        }
        assertTrue(server.queue().listAllPending().isEmpty());
    }

    @Test
    void pendingTransfersSurviveRestart() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "persist me");
        String transferId = client.shareOffline("alice", "Alice", "bob", file, "a.txt").transferId();

        server.close();
        server = new DropServer(config, Clock.systemUTC());
        server.start();

        List<TransferRecord> pending = server.queue().listPending("bob");
        assertEquals(1, pending.size());
        assertEquals(transferId, pending.get(0).id());
        assertEquals(2, server.identities().count());
    }
}
